package com.ai.clinicdesk.service;

import com.ai.clinicdesk.component.ArabicResponsePhrases;
import com.ai.clinicdesk.component.ResponsePhrases;
import com.ai.clinicdesk.conversation.BookingStep;
import com.ai.clinicdesk.conversation.EntityType;
import com.ai.clinicdesk.conversation.GreetingKind;
import com.ai.clinicdesk.conversation.InfoTopic;
import com.ai.clinicdesk.conversation.ReplyLanguage;
import com.ai.clinicdesk.dto.BookingDraft;
import com.ai.clinicdesk.dto.BookingTransition;
import com.ai.clinicdesk.dto.ReferenceSnapshot;
import com.ai.clinicdesk.dto.ReferenceSnapshot.BranchInfo;
import com.ai.clinicdesk.dto.ReferenceSnapshot.DoctorInfo;
import com.ai.clinicdesk.dto.ReferenceSnapshot.ServiceInfo;
import com.ai.clinicdesk.dto.RoutingDecision;
import com.ai.clinicdesk.llm.LlmResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Turns decisions and booking transitions into reply text.
 * No routing logic here, only type + payload to sentences. Same input and language, same bytes.
 * Calls without a {@link ReplyLanguage} answer in English.
 */
@Service
public class ReplyFormatter {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm", Locale.ENGLISH);
    private static final List<DayOfWeek> CLINIC_WEEK = List.of(
            DayOfWeek.SUNDAY, DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY,
            DayOfWeek.THURSDAY, DayOfWeek.FRIDAY, DayOfWeek.SATURDAY);

    private static final Pattern CONTROL = Pattern.compile("[\\p{Cc}&&[^\\n]]");
    private static final Pattern BLANK_RUN = Pattern.compile("\\n\\s*\\n(\\s*\\n)+");
    private static final Pattern SPACE_RUN = Pattern.compile("[ \\t\\x0B\\f]{2,}");

    private final Map<ReplyLanguage, ResponsePhrases> phrases = new EnumMap<>(ReplyLanguage.class);
    private final int maxLength;

    public ReplyFormatter(ResponsePhrases phrases, @Value("${clinicdesk.reply.max-length:1000}") int maxLength) {
        this.phrases.put(ReplyLanguage.ENGLISH, phrases);
        this.phrases.put(ReplyLanguage.ARABIC, new ArabicResponsePhrases());
        this.maxLength = maxLength;
    }

    public String format(RoutingDecision decision, ReferenceSnapshot snapshot) {
        return format(decision, snapshot, ReplyLanguage.ENGLISH);
    }

    /** DIRECT and CLARIFY replies, with the pending booking prompt appended when the decision carries one. */
    public String format(RoutingDecision decision, ReferenceSnapshot snapshot, ReplyLanguage language) {
        ResponsePhrases p = phrases(language);
        String text;
        switch (decision.getType()) {
            case DIRECT:
                text = direct(p, decision, snapshot);
                break;
            case CLARIFY:
                text = clarify(p, decision.getMissingField(), decision.getOptions(), snapshot);
                break;
            default:
                text = p.fallback();
        }
        if (decision.getResumeStep() != null && !decision.getResumeStep().isTerminal()) {
            text = text + "\n\n" + p.continueBooking() + " " + prompt(p, decision.getResumeStep(), snapshot);
        }
        return text;
    }

    public String formatBooking(BookingTransition transition, String reservationCode, ReferenceSnapshot snapshot) {
        return formatBooking(transition, reservationCode, snapshot, ReplyLanguage.ENGLISH);
    }

    public String formatBooking(BookingTransition transition, String reservationCode, ReferenceSnapshot snapshot,
                                ReplyLanguage language) {
        ResponsePhrases p = phrases(language);
        BookingDraft draft = transition.draft();
        switch (transition.outcome()) {
            case STARTED:
                return p.bookingStarted() + " " + prompt(p, draft.getStep(), snapshot);
            case ADVANCED:
                return prompt(p, draft.getStep(), snapshot);
            case INVALID:
                return invalidHint(p, draft.getStep()) + " " + prompt(p, draft.getStep(), snapshot);
            case AMBIGUOUS:
                return p.confirmCandidates() + "\n" + candidates(p, draft.getStep(), transition.candidates(), snapshot);
            case COMPLETED:
                return p.bookingCompleted(reservationCode) + "\n" + summary(p, draft, snapshot);
            case CANCELLED:
                return p.bookingCancelled();
            case ABANDONED:
            default:
                return p.bookingAbandoned();
        }
    }

    public String prompt(BookingStep step, ReferenceSnapshot snapshot) {
        return prompt(phrases(ReplyLanguage.ENGLISH), step, snapshot);
    }

    public String escalated(LlmResult<String> generated) {
        return escalated(generated, ReplyLanguage.ENGLISH);
    }

    /**
     * Generated text is passed through only after trimming, removing control characters, collapsing
     * blank runs and capping the length at a word boundary. Empty or failed output gets the fallback.
     */
    public String escalated(LlmResult<String> generated, ReplyLanguage language) {
        if (generated == null || !generated.isSuccess()) {
            return phrases(language).fallback();
        }
        String text = sanitize(generated.getValue());
        return text.isEmpty() ? phrases(language).fallback() : text;
    }

    public String throttleNotice() {
        return throttleNotice(ReplyLanguage.ENGLISH);
    }

    public String throttleNotice(ReplyLanguage language) {
        return phrases(language).throttleNotice();
    }

    public String apology() {
        return apology(ReplyLanguage.ENGLISH);
    }

    public String apology(ReplyLanguage language) {
        return phrases(language).apology();
    }

    String sanitize(String raw) {
        if (raw == null) return "";
        String text = raw.replace("\r\n", "\n").replace('\r', '\n');
        text = CONTROL.matcher(text).replaceAll("");
        text = BLANK_RUN.matcher(text).replaceAll("\n\n");
        text = SPACE_RUN.matcher(text).replaceAll(" ");
        text = text.trim();
        if (text.length() <= maxLength) return text;
        String cut = text.substring(0, maxLength);
        int boundary = Math.max(cut.lastIndexOf(' '), cut.lastIndexOf('\n'));
        if (boundary > maxLength / 2) {
            cut = cut.substring(0, boundary);
        }
        return cut.trim();
    }

    private ResponsePhrases phrases(ReplyLanguage language) {
        return phrases.get(language == null ? ReplyLanguage.ENGLISH : language);
    }

    private String prompt(ResponsePhrases p, BookingStep step, ReferenceSnapshot snapshot) {
        switch (step) {
            case NAME:
                return p.askName();
            case PHONE:
                return p.askPhone();
            case SERVICE:
                return p.askService() + serviceOptions(p, snapshot);
            case BRANCH:
                return p.askBranch() + branchOptions(snapshot);
            case DATE_TIME:
                return p.askDateTime();
            default:
                return "";
        }
    }

    // ---- direct ----

    private String direct(ResponsePhrases p, RoutingDecision decision, ReferenceSnapshot snapshot) {
        switch (decision.getTopic()) {
            case GREETING:
                return greeting(p, decision.getString("kind"));
            case DOCTOR_PROFILE:
                return snapshot.doctor(decision.getString("doctorId"))
                        .map(d -> p.doctorProfile(d.name(), d.specialty(), branchName(d.branchId(), snapshot),
                                schedule(p, d, null), d.experienceYears()))
                        .orElseGet(p::fallback);
            case DOCTOR_LIST:
                return doctorList(p, decision.getString("branchId"), snapshot);
            case SERVICE_DETAIL:
                return snapshot.service(decision.getString("serviceId"))
                        .map(s -> p.serviceDetail(s.name(), price(p, s), s.durationMinutes(), s.preparationRequired()))
                        .orElseGet(p::fallback);
            case SERVICE_LIST:
                return p.serviceListHeader() + serviceOptions(p, snapshot);
            case BRANCH_INFO:
                return snapshot.branch(decision.getString("branchId"))
                        .map(b -> p.branchInfo(b.name(), address(p, b), b.phone(), b.hoursWeekdays()))
                        .orElseGet(p::fallback);
            case BRANCH_LIST:
                return p.branchListHeader() + branchOptions(snapshot);
            case BRANCH_HOURS:
                return eachBranch(p, decision.getString("branchId"), snapshot,
                        b -> p.branchHours(b.name(), b.hoursWeekdays(), b.hoursWeekend()));
            case CONTACT:
                return eachBranch(p, decision.getString("branchId"), snapshot,
                        b -> p.contact(b.name(), b.phone(), b.email()));
            case AVAILABILITY_DAY:
                return availabilityDay(p, decision, snapshot);
            case AVAILABILITY_SCHEDULE:
                return availabilitySchedule(p, decision, snapshot);
            default:
                return p.fallback();
        }
    }

    private static String greeting(ResponsePhrases p, String kind) {
        if (GreetingKind.THANKS.name().equals(kind)) return p.thanks();
        if (GreetingKind.GOODBYE.name().equals(kind)) return p.goodbye();
        return p.greeting();
    }

    private String doctorList(ResponsePhrases p, String branchId, ReferenceSnapshot snapshot) {
        List<String> lines = new ArrayList<>();
        for (DoctorInfo d : snapshot.doctors()) {
            if (branchId != null && !branchId.equals(d.branchId())) continue;
            List<String> detail = new ArrayList<>();
            if (d.specialty() != null) detail.add(d.specialty());
            if (branchId == null && d.branchId() != null) detail.add(branchName(d.branchId(), snapshot));
            lines.add(detail.isEmpty() ? d.name() : d.name() + " (" + String.join(p.listSeparator(), detail) + ")");
        }
        if (lines.isEmpty()) return p.noDoctors();
        return p.doctorListHeader(branchId == null ? null : branchName(branchId, snapshot)) + "\n" + bullets(lines);
    }

    private String eachBranch(ResponsePhrases p, String branchId, ReferenceSnapshot snapshot,
                              Function<BranchInfo, String> line) {
        if (branchId != null) {
            return snapshot.branch(branchId).map(line).orElseGet(p::fallback);
        }
        List<String> lines = new ArrayList<>();
        for (BranchInfo b : snapshot.branches()) {
            lines.add(line.apply(b));
        }
        return lines.isEmpty() ? p.fallback() : String.join("\n", lines);
    }

    private String availabilityDay(ResponsePhrases p, RoutingDecision decision, ReferenceSnapshot snapshot) {
        String doctor = doctorName(decision.getString("doctorId"), snapshot);
        String date = formatDate(p, decision.getString("date"));
        boolean available = Boolean.parseBoolean(decision.getString("available"));
        String text = available ? p.availableOn(doctor, date) : p.notAvailableOn(doctor, date);
        String note = decision.getString("note");
        return StringUtils.isBlank(note) ? text : text + p.availabilityNote(note);
    }

    private String availabilitySchedule(ResponsePhrases p, RoutingDecision decision, ReferenceSnapshot snapshot) {
        String doctorId = decision.getString("doctorId");
        String date = formatDate(p, decision.getString("date"));
        return snapshot.doctor(doctorId)
                .map(d -> p.noConfirmedAvailability(d.name(), date, schedule(p, d, snapshot)))
                .orElseGet(() -> p.noConfirmedAvailability(doctorId, date, null));
    }

    // ---- clarify ----

    private String clarify(ResponsePhrases p, EntityType field, List<String> options, ReferenceSnapshot snapshot) {
        String question;
        switch (field) {
            case DOCTOR:
                question = p.whichDoctor();
                break;
            case SERVICE:
                question = p.whichService();
                break;
            case BRANCH:
                question = p.whichBranch();
                break;
            case TOPIC:
                question = p.whichTopic();
                break;
            case DATE:
                // a date is answered in free text, there is nothing to number
                return p.whichDate();
            default:
                return p.couldYouRephrase();
        }
        if (options.isEmpty()) return p.couldYouRephrase();
        return question + "\n" + numbered(options, id -> optionLabel(p, field, id, snapshot));
    }

    private String optionLabel(ResponsePhrases p, EntityType field, String id, ReferenceSnapshot snapshot) {
        if (field == EntityType.TOPIC) {
            try {
                return p.topicLabel(InfoTopic.valueOf(id));
            } catch (IllegalArgumentException e) {
                return id;
            }
        }
        if (snapshot == null) return id;
        switch (field) {
            case DOCTOR:
                return snapshot.doctor(id).map(d -> d.specialty() == null ? d.name() : d.name() + " (" + d.specialty() + ")").orElse(id);
            case SERVICE:
                return snapshot.service(id).map(ServiceInfo::name).orElse(id);
            case BRANCH:
                return snapshot.branch(id).map(b -> b.city() == null ? b.name() : b.name() + " (" + b.city() + ")").orElse(id);
            default:
                return id;
        }
    }

    // ---- booking ----

    private static String invalidHint(ResponsePhrases p, BookingStep step) {
        switch (step) {
            case NAME:
                return p.invalidName();
            case PHONE:
                return p.invalidPhone();
            case DATE_TIME:
                return p.invalidDate();
            default:
                return p.invalidChoice();
        }
    }

    /** Candidates keep their number from the full option list, which is what a numeric answer is matched against. */
    private String candidates(ResponsePhrases p, BookingStep step, List<String> ids, ReferenceSnapshot snapshot) {
        EntityType field = step == BookingStep.BRANCH ? EntityType.BRANCH : EntityType.SERVICE;
        List<String> all = snapshot == null ? ids
                : new ArrayList<>(field == EntityType.BRANCH ? snapshot.branchNames().keySet() : snapshot.serviceNames().keySet());
        StringBuilder sb = new StringBuilder();
        for (String id : ids) {
            if (sb.length() > 0) sb.append("\n");
            sb.append(all.indexOf(id) + 1).append(". ").append(optionLabel(p, field, id, snapshot));
        }
        return sb.toString();
    }

    private String summary(ResponsePhrases p, BookingDraft draft, ReferenceSnapshot snapshot) {
        String service = snapshot == null ? draft.getServiceId()
                : snapshot.service(draft.getServiceId()).map(ServiceInfo::name).orElse(draft.getServiceId());
        String branch = draft.getBranchId() == null ? null : branchName(draft.getBranchId(), snapshot);
        String when = null;
        if (draft.getPreferredDate() != null) {
            when = p.date(draft.getPreferredDate());
            LocalTime time = draft.getPreferredTime();
            if (time != null) when = when + " " + TIME.format(time);
        }
        return p.bookingSummary(draft.getName(), draft.getPhone(), service, branch, when);
    }

    private String serviceOptions(ResponsePhrases p, ReferenceSnapshot snapshot) {
        if (snapshot == null) return "";
        List<String> lines = new ArrayList<>();
        for (ServiceInfo s : snapshot.services()) {
            lines.add(s.name() + " (" + price(p, s) + ")");
        }
        return "\n" + numberedLines(lines);
    }

    private static String branchOptions(ReferenceSnapshot snapshot) {
        if (snapshot == null) return "";
        List<String> lines = new ArrayList<>();
        for (BranchInfo b : snapshot.branches()) {
            lines.add(b.city() == null ? b.name() : b.name() + " (" + b.city() + ")");
        }
        return "\n" + numberedLines(lines);
    }

    // ---- helpers ----

    private static String price(ResponsePhrases p, ServiceInfo s) {
        if (s.priceSar() != null) return p.price(s.priceSar().stripTrailingZeros().toPlainString());
        if (s.priceRange() != null) return p.price(s.priceRange());
        return p.priceOnRequest();
    }

    private static String address(ResponsePhrases p, BranchInfo b) {
        if (b.address() == null) return b.city();
        return b.city() == null ? b.address() : b.address() + p.listSeparator() + b.city();
    }

    private static String schedule(ResponsePhrases p, DoctorInfo d, ReferenceSnapshot snapshot) {
        Set<DayOfWeek> days = d.days();
        if (days == null || days.isEmpty()) return null;
        List<String> names = new ArrayList<>();
        for (DayOfWeek day : CLINIC_WEEK) {
            if (days.contains(day)) names.add(p.dayShort(day));
        }
        StringBuilder sb = new StringBuilder(String.join(p.listSeparator(), names));
        if (d.timeFrom() != null && d.timeTo() != null) {
            sb.append(p.hoursRange(d.timeFrom(), d.timeTo()));
        }
        if (snapshot != null) {
            snapshot.branch(d.branchId()).ifPresent(b -> sb.append(p.atPlace(b.name())));
        }
        return sb.toString();
    }

    private static String branchName(String branchId, ReferenceSnapshot snapshot) {
        if (branchId == null) return null;
        if (snapshot == null) return branchId;
        return snapshot.branch(branchId).map(BranchInfo::name).orElse(branchId);
    }

    private static String doctorName(String doctorId, ReferenceSnapshot snapshot) {
        return snapshot.doctor(doctorId).map(DoctorInfo::name).orElse(doctorId);
    }

    private static String formatDate(ResponsePhrases p, String iso) {
        if (iso == null) return "";
        return p.date(LocalDate.parse(iso));
    }

    private static String numbered(List<String> ids, Function<String, String> label) {
        List<String> lines = new ArrayList<>(ids.size());
        for (String id : ids) {
            lines.add(label.apply(id));
        }
        return numberedLines(lines);
    }

    private static String numberedLines(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) sb.append("\n");
            sb.append(i + 1).append(". ").append(lines.get(i));
        }
        return sb.toString();
    }

    private static String bullets(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) sb.append("\n");
            sb.append("- ").append(lines.get(i));
        }
        return sb.toString();
    }
}
