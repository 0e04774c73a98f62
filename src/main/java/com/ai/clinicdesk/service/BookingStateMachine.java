package com.ai.clinicdesk.service;

import com.ai.clinicdesk.component.DateParser;
import com.ai.clinicdesk.component.ReferenceMatcher;
import com.ai.clinicdesk.conversation.BookingStep;
import com.ai.clinicdesk.conversation.ClassificationResult;
import com.ai.clinicdesk.conversation.EntityType;
import com.ai.clinicdesk.conversation.EntityValue;
import com.ai.clinicdesk.dto.BookingDraft;
import com.ai.clinicdesk.dto.BookingTransition;
import com.ai.clinicdesk.dto.BookingTransition.Outcome;
import com.ai.clinicdesk.dto.ReferenceSnapshot;
import com.ai.clinicdesk.utils.PhoneNormalizer;
import com.ai.clinicdesk.utils.TextNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Booking conversation as a pure transition function: (draft, message) to (draft, outcome).
 * Only the field of the current step is read from the message. Invalid input keeps the step
 * and bumps the attempt counter; too many in a row abandons the booking.
 */
@Component
public class BookingStateMachine {

    private static final List<String> CANCEL_WORDS = List.of(
            "cancel", "stop", "quit", "exit", "الغاء", "الغي", "خروج", "توقف", "كنسل");
    private static final List<String> DROP_BOOKING = List.of(
            "لا اريد الحجز", "ما ابي احجز", "ما ابي الحجز", "ما ابغى احجز", "ما ابغى الحجز");
    private static final Set<String> SKIP_WORDS = Set.of(
            "skip", "no", "none", "any", "anything", "no preference", "doesnt matter", "doesn t matter",
            "تخطي", "لا", "اي", "اي شي", "مو مهم", "بدون");
    private static final List<String> SKIP_PHRASES = List.of(
            "skip", "no preference", "تخطي", "لا اريد", "ما ابي", "ما ابغى", "مو مهم", "ما يهم");

    private static final Pattern NAME_PREFIX = Pattern.compile(
            "(?i)^(my name is|name is|i am|i'm|this is|it's|اسمي|انا)\\s+");
    private static final Pattern NAME_SHAPE = Pattern.compile("^\\p{L}[\\p{L}\\p{M} .'-]{1,59}$");
    private static final Set<String> NOT_NAME_WORDS = Set.of(
            "book", "booking", "appointment", "want", "need", "price", "hello", "hi", "help", "doctor",
            "available", "how", "what", "when", "where", "حجز", "موعد", "ابي", "ابغى", "ابغي", "سعر", "كم", "متى", "وين");
    private static final int MAX_NAME_WORDS = 4;

    private final ReferenceMatcher matcher;
    private final DateParser dateParser;
    private final int maxInvalidAttempts;

    public BookingStateMachine(ReferenceMatcher matcher, DateParser dateParser,
                               @Value("${clinicdesk.booking.max-invalid-attempts:3}") int maxInvalidAttempts) {
        this.matcher = matcher;
        this.dateParser = dateParser;
        this.maxInvalidAttempts = maxInvalidAttempts;
    }

    /**
     * New draft at NAME. Doctor, service, branch and date already named in the booking request
     * are kept so their steps are not asked again.
     */
    public BookingDraft start(ClassificationResult request) {
        BookingDraft.BookingDraftBuilder b = BookingDraft.start().toBuilder();
        if (request != null) {
            b.doctorId(request.resolvedId(EntityType.DOCTOR));
            b.serviceId(request.resolvedId(EntityType.SERVICE));
            b.branchId(request.resolvedId(EntityType.BRANCH));
            request.entity(EntityType.DATE).map(EntityValue::getDate)
                    .filter(d -> !d.isBefore(dateParser.today()))
                    .ifPresent(d -> {
                        b.preferredDate(d);
                        request.entity(EntityType.TIME).map(EntityValue::getValue).map(LocalTime::parse).ifPresent(b::preferredTime);
                    });
        }
        return b.build();
    }

    public BookingTransition advance(BookingDraft draft, String text, ReferenceSnapshot snapshot) {
        if (draft.getStep().isTerminal()) {
            throw new IllegalStateException("Booking already finished at " + draft.getStep());
        }
        String normalized = TextNormalizer.normalize(text);
        boolean skipping = draft.getStep().isOptional() && isSkip(normalized)
                && !TextNormalizer.containsAny(normalized, DROP_BOOKING);
        if (!skipping && isCancel(normalized)) {
            return BookingTransition.of(draft.toBuilder().step(BookingStep.CANCELLED).build(), Outcome.CANCELLED);
        }

        switch (draft.getStep()) {
            case NAME:
                return extractName(text)
                        .map(name -> accept(draft.toBuilder().name(name), draft))
                        .orElseGet(() -> reject(draft));
            case PHONE:
                return PhoneNormalizer.extract(normalized)
                        .map(phone -> accept(draft.toBuilder().phone(phone), draft))
                        .orElseGet(() -> reject(draft));
            case SERVICE:
                return chooseReference(draft, normalized, snapshot == null ? null : snapshot.serviceNames(), false,
                        (b, id) -> b.serviceId(id));
            case BRANCH:
                return chooseReference(draft, normalized, snapshot == null ? null : snapshot.branchNames(), true,
                        (b, id) -> b.branchId(id));
            case DATE_TIME:
                return dateTime(draft, normalized);
            default:
                throw new IllegalStateException("Unexpected step " + draft.getStep());
        }
    }

    public boolean isCancel(String normalized) {
        return TextNormalizer.containsAny(normalized, CANCEL_WORDS) || TextNormalizer.containsAny(normalized, DROP_BOOKING);
    }

    /** Declining an optional field is a skip, even when phrased like "I don't want a specific branch". */
    public static boolean isSkip(String normalized) {
        String words = TextNormalizer.words(normalized);
        return SKIP_WORDS.contains(words) || TextNormalizer.containsAny(normalized, SKIP_PHRASES);
    }

    static Optional<String> extractName(String raw) {
        if (raw == null) return Optional.empty();
        String name = NAME_PREFIX.matcher(raw.trim()).replaceFirst("").trim();
        if (!NAME_SHAPE.matcher(name).matches()) return Optional.empty();
        List<String> tokens = TextNormalizer.tokens(TextNormalizer.normalize(name));
        if (tokens.isEmpty() || tokens.size() > MAX_NAME_WORDS) return Optional.empty();
        for (String t : tokens) {
            if (NOT_NAME_WORDS.contains(t)) return Optional.empty();
        }
        return Optional.of(name.replaceAll("\\s+", " "));
    }

    private interface FieldSetter {
        BookingDraft.BookingDraftBuilder set(BookingDraft.BookingDraftBuilder builder, String id);
    }

    private BookingTransition chooseReference(BookingDraft draft, String normalized, Map<String, String> names,
                                              boolean optional, FieldSetter setter) {
        if (optional && isSkip(normalized)) {
            return accept(setter.set(draft.toBuilder(), null), draft);
        }
        if (names == null || names.isEmpty()) {
            return BookingTransition.of(draft, Outcome.INVALID);
        }
        String byNumber = ReferenceMatcher.byNumber(normalized, new ArrayList<>(names.keySet()));
        if (byNumber != null) {
            return accept(setter.set(draft.toBuilder(), byNumber), draft);
        }
        ReferenceMatcher.Match match = matcher.match(normalized, names);
        if (match.isResolved()) {
            return accept(setter.set(draft.toBuilder(), match.id()), draft);
        }
        if (match.isAmbiguous()) {
            return new BookingTransition(draft, Outcome.AMBIGUOUS, match.ids());
        }
        return reject(draft);
    }

    private BookingTransition dateTime(BookingDraft draft, String normalized) {
        if (isSkip(normalized)) {
            return accept(draft.toBuilder().preferredDate(null).preferredTime(null), draft);
        }
        Optional<LocalDate> date = dateParser.parseDate(normalized);
        if (date.isEmpty() || date.get().isBefore(dateParser.today())) {
            return reject(draft);
        }
        LocalTime time = dateParser.parseTime(normalized).orElse(null);
        return accept(draft.toBuilder().preferredDate(date.get()).preferredTime(time), draft);
    }

    private BookingTransition accept(BookingDraft.BookingDraftBuilder updated, BookingDraft before) {
        BookingDraft filled = updated.invalidAttempts(0).build();
        BookingStep next = nextStep(filled, before.getStep());
        BookingDraft result = filled.toBuilder().step(next).build();
        return BookingTransition.of(result, next == BookingStep.DONE ? Outcome.COMPLETED : Outcome.ADVANCED);
    }

    private BookingTransition reject(BookingDraft draft) {
        int attempts = draft.getInvalidAttempts() + 1;
        if (attempts >= maxInvalidAttempts) {
            return BookingTransition.of(draft.toBuilder().invalidAttempts(attempts).step(BookingStep.CANCELLED).build(),
                    Outcome.ABANDONED);
        }
        return BookingTransition.of(draft.toBuilder().invalidAttempts(attempts).build(), Outcome.INVALID);
    }

    /** Steps whose value was already supplied up front are not asked. */
    static BookingStep nextStep(BookingDraft draft, BookingStep current) {
        BookingStep next = current.next();
        while (!next.isTerminal() && alreadyFilled(draft, next)) {
            next = next.next();
        }
        return next;
    }

    private static boolean alreadyFilled(BookingDraft draft, BookingStep step) {
        switch (step) {
            case SERVICE:
                return draft.getServiceId() != null;
            case BRANCH:
                return draft.getBranchId() != null;
            case DATE_TIME:
                return draft.getPreferredDate() != null;
            default:
                return false;
        }
    }
}
