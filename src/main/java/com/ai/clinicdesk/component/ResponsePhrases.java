package com.ai.clinicdesk.component;

import com.ai.clinicdesk.conversation.InfoTopic;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * English reply templates. Short, direct register; every method returns the same text for the
 * same input. {@link ArabicResponsePhrases} overrides each one.
 */
@Component
public class ResponsePhrases {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("EEE d MMM yyyy", Locale.ENGLISH);

    // ---- units ----

    public String date(LocalDate date) {
        return DATE.format(date);
    }

    public String dayShort(DayOfWeek day) {
        return day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    public String listSeparator() {
        return ", ";
    }

    public String hoursRange(String from, String to) {
        return " from " + from + " to " + to;
    }

    public String atPlace(String place) {
        return " at " + place;
    }

    public String price(String amount) {
        return amount + " SAR";
    }

    public String topicLabel(InfoTopic topic) {
        switch (topic) {
            case DOCTOR:
                return "Doctors";
            case SERVICE:
                return "Services and prices";
            case BRANCH:
                return "Branches and locations";
            case HOURS:
                return "Opening hours";
            case CONTACT:
            default:
                return "Contact details";
        }
    }

    // ---- greetings ----

    public String greeting() {
        return "Hello! How can I help you today? You can ask about our doctors, services, prices and branches, or book an appointment.";
    }

    public String thanks() {
        return "You're welcome! Anything else I can help with?";
    }

    public String goodbye() {
        return "Take care! Message us anytime.";
    }

    // ---- direct answers ----

    public String doctorProfile(String name, String specialty, String branch, String schedule, Integer experienceYears) {
        StringBuilder sb = new StringBuilder(name);
        if (specialty != null) sb.append(" is our ").append(specialty).append(" specialist");
        if (branch != null) sb.append(" at ").append(branch);
        sb.append(".");
        if (experienceYears != null) sb.append(" ").append(experienceYears).append(" years of experience.");
        if (schedule != null) sb.append(" Usual schedule: ").append(schedule).append(".");
        return sb.toString();
    }

    public String doctorListHeader(String branch) {
        return branch == null ? "Our doctors:" : "Our doctors at " + branch + ":";
    }

    public String noDoctors() {
        return "I don't have any doctors listed there at the moment.";
    }

    public String serviceDetail(String name, String price, Integer durationMinutes, String preparation) {
        StringBuilder sb = new StringBuilder(name).append(": ").append(price).append(".");
        if (durationMinutes != null) sb.append(" Takes about ").append(durationMinutes).append(" minutes.");
        if (preparation != null) sb.append(" Preparation: ").append(preparation).append(".");
        return sb.toString();
    }

    public String serviceListHeader() {
        return "Our services:";
    }

    public String priceOnRequest() {
        return "price on request";
    }

    public String branchInfo(String name, String address, String phone, String hours) {
        StringBuilder sb = new StringBuilder(name);
        if (address != null) sb.append(": ").append(address);
        sb.append(".");
        if (hours != null) sb.append(" Hours: ").append(hours).append(".");
        if (phone != null) sb.append(" Phone: ").append(phone).append(".");
        return sb.toString();
    }

    public String branchListHeader() {
        return "Our branches:";
    }

    public String branchHours(String name, String weekdays, String weekend) {
        StringBuilder sb = new StringBuilder(name).append(" hours: ");
        sb.append("weekdays ").append(weekdays != null ? weekdays : "not listed");
        sb.append(", weekend ").append(weekend != null ? weekend : "closed").append(".");
        return sb.toString();
    }

    public String contact(String name, String phone, String email) {
        StringBuilder sb = new StringBuilder("You can reach ").append(name);
        if (phone != null) sb.append(" on ").append(phone);
        if (email != null) sb.append(phone != null ? " or " : " at ").append(email);
        return sb.append(".").toString();
    }

    public String availableOn(String doctor, String date) {
        return "Yes, " + doctor + " is available on " + date + ".";
    }

    public String notAvailableOn(String doctor, String date) {
        return "No, " + doctor + " is not available on " + date + ".";
    }

    public String availabilityNote(String note) {
        return " Note: " + note;
    }

    public String noConfirmedAvailability(String doctor, String date, String schedule) {
        String base = "I don't have confirmed availability for " + doctor + " on " + date + ".";
        return schedule == null ? base : base + " Their usual schedule is " + schedule + ".";
    }

    // ---- clarification ----

    public String whichDoctor() {
        return "Which doctor do you mean? Reply with the number:";
    }

    public String whichService() {
        return "Which service do you mean? Reply with the number:";
    }

    public String whichBranch() {
        return "Which branch do you mean? Reply with the number:";
    }

    public String whichDate() {
        return "Which day do you mean? (e.g. 'tomorrow', 'Sunday' or '25/10')";
    }

    public String whichTopic() {
        return "What would you like to know about? Reply with the number:";
    }

    public String couldYouRephrase() {
        return "Could you tell me a bit more about what you need?";
    }

    // ---- booking ----

    public String bookingStarted() {
        return "Sure, let's book your appointment.";
    }

    public String askName() {
        return "What's your full name?";
    }

    public String askPhone() {
        return "What's your mobile number? (e.g. 05XXXXXXXX)";
    }

    public String askService() {
        return "Which service would you like? Reply with the number or the name:";
    }

    public String askBranch() {
        return "Which branch do you prefer? Reply with the number, or 'skip':";
    }

    public String askDateTime() {
        return "What date and time suit you? (e.g. 'tomorrow 10am' or '25/10/2026'), or 'skip'.";
    }

    public String invalidName() {
        return "Sorry, I didn't catch a name there.";
    }

    public String invalidPhone() {
        return "That doesn't look like a valid Saudi mobile number.";
    }

    public String invalidChoice() {
        return "Sorry, I couldn't match that to one of the options.";
    }

    public String invalidDate() {
        return "Sorry, I need a date from today onwards.";
    }

    public String confirmCandidates() {
        return "Did you mean one of these? Reply with the number:";
    }

    public String bookingCompleted(String code) {
        return "Your booking request is received. Reference: " + code + ". Our team will contact you to confirm.";
    }

    public String bookingSummary(String name, String phone, String service, String branch, String when) {
        return "Name: " + name + "\nPhone: " + phone + "\nService: " + service
                + "\nBranch: " + (branch != null ? branch : "any")
                + "\nPreferred time: " + (when != null ? when : "any");
    }

    public String bookingCancelled() {
        return "No problem, I've cancelled this booking. Send 'book' anytime to start again.";
    }

    public String bookingAbandoned() {
        return "I couldn't get that after a few tries, so I've stopped this booking. Send 'book' anytime to start again.";
    }

    public String continueBooking() {
        return "Back to your booking:";
    }

    // ---- failures ----

    public String throttleNotice() {
        return "You're sending messages a little too fast. Please wait a minute and try again.";
    }

    public String apology() {
        return "Sorry, something went wrong on our side. Please try again in a moment.";
    }

    public String fallback() {
        return "Sorry, I couldn't answer that right now. You can ask about our doctors, services, prices or branches, or type 'book' to make an appointment.";
    }
}
