package com.ai.clinicdesk.dto;

import com.ai.clinicdesk.conversation.BookingStep;
import com.ai.clinicdesk.conversation.EntityType;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of routing one message. No text: the formatter renders it.
 * DIRECT carries a topic and payload, CLARIFY the missing field and the options to offer,
 * ESCALATE the context for generation, BOOKING hands the message to the booking flow.
 */
public final class RoutingDecision {

    public enum Type {
        DIRECT,
        CLARIFY,
        ESCALATE,
        BOOKING
    }

    public enum DirectTopic {
        GREETING,
        DOCTOR_PROFILE,
        DOCTOR_LIST,
        SERVICE_DETAIL,
        SERVICE_LIST,
        BRANCH_INFO,
        BRANCH_LIST,
        BRANCH_HOURS,
        CONTACT,
        AVAILABILITY_DAY,
        AVAILABILITY_SCHEDULE
    }

    private final Type type;
    private final DirectTopic topic;
    private final Map<String, Object> payload;
    private final EntityType missingField;
    private final List<String> options;
    private final EscalationContext escalation;
    private final BookingStep resumeStep;

    private RoutingDecision(Type type, DirectTopic topic, Map<String, Object> payload, EntityType missingField,
                            List<String> options, EscalationContext escalation, BookingStep resumeStep) {
        this.type = type;
        this.topic = topic;
        this.payload = payload == null ? Collections.emptyMap() : new HashMap<>(payload);
        this.missingField = missingField;
        this.options = options == null ? List.of() : List.copyOf(options);
        this.escalation = escalation;
        this.resumeStep = resumeStep;
    }

    public static RoutingDecision direct(DirectTopic topic, Map<String, Object> payload) {
        return new RoutingDecision(Type.DIRECT, topic, payload, null, null, null, null);
    }

    public static RoutingDecision clarify(EntityType missingField, List<String> options) {
        return new RoutingDecision(Type.CLARIFY, null, null, missingField, options, null, null);
    }

    public static RoutingDecision escalate(EscalationContext context) {
        return new RoutingDecision(Type.ESCALATE, null, null, null, null, context, null);
    }

    public static RoutingDecision booking() {
        return new RoutingDecision(Type.BOOKING, null, null, null, null, null, null);
    }

    /** Same decision, with the pending booking prompt appended after the answer. */
    public RoutingDecision resumingBooking(BookingStep step) {
        return new RoutingDecision(type, topic, payload, missingField, options, escalation, step);
    }

    public Type getType() {
        return type;
    }

    public DirectTopic getTopic() {
        return topic;
    }

    public Map<String, Object> getPayload() {
        return Collections.unmodifiableMap(payload);
    }

    public String getString(String key) {
        Object v = payload.get(key);
        return v == null ? null : v.toString();
    }

    public EntityType getMissingField() {
        return missingField;
    }

    public List<String> getOptions() {
        return options;
    }

    public EscalationContext getEscalation() {
        return escalation;
    }

    public BookingStep getResumeStep() {
        return resumeStep;
    }

    @Override
    public String toString() {
        switch (type) {
            case DIRECT:
                return "DIRECT{" + topic + ", " + payload + "}";
            case CLARIFY:
                return "CLARIFY{" + missingField + ", options=" + options + "}";
            case ESCALATE:
                return "ESCALATE{" + (escalation != null ? escalation.reason() : null) + "}";
            default:
                return type.name();
        }
    }
}
