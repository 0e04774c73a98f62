package com.ai.clinicdesk.service;

import com.ai.clinicdesk.conversation.ClassificationResult;
import com.ai.clinicdesk.conversation.Confidence;
import com.ai.clinicdesk.conversation.EntityType;
import com.ai.clinicdesk.conversation.EntityValue;
import com.ai.clinicdesk.conversation.GreetingKind;
import com.ai.clinicdesk.conversation.InfoTopic;
import com.ai.clinicdesk.conversation.Intent;
import com.ai.clinicdesk.conversation.IntentRequirements;
import com.ai.clinicdesk.conversation.PendingClarification;
import com.ai.clinicdesk.dto.EscalationContext;
import com.ai.clinicdesk.dto.EscalationContext.Reason;
import com.ai.clinicdesk.dto.ReferenceSnapshot;
import com.ai.clinicdesk.dto.RoutingDecision;
import com.ai.clinicdesk.dto.RoutingDecision.DirectTopic;
import com.ai.clinicdesk.entity.BookingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decision table, first match wins:
 * <ol>
 *   <li>open booking session, or a new booking request: hand to the booking flow
 *       (an explicit side question is answered first and the booking prompt repeated)</li>
 *   <li>all required entities resolve: DIRECT</li>
 *   <li>exactly one required or mentioned entity unresolved: CLARIFY</li>
 *   <li>anything else: ESCALATE</li>
 * </ol>
 */
@Service
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private static final Set<Intent> SIDE_QUESTIONS =
            EnumSet.of(Intent.AVAILABILITY_QUERY, Intent.PRICE_QUERY, Intent.INFO_QUERY);

    private final Clock clock;
    private final int maxClarifications;

    public MessageRouter(Clock clock, @Value("${clinicdesk.router.max-clarifications:2}") int maxClarifications) {
        this.clock = clock;
        this.maxClarifications = maxClarifications;
    }

    /**
     * @param result  classification, already merged with the pending clarification when it answered one
     * @param session active booking session, or null
     * @param pending clarification awaiting an answer, or null
     */
    public RoutingDecision route(ClassificationResult result, ReferenceSnapshot snapshot,
                                 BookingSession session, PendingClarification pending) {
        RoutingDecision decision = decideWithSession(result, snapshot, session, pending);
        log.debug("Routed {} -> {}", result, decision);
        return decision;
    }

    private RoutingDecision decideWithSession(ClassificationResult result, ReferenceSnapshot snapshot,
                                              BookingSession session, PendingClarification pending) {
        if (session != null && session.isActive()) {
            if (isSideQuestion(result)) {
                RoutingDecision answer = decide(result, snapshot, null);
                if (answer.getType() == RoutingDecision.Type.DIRECT) {
                    return answer.resumingBooking(session.getStep());
                }
            }
            return RoutingDecision.booking();
        }
        if (result.getIntent() == Intent.BOOKING_REQUEST) {
            return RoutingDecision.booking();
        }
        return decide(result, snapshot, pending);
    }

    private static boolean isSideQuestion(ClassificationResult result) {
        return result.isExplicit()
                && result.getSource() == ClassificationResult.Source.RULES
                && SIDE_QUESTIONS.contains(result.getIntent());
    }

    RoutingDecision decide(ClassificationResult result, ReferenceSnapshot snapshot, PendingClarification pending) {
        Intent intent = result.getIntent();
        if (intent == Intent.UNKNOWN || intent == Intent.CLARIFICATION_ANSWER) {
            return escalate(Reason.UNKNOWN_INTENT, result, List.of());
        }
        if (result.getConfidence() == Confidence.LOW) {
            return escalate(Reason.LOW_CONFIDENCE, result, List.of());
        }
        if (intent == Intent.GREETING) {
            String kind = result.entity(EntityType.TOPIC).map(EntityValue::getValue).orElse(GreetingKind.HELLO.name());
            return RoutingDecision.direct(DirectTopic.GREETING, Map.of("kind", kind));
        }
        if (snapshot == null) {
            return escalate(Reason.REFERENCE_DATA_UNAVAILABLE, result, List.of());
        }

        InfoTopic topic = IntentRequirements.topicOf(result);
        Set<EntityType> required = IntentRequirements.required(intent);
        List<EntityType> unresolved = new ArrayList<>();
        for (EntityType type : IntentRequirements.relevant(intent, topic)) {
            EntityValue value = result.getEntities().get(type);
            boolean missing = value == null && required.contains(type);
            boolean failed = value != null && !value.isResolved();
            if (missing || failed) unresolved.add(type);
        }

        if (unresolved.isEmpty()) {
            return direct(intent, topic, result, snapshot);
        }
        if (unresolved.size() == 1) {
            EntityType field = unresolved.get(0);
            if (pending != null && pending.field() == field && pending.attempts() >= maxClarifications) {
                return escalate(Reason.REPEATED_CLARIFICATION, result, List.of(field.name()));
            }
            return RoutingDecision.clarify(field, options(field, result, snapshot));
        }
        List<String> fields = unresolved.stream().map(Enum::name).toList();
        return escalate(Reason.MULTIPLE_UNRESOLVED, result, fields);
    }

    private RoutingDecision direct(Intent intent, InfoTopic topic, ClassificationResult result, ReferenceSnapshot snapshot) {
        Map<String, Object> payload = new HashMap<>();
        String doctorId = result.resolvedId(EntityType.DOCTOR);
        String serviceId = result.resolvedId(EntityType.SERVICE);
        String branchId = result.resolvedId(EntityType.BRANCH);

        switch (intent) {
            case AVAILABILITY_QUERY: {
                LocalDate date = result.entity(EntityType.DATE)
                        .map(EntityValue::getDate)
                        .orElse(LocalDate.now(clock));
                payload.put("doctorId", doctorId);
                payload.put("date", date.toString());
                return snapshot.availability(date, doctorId)
                        .map(row -> {
                            payload.put("available", row.available());
                            payload.put("note", row.note());
                            return RoutingDecision.direct(DirectTopic.AVAILABILITY_DAY, payload);
                        })
                        .orElseGet(() -> RoutingDecision.direct(DirectTopic.AVAILABILITY_SCHEDULE, payload));
            }
            case PRICE_QUERY:
                payload.put("serviceId", serviceId);
                return RoutingDecision.direct(DirectTopic.SERVICE_DETAIL, payload);
            case INFO_QUERY:
                return info(topic, doctorId, serviceId, branchId, payload);
            default:
                return escalate(Reason.UNKNOWN_INTENT, result, List.of());
        }
    }

    private static RoutingDecision info(InfoTopic topic, String doctorId, String serviceId, String branchId,
                                        Map<String, Object> payload) {
        switch (topic) {
            case DOCTOR:
                if (doctorId != null) {
                    payload.put("doctorId", doctorId);
                    return RoutingDecision.direct(DirectTopic.DOCTOR_PROFILE, payload);
                }
                payload.put("branchId", branchId);
                return RoutingDecision.direct(DirectTopic.DOCTOR_LIST, payload);
            case SERVICE:
                if (serviceId != null) {
                    payload.put("serviceId", serviceId);
                    return RoutingDecision.direct(DirectTopic.SERVICE_DETAIL, payload);
                }
                return RoutingDecision.direct(DirectTopic.SERVICE_LIST, payload);
            case BRANCH:
                if (branchId != null) {
                    payload.put("branchId", branchId);
                    return RoutingDecision.direct(DirectTopic.BRANCH_INFO, payload);
                }
                return RoutingDecision.direct(DirectTopic.BRANCH_LIST, payload);
            case HOURS:
                payload.put("branchId", branchId);
                return RoutingDecision.direct(DirectTopic.BRANCH_HOURS, payload);
            case CONTACT:
            default:
                payload.put("branchId", branchId);
                return RoutingDecision.direct(DirectTopic.CONTACT, payload);
        }
    }

    private static List<String> options(EntityType field, ClassificationResult result, ReferenceSnapshot snapshot) {
        EntityValue value = result.getEntities().get(field);
        if (value != null && value.isAmbiguous()) {
            return value.getCandidates();
        }
        switch (field) {
            case DOCTOR:
                return new ArrayList<>(snapshot.doctorNames().keySet());
            case SERVICE:
                return new ArrayList<>(snapshot.serviceNames().keySet());
            case BRANCH:
                return new ArrayList<>(snapshot.branchNames().keySet());
            case TOPIC:
                return Arrays.stream(InfoTopic.values()).map(Enum::name).toList();
            default:
                return List.of();
        }
    }

    private static RoutingDecision escalate(Reason reason, ClassificationResult result, List<String> fields) {
        return RoutingDecision.escalate(new EscalationContext(reason, null, result.getIntent(), fields, List.of(), null));
    }
}
