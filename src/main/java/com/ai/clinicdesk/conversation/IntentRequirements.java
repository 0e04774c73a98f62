package com.ai.clinicdesk.conversation;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which entities an intent needs before it can be answered from reference data, and which
 * mentioned entities must resolve for the answer to be correct.
 */
public final class IntentRequirements {

    private IntentRequirements() {
    }

    public static EnumSet<EntityType> required(Intent intent) {
        switch (intent) {
            case AVAILABILITY_QUERY:
                return EnumSet.of(EntityType.DOCTOR);
            case PRICE_QUERY:
                return EnumSet.of(EntityType.SERVICE);
            case INFO_QUERY:
                return EnumSet.of(EntityType.TOPIC);
            default:
                return EnumSet.noneOf(EntityType.class);
        }
    }

    /**
     * Entities that, when mentioned, have to resolve. Availability and price answers are about a
     * specific doctor, service, branch and day, so any of those named but not understood counts.
     * For info queries it depends on the topic: a doctor named in a doctor question matters, a
     * service named in passing does not.
     */
    public static Set<EntityType> relevant(Intent intent, InfoTopic topic) {
        EnumSet<EntityType> out = required(intent);
        switch (intent) {
            case AVAILABILITY_QUERY:
                out.addAll(EnumSet.of(EntityType.DOCTOR, EntityType.SERVICE, EntityType.BRANCH, EntityType.DATE));
                break;
            case PRICE_QUERY:
                out.addAll(EnumSet.of(EntityType.DOCTOR, EntityType.SERVICE, EntityType.BRANCH));
                break;
            case INFO_QUERY:
                if (topic == null) break;
                switch (topic) {
                    case DOCTOR:
                        out.add(EntityType.DOCTOR);
                        out.add(EntityType.BRANCH);
                        break;
                    case SERVICE:
                        out.add(EntityType.SERVICE);
                        break;
                    default:
                        out.add(EntityType.BRANCH);
                        break;
                }
                break;
            default:
                break;
        }
        return out;
    }

    public static InfoTopic topicOf(ClassificationResult result) {
        return result.entity(EntityType.TOPIC)
                .map(EntityValue::getValue)
                .map(v -> {
                    try {
                        return InfoTopic.valueOf(v);
                    } catch (IllegalArgumentException e) {
                        return null;
                    }
                })
                .orElse(null);
    }
}
