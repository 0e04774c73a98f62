package com.ai.clinicdesk.conversation;

import java.util.List;
import java.util.Map;

/**
 * Clarification question awaiting an answer: the intent it belongs to, the field asked for,
 * the option ids offered (in the order they were listed) and how many times the field was asked.
 */
public record PendingClarification(Intent intent,
                                   EntityType field,
                                   List<String> optionIds,
                                   Map<EntityType, EntityValue> entities,
                                   int attempts) {
}
