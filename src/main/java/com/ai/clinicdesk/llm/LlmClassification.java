package com.ai.clinicdesk.llm;

import com.ai.clinicdesk.conversation.Confidence;
import com.ai.clinicdesk.conversation.EntityType;
import com.ai.clinicdesk.conversation.Intent;

import java.util.Map;

/**
 * Schema-validated classification returned by the model. Entity values are raw mentions
 * and still have to be grounded against reference data.
 */
public record LlmClassification(Intent intent, Confidence confidence, Map<EntityType, String> entities) {
}
