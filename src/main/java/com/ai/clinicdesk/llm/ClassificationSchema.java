package com.ai.clinicdesk.llm;

import com.ai.clinicdesk.conversation.Confidence;
import com.ai.clinicdesk.conversation.EntityType;
import com.ai.clinicdesk.conversation.Intent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * JSON schema sent with classification requests and the validator applied to the answer.
 * Anything outside the schema (unknown keys, wrong types, values outside the enums) is a
 * {@link LlmFailure#SCHEMA_VIOLATION}.
 */
public final class ClassificationSchema {

    static final String NAME = "message_classification";
    private static final Set<String> ROOT_KEYS = Set.of("intent", "confidence", "entities");

    private ClassificationSchema() {
    }

    public static ObjectNode schema(ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", "object");
        root.put("additionalProperties", false);
        ArrayNode required = root.putArray("required");
        ROOT_KEYS.stream().sorted().forEach(required::add);

        ObjectNode props = root.putObject("properties");
        ObjectNode intent = props.putObject("intent");
        intent.put("type", "string");
        ArrayNode intents = intent.putArray("enum");
        for (Intent i : Intent.values()) {
            if (i != Intent.CLARIFICATION_ANSWER) intents.add(i.name());
        }
        ObjectNode confidence = props.putObject("confidence");
        confidence.put("type", "string");
        ArrayNode levels = confidence.putArray("enum");
        for (Confidence c : Confidence.values()) levels.add(c.name());

        ObjectNode entities = props.putObject("entities");
        entities.put("type", "object");
        entities.put("additionalProperties", false);
        ArrayNode entityRequired = entities.putArray("required");
        ObjectNode entityProps = entities.putObject("properties");
        for (EntityType t : EntityType.values()) {
            String key = t.name().toLowerCase(Locale.ROOT);
            entityRequired.add(key);
            ArrayNode type = entityProps.putObject(key).putArray("type");
            type.add("string");
            type.add("null");
        }
        return root;
    }

    public static LlmResult<LlmClassification> parse(ObjectMapper mapper, String content) {
        if (content == null || content.isBlank()) {
            return LlmResult.failure(LlmFailure.EMPTY_RESPONSE, null);
        }
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            return violation("not JSON");
        }
        if (root == null || !root.isObject()) return violation("root is not an object");
        for (Iterator<String> it = root.fieldNames(); it.hasNext(); ) {
            String field = it.next();
            if (!ROOT_KEYS.contains(field)) return violation("unexpected field " + field);
        }

        Intent intent = enumValue(Intent.class, root.get("intent"));
        if (intent == null || intent == Intent.CLARIFICATION_ANSWER) return violation("bad intent");
        Confidence confidence = enumValue(Confidence.class, root.get("confidence"));
        if (confidence == null) return violation("bad confidence");

        JsonNode entitiesNode = root.get("entities");
        if (entitiesNode == null || !entitiesNode.isObject()) return violation("entities is not an object");
        Map<EntityType, String> entities = new EnumMap<>(EntityType.class);
        for (Iterator<Map.Entry<String, JsonNode>> it = entitiesNode.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            EntityType type = enumValue(EntityType.class, e.getKey());
            if (type == null) return violation("unexpected entity " + e.getKey());
            JsonNode v = e.getValue();
            if (v == null || v.isNull()) continue;
            if (!v.isTextual()) return violation("entity " + e.getKey() + " is not a string");
            if (!v.asText().isBlank()) entities.put(type, v.asText().trim());
        }
        return LlmResult.success(new LlmClassification(intent, confidence, entities));
    }

    private static LlmResult<LlmClassification> violation(String detail) {
        return LlmResult.failure(LlmFailure.SCHEMA_VIOLATION, detail);
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, JsonNode node) {
        if (node == null || !node.isTextual()) return null;
        return enumValue(type, node.asText());
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
