package com.ai.clinicdesk.conversation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable outcome of classifying one message: intent, extracted entities, confidence and
 * which stage produced it. {@code explicit} is set when the intent came from keyword rules
 * rather than being inferred from a bare entity mention.
 */
public final class ClassificationResult {

    public enum Source {
        RULES,
        LLM,
        FALLBACK
    }

    private final Intent intent;
    private final Map<EntityType, EntityValue> entities;
    private final Confidence confidence;
    private final Source source;
    private final boolean explicit;

    public ClassificationResult(Intent intent, Map<EntityType, EntityValue> entities,
                                Confidence confidence, Source source, boolean explicit) {
        this.intent = intent;
        EnumMap<EntityType, EntityValue> copy = new EnumMap<>(EntityType.class);
        if (entities != null) copy.putAll(entities);
        this.entities = Collections.unmodifiableMap(copy);
        this.confidence = confidence;
        this.source = source;
        this.explicit = explicit;
    }

    public static ClassificationResult unknown(Source source) {
        return new ClassificationResult(Intent.UNKNOWN, null, Confidence.LOW, source, false);
    }

    public Intent getIntent() {
        return intent;
    }

    public Map<EntityType, EntityValue> getEntities() {
        return entities;
    }

    public Optional<EntityValue> entity(EntityType type) {
        return Optional.ofNullable(entities.get(type));
    }

    public String resolvedId(EntityType type) {
        EntityValue v = entities.get(type);
        return v != null && v.isResolved() ? v.getValue() : null;
    }

    public boolean has(EntityType type) {
        return entities.containsKey(type);
    }

    public Confidence getConfidence() {
        return confidence;
    }

    public Source getSource() {
        return source;
    }

    public boolean isExplicit() {
        return explicit;
    }

    /**
     * Continues an earlier classification with the entities supplied by a clarification answer.
     * New values replace the earlier ones; the earlier intent is kept.
     */
    public ClassificationResult resume(Intent pendingIntent, Map<EntityType, EntityValue> pendingEntities) {
        EnumMap<EntityType, EntityValue> merged = new EnumMap<>(EntityType.class);
        if (pendingEntities != null) merged.putAll(pendingEntities);
        merged.putAll(entities);
        return new ClassificationResult(pendingIntent, merged, Confidence.HIGH, source, true);
    }

    @Override
    public String toString() {
        return "ClassificationResult{" + intent + ", " + confidence + ", " + source + ", " + entities + "}";
    }
}
