package com.ai.clinicdesk.component;

import com.ai.clinicdesk.conversation.ClassificationResult;
import com.ai.clinicdesk.conversation.EntityType;
import com.ai.clinicdesk.conversation.EntityValue;
import com.ai.clinicdesk.conversation.PendingClarification;
import com.ai.clinicdesk.platform.Platform;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Remembers the last clarification question per user so the next message can be read as its
 * answer, and counts how often the same field has been asked.
 */
@Component
public class ClarificationTracker {

    private final Cache<String, PendingClarification> pending;

    public ClarificationTracker(@Value("${clinicdesk.booking.inactivity-timeout:30m}") Duration ttl) {
        this.pending = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(50_000)
                .build();
    }

    public Optional<PendingClarification> pending(Platform platform, String userId) {
        return Optional.ofNullable(pending.getIfPresent(SessionLockRegistry.key(platform, userId)));
    }

    /**
     * Records a clarification question. Keeps the entities already understood (minus the one
     * being asked for) and returns the number of times this field has now been asked in a row.
     */
    public int register(Platform platform, String userId, ClassificationResult result,
                        EntityType field, List<String> optionIds) {
        String key = SessionLockRegistry.key(platform, userId);
        PendingClarification previous = pending.getIfPresent(key);
        int attempts = previous != null && previous.field() == field && previous.intent() == result.getIntent()
                ? previous.attempts() + 1
                : 1;
        Map<EntityType, EntityValue> known = new EnumMap<>(EntityType.class);
        known.putAll(result.getEntities());
        known.remove(field);
        pending.put(key, new PendingClarification(result.getIntent(), field, List.copyOf(optionIds), Map.copyOf(known), attempts));
        return attempts;
    }

    public void clear(Platform platform, String userId) {
        pending.invalidate(SessionLockRegistry.key(platform, userId));
    }
}
