package com.ai.clinicdesk.service;

import com.ai.clinicdesk.platform.Platform;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Drops platform redeliveries. Remembers (platform, message id) pairs in a bounded,
 * expiring store; the first delivery wins and later copies are ignored.
 */
@Service
public class DeduplicationGate {

    private static final Logger log = LoggerFactory.getLogger(DeduplicationGate.class);

    private final Cache<String, Boolean> seen;

    public DeduplicationGate(@Value("${clinicdesk.dedup.max-entries:100000}") long maxEntries,
                             @Value("${clinicdesk.dedup.ttl:24h}") Duration ttl) {
        this.seen = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl)
                .build();
    }

    public boolean seen(Platform platform, String messageId) {
        if (StringUtils.isBlank(messageId)) return false;
        return seen.getIfPresent(key(platform, messageId)) != null;
    }

    public void markSeen(Platform platform, String messageId) {
        if (StringUtils.isBlank(messageId)) return;
        seen.put(key(platform, messageId), Boolean.TRUE);
    }

    /**
     * Atomically checks and marks. Returns true only for the first caller with this pair.
     * Messages without an id always pass.
     */
    public boolean firstDelivery(Platform platform, String messageId) {
        if (StringUtils.isBlank(messageId)) return true;
        boolean first = seen.asMap().putIfAbsent(key(platform, messageId), Boolean.TRUE) == null;
        if (!first) {
            log.debug("Duplicate delivery dropped platform={} messageId={}", platform, messageId);
        }
        return first;
    }

    private static String key(Platform platform, String messageId) {
        return platform.name() + ":" + messageId;
    }
}
