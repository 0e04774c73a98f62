package com.ai.clinicdesk.service;

import com.ai.clinicdesk.platform.Platform;
import com.ai.clinicdesk.utils.UserIdMasker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Sliding-window limiter per (platform, user). The first message rejected in a saturated
 * window is flagged so the caller sends exactly one throttle notice; the rest are silent.
 */
@Service
public class MessageRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(MessageRateLimiter.class);

    public enum Decision {
        ALLOWED,
        THROTTLED_NOTIFY,
        THROTTLED_SILENT
    }

    private final int maxMessages;
    private final Duration window;
    private final Clock clock;
    private final Cache<String, UserWindow> windows;

    public MessageRateLimiter(@Value("${clinicdesk.rate-limit.max-messages:10}") int maxMessages,
                              @Value("${clinicdesk.rate-limit.window:60s}") Duration window,
                              Clock clock) {
        this.maxMessages = maxMessages;
        this.window = window;
        this.clock = clock;
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(window.multipliedBy(2))
                .maximumSize(100_000)
                .build();
    }

    public boolean allow(Platform platform, String userId) {
        return check(platform, userId) == Decision.ALLOWED;
    }

    public Decision check(Platform platform, String userId) {
        UserWindow w = windows.get(platform.name() + ":" + userId, k -> new UserWindow());
        Decision decision = w.record(clock.instant(), window, maxMessages);
        if (decision == Decision.THROTTLED_NOTIFY) {
            log.warn("Rate limit exceeded platform={} user={}", platform, UserIdMasker.mask(userId));
        }
        return decision;
    }

    private static class UserWindow {
        private final Deque<Instant> accepted = new ArrayDeque<>();
        private boolean noticeSent;

        synchronized Decision record(Instant now, Duration window, int max) {
            Instant cutoff = now.minus(window);
            while (!accepted.isEmpty() && !accepted.peekFirst().isAfter(cutoff)) {
                accepted.pollFirst();
            }
            if (accepted.size() < max) {
                accepted.addLast(now);
                noticeSent = false;
                return Decision.ALLOWED;
            }
            if (!noticeSent) {
                noticeSent = true;
                return Decision.THROTTLED_NOTIFY;
            }
            return Decision.THROTTLED_SILENT;
        }
    }
}
