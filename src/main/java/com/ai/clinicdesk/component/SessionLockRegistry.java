package com.ai.clinicdesk.component;

import com.ai.clinicdesk.platform.Platform;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per (platform, user). Messages from the same user are processed one at a time;
 * different users never contend. Locks are weakly held and vanish once no thread uses them.
 */
@Component
public class SessionLockRegistry {

    private final Cache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build();

    public <T> T withLock(Platform platform, String userId, Supplier<T> work) {
        ReentrantLock lock = locks.get(key(platform, userId), k -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    public static String key(Platform platform, String userId) {
        return platform.name() + ":" + userId;
    }
}
