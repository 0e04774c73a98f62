package com.ai.clinicdesk.component;

import com.ai.clinicdesk.platform.Platform;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SessionLockRegistryTest {

    private final SessionLockRegistry registry = new SessionLockRegistry();

    @Test
    @DisplayName("Should run work for the same user one at a time")
    void shouldSerializeSameUser() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Future<Integer>> futures = new ArrayList<>();

        for (int i = 0; i < 16; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                return registry.withLock(Platform.WHATSAPP, "same-user", () -> {
                    int now = inside.incrementAndGet();
                    maxInside.accumulateAndGet(now, Math::max);
                    try {
                        Thread.sleep(2);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    inside.decrementAndGet();
                    return now;
                });
            }));
        }
        start.countDown();
        for (Future<Integer> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should key locks by platform and user")
    void shouldBuildKey() {
        assertThat(SessionLockRegistry.key(Platform.INSTAGRAM, "42")).isEqualTo("INSTAGRAM:42");
    }
}
