package com.yuzhi.sqlguard.platform.service.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ExpiringCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @Test
    void valueIsReusedUntilTtlElapses() {
        ExpiringCache<String, Integer> cache = new ExpiringCache<>(Duration.ofSeconds(300), clock);
        AtomicInteger loads = new AtomicInteger();

        assertThat(cache.get("k", k -> loads.incrementAndGet())).isEqualTo(1);
        clock.advance(Duration.ofSeconds(299));
        assertThat(cache.get("k", k -> loads.incrementAndGet())).isEqualTo(1);
        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("k", k -> loads.incrementAndGet())).isEqualTo(2);
    }

    @Test
    void zeroTtlDisablesCaching() {
        ExpiringCache<String, Integer> cache = new ExpiringCache<>(Duration.ZERO, clock);
        AtomicInteger loads = new AtomicInteger();

        cache.get("k", k -> loads.incrementAndGet());
        cache.get("k", k -> loads.incrementAndGet());
        cache.put("k", 42);

        assertThat(loads.get()).isEqualTo(2);
        assertThat(cache.size()).isZero();
    }

    @Test
    void failedLoadIsNotCached() {
        ExpiringCache<String, Integer> cache = new ExpiringCache<>(Duration.ofMinutes(5), clock);

        assertThatThrownBy(() -> cache.get("k", k -> {
                throw new IllegalStateException("db down");
            }))
            .isInstanceOf(IllegalStateException.class);
        assertThat(cache.size()).isZero();
        assertThat(cache.get("k", k -> 7)).isEqualTo(7);
    }

    @Test
    void invalidationForcesReload() {
        ExpiringCache<String, Integer> cache = new ExpiringCache<>(Duration.ofMinutes(5), clock);
        AtomicInteger loads = new AtomicInteger();

        cache.get("a", k -> loads.incrementAndGet());
        cache.get("b", k -> loads.incrementAndGet());
        cache.invalidate("a");
        cache.get("a", k -> loads.incrementAndGet());
        cache.get("b", k -> loads.incrementAndGet());
        assertThat(loads.get()).isEqualTo(3);

        cache.invalidateAll();
        assertThat(cache.size()).isZero();
    }

    @Test
    void concurrentCallersLoadAKeyOnce() throws Exception {
        ExpiringCache<String, Integer> cache = new ExpiringCache<>(Duration.ofMinutes(5), clock);
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                results.add(
                    pool.submit(() -> {
                        start.await();
                        return cache.get("shared", k -> {
                            sleepQuietly();
                            return loads.incrementAndGet();
                        });
                    })
                );
            }
            start.countDown();
            for (Future<Integer> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo(1);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(loads.get()).isEqualTo(1);
    }

    private static void sleepQuietly() {
        try {
            Thread.sleep(20);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
