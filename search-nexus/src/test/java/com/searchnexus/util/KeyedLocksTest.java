package com.searchnexus.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class KeyedLocksTest {

    private final KeyedLocks locks = new KeyedLocks();

    @Test
    void lockIsHeldOnlyWhileActionRuns() {
        boolean heldInside = locks.withLock("node-1", () -> locks.isLocked("node-1"));

        assertThat(heldInside).isTrue();
        assertThat(locks.isLocked("node-1")).isFalse();
    }

    @Test
    void releasedKeysAreForgotten() {
        locks.withLock("node-1", () -> locks.withLocks(List.of("node-2", "node-3"), () -> null));
        for (int i = 0; i < 100; i++) {
            locks.withLock("rejected-" + i, () -> null);
        }

        assertThat(locks.size()).isZero();
    }

    @Test
    void entryStaysWhileHeld() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            Future<Object> holder = pool.submit(() -> locks.withLock("node-1", () -> {
                entered.countDown();
                awaitQuietly(release);
                return null;
            }));
            entered.await(5, TimeUnit.SECONDS);

            assertThat(locks.isLocked("node-1")).isTrue();
            assertThat(locks.size()).isEqualTo(1);
            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }

        assertThat(locks.size()).isZero();
    }

    @Test
    void duplicateAndNullKeysAreTolerated() {
        String result = locks.withLocks(Arrays.asList("a", null, "a"), () -> "done");

        assertThat(result).isEqualTo("done");
        assertThat(locks.isLocked("a")).isFalse();
    }

    @Test
    void sameKeyIsMutuallyExclusive() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(pool.submit(() -> {
                    go.await();
                    return locks.withLock("node-1", () -> {
                        maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
                        sleepQuietly();
                        active.decrementAndGet();
                        return null;
                    });
                }));
            }
            go.countDown();
            for (Future<Object> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxActive.get()).isEqualTo(1);
    }

    @Test
    void overlappingKeySetsDoNotDeadlock() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<String> first = pool.submit(() -> locks.withLocks(List.of("a", "b"), () -> {
                sleepQuietly();
                return "ab";
            }));
            Future<String> second = pool.submit(() -> locks.withLocks(List.of("b", "a"), () -> {
                sleepQuietly();
                return "ba";
            }));

            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("ab");
            assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("ba");
        } finally {
            pool.shutdownNow();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepQuietly() {
        try {
            Thread.sleep(20);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
