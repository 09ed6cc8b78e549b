package lab.reconciler.common;

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

class KeyedLocksTest {

    private final KeyedLocks locks = new KeyedLocks("test");

    @Test
    void lockIsDroppedOnceItsLastUserLeaves() {
        for (int i = 0; i < 1000; i++) {
            locks.withLock("order-" + i, () -> assertThat(locks.activeKeys()).isEqualTo(1));
        }

        assertThat(locks.activeKeys()).isZero();
    }

    @Test
    void reentrantUse_keepsTheKeyUntilTheOuterCallReturns() {
        locks.withLock("a", () -> {
            locks.withLock("a", () -> assertThat(locks.activeKeys()).isEqualTo(1));
            assertThat(locks.activeKeys()).isEqualTo(1);
        });

        assertThat(locks.activeKeys()).isZero();
    }

    @Test
    void failingAction_releasesTheKey() {
        try {
            locks.withLock("a", (Runnable) () -> {
                throw new IllegalStateException("boom");
            });
        } catch (IllegalStateException e) {
            assertThat(e).hasMessage("boom");
        }

        assertThat(locks.activeKeys()).isZero();
    }

    @Test
    void contendedKey_staysExclusiveAndIsDroppedAfterwards() throws Exception {
        int threads = 8;
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    for (int round = 0; round < 200; round++) {
                        locks.withLock("shared", () -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            inside.decrementAndGet();
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(locks.activeKeys()).isZero();
    }
}
