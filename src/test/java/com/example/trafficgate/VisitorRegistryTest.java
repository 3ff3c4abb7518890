package com.example.trafficgate;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class VisitorRegistryTest {

    private final ManualNanoClock clock = new ManualNanoClock(0);
    private final VisitorRegistry registry = new VisitorRegistry(clock, 5, 1.0);

    @Test
    void burstThenRecoverForSingleKey() {
        List<Boolean> results = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            results.add(registry.checkAndAdmit("A").allowed());
        }
        assertThat(results).containsExactly(true, true, true, true, true);
        assertThat(registry.checkAndAdmit("A").allowed()).isFalse();

        clock.advance(Duration.ofSeconds(1));
        assertThat(registry.checkAndAdmit("A").allowed()).isTrue();
    }

    @Test
    void keysAreIndependent() {
        for (int i = 0; i < 5; i++) registry.checkAndAdmit("A");
        assertThat(registry.checkAndAdmit("A").allowed()).isFalse();

        assertThat(registry.checkAndAdmit("B").allowed()).isTrue();
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void sweepRemovesOnlyStaleEntries() {
        registry.checkAndAdmit("stale");
        clock.advance(Duration.ofMinutes(4));
        registry.checkAndAdmit("fresh");
        clock.advance(Duration.ofMinutes(1).plusSeconds(1));

        int removed = registry.sweep(Duration.ofMinutes(5));

        assertThat(removed).isEqualTo(1);
        assertThat(registry.contains("stale")).isFalse();
        assertThat(registry.contains("fresh")).isTrue();
    }

    @Test
    void touchingAnEntryKeepsItAlive() {
        registry.checkAndAdmit("A");
        clock.advance(Duration.ofMinutes(4));
        registry.checkAndAdmit("A");
        clock.advance(Duration.ofMinutes(4));

        assertThat(registry.sweep(Duration.ofMinutes(5))).isZero();
        assertThat(registry.contains("A")).isTrue();
    }

    @Test
    void evictedKeyStartsWithFullBucket() {
        for (int i = 0; i < 5; i++) registry.checkAndAdmit("A");
        clock.advance(Duration.ofMinutes(10));
        registry.sweep(Duration.ofMinutes(5));

        assertThat(registry.contains("A")).isFalse();
        assertThat(registry.checkAndAdmit("A").remaining()).isEqualTo(4L);
    }

    @Test
    void concurrentFirstRequestsShareOneBucket() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Callable<Boolean>> calls = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                calls.add(() -> {
                    start.await();
                    return registry.checkAndAdmit("same").allowed();
                });
            }
            List<Future<Boolean>> futures = new ArrayList<>();
            for (Callable<Boolean> c : calls) futures.add(pool.submit(c));
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> f : futures) {
                if (f.get(5, TimeUnit.SECONDS)) admitted++;
            }
            // 時計は止まっているので、ちょうど容量分だけ通る
            assertThat(admitted).isEqualTo(5);
            assertThat(registry.size()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
