package com.example.trafficgate;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SweeperHealthIndicatorTest {

    private final ThreadPoolTaskScheduler scheduler = initScheduler();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void downWhenASweeperHalted() {
        PeriodicSweeper healthy = new PeriodicSweeper("visitor-sweeper", scheduler, Duration.ofHours(1),
                () -> { }, FailurePolicy.STOP, null, registry);
        PeriodicSweeper broken = new PeriodicSweeper("counter-flusher", scheduler, Duration.ofHours(1),
                () -> { throw new CounterStoreException("store down"); }, FailurePolicy.STOP, null, registry);
        healthy.start();
        broken.start();
        SweeperHealthIndicator indicator = new SweeperHealthIndicator(List.of(healthy, broken));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);

        broken.runOnce();

        Health health = indicator.health();
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("visitor-sweeper", "RUNNING");
        assertThat((String) health.getDetails().get("counter-flusher")).startsWith("halted");
    }

    private static ThreadPoolTaskScheduler initScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.initialize();
        return s;
    }
}
