package com.example.trafficgate;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 失敗で止まったワーカーがあれば DOWN。
 * STOP ポリシーで止まったまま気付かれない、という状態を外から見えるようにする。
 */
@Component("sweepers")
public class SweeperHealthIndicator implements HealthIndicator {

    private final List<PeriodicSweeper> sweepers;

    public SweeperHealthIndicator(List<PeriodicSweeper> sweepers) {
        this.sweepers = sweepers;
    }

    @Override
    public Health health() {
        Health.Builder builder = Health.up();
        for (PeriodicSweeper sweeper : sweepers) {
            if (sweeper.isHalted()) {
                builder.down();
                Exception failure = sweeper.getLastFailure();
                builder.withDetail(sweeper.getName(),
                        "halted: " + (failure == null ? "unknown" : failure.toString()));
            } else {
                builder.withDetail(sweeper.getName(), sweeper.getState().name());
            }
        }
        return builder.build();
    }
}
