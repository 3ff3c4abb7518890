package com.example.trafficgate;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * レジストリ・集計器と、それを掃除/フラッシュする2本のバックグラウンドワーカーの組み立て。
 * どれもグローバルではなくこのコンテキストが持つインスタンス。
 */
@Configuration
@EnableConfigurationProperties({RateLimitProperties.class, CounterProperties.class})
public class TrafficGateConfig {

    private static final Logger log = LoggerFactory.getLogger(TrafficGateConfig.class);

    @Bean
    NanoClock nanoClock() {
        return NanoClock.system();
    }

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    VisitorRegistry visitorRegistry(NanoClock nanoClock, RateLimitProperties props) {
        return new VisitorRegistry(nanoClock, props.getCapacity(), props.getRefillPerSecond());
    }

    @Bean
    CounterAggregator counterAggregator(Clock clock) {
        return new CounterAggregator(clock);
    }

    @Bean
    ThreadPoolTaskScheduler sweeperScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("sweeper-");
        // 実行中の掃除/フラッシュは終わるまで待つ
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        return scheduler;
    }

    @Bean
    PeriodicSweeper visitorSweeper(@Qualifier("sweeperScheduler") ThreadPoolTaskScheduler scheduler,
                                   RateLimiterService rateLimiterService,
                                   RateLimitProperties props,
                                   MeterRegistry registry) {
        return new PeriodicSweeper(
                "visitor-sweeper",
                scheduler,
                props.getSweepInterval(),
                () -> {
                    int removed = rateLimiterService.evictIdle();
                    if (removed > 0) {
                        log.debug("Evicted {} idle visitors", removed);
                    }
                },
                props.getSweepFailurePolicy(),
                null,
                registry
        );
    }

    @Bean
    PeriodicSweeper counterFlushSweeper(@Qualifier("sweeperScheduler") ThreadPoolTaskScheduler scheduler,
                                        CounterFlushService flushService,
                                        CounterProperties props,
                                        MeterRegistry registry) {
        PeriodicSweeper.Task finalFlush = props.isFlushOnShutdown() ? flushService::flush : null;
        return new PeriodicSweeper(
                "counter-flusher",
                scheduler,
                props.getFlushInterval(),
                flushService::flush,
                props.getFlushFailurePolicy(),
                finalFlush,
                registry
        );
    }
}
