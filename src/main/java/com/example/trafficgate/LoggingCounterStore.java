package com.example.trafficgate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 外部ストアを持たない構成用。スナップショットをログに出すだけ。
 */
@Component
@ConditionalOnProperty(prefix = "counters", name = "store", havingValue = "logging", matchIfMissing = true)
public class LoggingCounterStore implements CounterStore {

    private static final Logger log = LoggerFactory.getLogger(LoggingCounterStore.class);

    @Override
    public void upload(CounterSnapshot snapshot) {
        snapshot.counters().forEach((key, values) ->
                log.info("counter key={} views={} clicks={}", key, values.views(), values.clicks()));
    }
}
