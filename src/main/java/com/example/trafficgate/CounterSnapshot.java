package com.example.trafficgate;

import java.time.Instant;
import java.util.Map;

/**
 * ドレイン時点のカウンターの不変コピー。ストアにはこれがそのまま渡される。
 */
public record CounterSnapshot(Instant takenAt, Map<MetricKey, CounterValues> counters) {

    public CounterSnapshot {
        counters = Map.copyOf(counters);
    }

    public boolean isEmpty() {
        return counters.isEmpty();
    }

    public int size() {
        return counters.size();
    }

    public CounterValues get(MetricKey key) {
        return counters.get(key);
    }
}
