package com.example.trafficgate;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * メトリクスキーごとの view/click 数をメモリ上で集計する。
 *
 * マップ全体を1つのロックで守る。エントリの作成も加算も短いクリティカルセクション内で済ませ、
 * drain はマップの差し替えだけをロック内で行う。差し替え後の古いマップには誰も書かないので、
 * スナップショットの組み立てとアップロードはロックの外で行える。
 */
public class CounterAggregator {

    private final Clock clock;
    private final Object lock = new Object();
    private Map<MetricKey, MutableCounter> counters = new HashMap<>();

    public CounterAggregator(Clock clock) {
        this.clock = clock;
    }

    public void recordView(MetricKey key) {
        synchronized (lock) {
            counters.computeIfAbsent(key, k -> new MutableCounter()).views++;
        }
    }

    /**
     * 先行する view がなくてもエントリを作って加算する。
     */
    public void recordClick(MetricKey key) {
        synchronized (lock) {
            counters.computeIfAbsent(key, k -> new MutableCounter()).clicks++;
        }
    }

    /**
     * 現在の集計を取り出して空にする。
     */
    public CounterSnapshot drain() {
        Map<MetricKey, MutableCounter> drained;
        synchronized (lock) {
            drained = counters;
            counters = new HashMap<>();
        }
        return toSnapshot(drained);
    }

    /**
     * リセットせずに現在の集計を覗く。
     */
    public CounterSnapshot peek() {
        Map<MetricKey, CounterValues> copy = new HashMap<>();
        synchronized (lock) {
            counters.forEach((k, v) -> copy.put(k, v.toValues()));
        }
        return new CounterSnapshot(clock.instant(), copy);
    }

    /**
     * 送れなかったスナップショットを現在の集計に足し戻す。
     */
    public void restore(CounterSnapshot snapshot) {
        synchronized (lock) {
            snapshot.counters().forEach((k, v) -> {
                MutableCounter c = counters.computeIfAbsent(k, key -> new MutableCounter());
                c.views += v.views();
                c.clicks += v.clicks();
            });
        }
    }

    public int size() {
        synchronized (lock) {
            return counters.size();
        }
    }

    private CounterSnapshot toSnapshot(Map<MetricKey, MutableCounter> drained) {
        Map<MetricKey, CounterValues> values = new HashMap<>(drained.size());
        drained.forEach((k, v) -> values.put(k, v.toValues()));
        return new CounterSnapshot(clock.instant(), values);
    }

    private static final class MutableCounter {
        private long views;
        private long clicks;

        private CounterValues toValues() {
            return new CounterValues(views, clicks);
        }
    }
}
