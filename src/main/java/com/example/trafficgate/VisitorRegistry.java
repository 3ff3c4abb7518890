package com.example.trafficgate;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * クライアントキーごとのトークンバケットと最終アクセス時刻を保持するレジストリ。
 *
 * マップ全体を1つのロックで守る。中の処理は O(1) なので粗いロックで十分。
 * sweep も同じロックを取るので、掃除中のアドミッション判定は1パス分だけ待たされる。
 */
public class VisitorRegistry {

    private final NanoClock clock;
    private final int capacity;
    private final double refillPerSecond;

    private final Object lock = new Object();
    private final Map<String, Visitor> visitors = new HashMap<>();

    public VisitorRegistry(NanoClock clock, int capacity, double refillPerSecond) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (refillPerSecond <= 0) throw new IllegalArgumentException("refillPerSecond <= 0");
        this.clock = clock;
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
    }

    /**
     * キーのバケットから1トークン消費を試みる。
     * 初見のキーなら満タンのバケットを作ってから消費する。
     */
    public AllowResult checkAndAdmit(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("client key must not be blank");
        }
        synchronized (lock) {
            long now = clock.nowNanos();
            Visitor visitor = visitors.get(key);
            if (visitor == null) {
                visitor = new Visitor(new TokenBucket(clock, capacity, refillPerSecond), now);
                visitors.put(key, visitor);
            } else {
                visitor.lastSeenNanos = now;
            }
            return visitor.bucket.tryConsume();
        }
    }

    /**
     * staleness より長くアクセスのないエントリを削除する。
     *
     * @return 削除した件数
     */
    public int sweep(Duration staleness) {
        long thresholdNanos = staleness.toNanos();
        int removed = 0;
        synchronized (lock) {
            long now = clock.nowNanos();
            Iterator<Visitor> it = visitors.values().iterator();
            while (it.hasNext()) {
                if (now - it.next().lastSeenNanos > thresholdNanos) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    public int size() {
        synchronized (lock) {
            return visitors.size();
        }
    }

    public boolean contains(String key) {
        synchronized (lock) {
            return visitors.containsKey(key);
        }
    }

    private static final class Visitor {
        private final TokenBucket bucket;
        private long lastSeenNanos;

        private Visitor(TokenBucket bucket, long lastSeenNanos) {
            this.bucket = bucket;
            this.lastSeenNanos = lastSeenNanos;
        }
    }
}
