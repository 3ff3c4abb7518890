package com.example.trafficgate;

/**
 * シンプルなトークンバケット実装（スレッドセーフ）。
 * capacity: バースト容量
 * refillPerSecond: 1秒あたり補充するトークン数
 *
 * 生成直後は満タン。トークン数は常に 0 以上 capacity 以下。
 */
final class TokenBucket {
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final NanoClock clock;
    private final int capacity;
    private final double refillPerSecond;

    // tokens は小数（部分トークン）も扱うため double
    private double tokens;
    private long lastRefillNanos;

    TokenBucket(NanoClock clock, int capacity, double refillPerSecond) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        if (refillPerSecond <= 0) throw new IllegalArgumentException("refillPerSecond <= 0");
        this.clock = clock;
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.tokens = capacity;
        this.lastRefillNanos = clock.nowNanos();
    }

    synchronized double availableTokens() {
        refill();
        return tokens;
    }

    /**
     * 1トークン消費を試みる。
     * 不許可でも補充は必ず反映される。
     */
    synchronized AllowResult tryConsume() {
        refill();

        boolean allowed;
        if (tokens >= 1.0) {
            tokens -= 1.0;
            allowed = true;
        } else {
            allowed = false;
        }

        long retryAfterSec = 0L;
        long resetAfterMillis;

        if (allowed) {
            // 許可時は「満タンになるまで」を返す
            resetAfterMillis = estimateMillisToFull();
        } else {
            // 不許可時は「次の1トークンが得られるまで」を返す
            resetAfterMillis = estimateMillisToNextToken();
            retryAfterSec = Math.max(1L, (long) Math.ceil(resetAfterMillis / 1000.0));
        }

        long remaining = (long) Math.floor(tokens);
        return new AllowResult(allowed, remaining, resetAfterMillis, retryAfterSec);
    }

    private void refill() {
        long now = clock.nowNanos();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0) return;
        tokens = Math.min(capacity, tokens + (elapsed / NANOS_PER_SECOND) * refillPerSecond);
        lastRefillNanos = now;
    }

    private long estimateMillisToNextToken() {
        if (tokens >= 1.0) return 0L;
        double need = 1.0 - tokens;
        double sec = need / refillPerSecond;
        return (long) Math.ceil(sec * 1000.0);
    }

    private long estimateMillisToFull() {
        double need = capacity - tokens;
        if (need <= 0) return 0L;
        double sec = need / refillPerSecond;
        return (long) Math.ceil(sec * 1000.0);
    }
}
