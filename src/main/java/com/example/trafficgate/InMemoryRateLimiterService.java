package com.example.trafficgate;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * 単一インスタンス用のレートリミッター。
 * アプリ内メモリ (VisitorRegistry) にクライアントごとのトークンバケットを保持する。
 * 複数プロセス間で状態は共有しない。
 */
@Service
public class InMemoryRateLimiterService implements RateLimiterService {

    private final RateLimitProperties props;
    private final VisitorRegistry visitors;
    private final Counter allowedCounter;
    private final Counter deniedCounter;

    public InMemoryRateLimiterService(RateLimitProperties props, VisitorRegistry visitors, MeterRegistry registry) {
        this.props = props;
        this.visitors = visitors;
        this.allowedCounter = Counter.builder("ratelimiter_requests_total")
                .tag("outcome", "allowed")
                .register(registry);
        this.deniedCounter = Counter.builder("ratelimiter_requests_total")
                .tag("outcome", "denied")
                .register(registry);
        Gauge.builder("ratelimiter_visitors", visitors, VisitorRegistry::size)
                .register(registry);
    }

    @Override
    public AllowResult allow(String key) {
        AllowResult res = visitors.checkAndAdmit(key);

        if (res.allowed()) {
            allowedCounter.increment();
        } else {
            deniedCounter.increment();
        }
        return res;
    }

    @Override
    public int evictIdle() {
        return visitors.sweep(props.getStaleness());
    }
}
