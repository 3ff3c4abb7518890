package com.example.trafficgate;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * クライアント単位のレートリミッター設定値。
 *
 * staleness と sweepInterval は独立したつまみ:
 *   sweepInterval  -> どのくらいの頻度で掃除するか
 *   staleness      -> 何秒アクセスがなければ消すか
 */
@Validated
@ConfigurationProperties(prefix = "ratelimit")
public class RateLimitProperties {
    /** バースト容量（トークンの最大保持量） */
    @Min(1)
    private int capacity = 5;

    /** 1秒あたり補充されるトークン数 */
    @Positive
    private double refillPerSecond = 1.0;

    /** この時間アクセスのないクライアントは掃除で消す */
    @NotNull
    private Duration staleness = Duration.ofMinutes(5);

    /** 掃除の実行間隔 */
    @NotNull
    private Duration sweepInterval = Duration.ofSeconds(5);

    /**
     * true なら X-Forwarded-For の先頭をクライアントキーに使う。
     * リバースプロキシの後ろに置くときだけ有効にすること。
     */
    private boolean trustForwardedFor = false;

    /** 掃除が失敗したときの振る舞い */
    @NotNull
    private FailurePolicy sweepFailurePolicy = FailurePolicy.CONTINUE;

    public int getCapacity() { return capacity; }
    public void setCapacity(int capacity) { this.capacity = capacity; }

    public double getRefillPerSecond() { return refillPerSecond; }
    public void setRefillPerSecond(double refillPerSecond) { this.refillPerSecond = refillPerSecond; }

    public Duration getStaleness() { return staleness; }
    public void setStaleness(Duration staleness) { this.staleness = staleness; }

    public Duration getSweepInterval() { return sweepInterval; }
    public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }

    public boolean isTrustForwardedFor() { return trustForwardedFor; }
    public void setTrustForwardedFor(boolean trustForwardedFor) { this.trustForwardedFor = trustForwardedFor; }

    public FailurePolicy getSweepFailurePolicy() { return sweepFailurePolicy; }
    public void setSweepFailurePolicy(FailurePolicy sweepFailurePolicy) { this.sweepFailurePolicy = sweepFailurePolicy; }
}
