package com.example.trafficgate;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * view/click カウンターの集計とフラッシュの設定値。
 *
 * store:
 *   "logging" -> LoggingCounterStore（デフォルト。ログに出すだけ）
 *   "redis"   -> RedisCounterStore（Redis のハッシュに加算する）
 */
@Validated
@ConfigurationProperties(prefix = "counters")
public class CounterProperties {
    /** ドレインしてストアへ送る間隔 */
    @NotNull
    private Duration flushInterval = Duration.ofSeconds(5);

    private String store = "logging";

    /** 受け付けるコンテンツカテゴリ */
    @NotEmpty
    private List<String> categories = new ArrayList<>(List.of("sports", "entertainment", "business", "education"));

    /** アップロードに失敗したスナップショットを集計に戻して次回に回すか */
    private boolean requeueOnFailure = true;

    /** 停止時に最後のフラッシュを行うか */
    private boolean flushOnShutdown = true;

    /** フラッシュが失敗したときの振る舞い */
    @NotNull
    private FailurePolicy flushFailurePolicy = FailurePolicy.CONTINUE;

    private String redisKeyPrefix = "counters";

    /** Redis に書いたハッシュの有効期限 (0 で期限なし) */
    private Duration redisKeyTtl = Duration.ofDays(1);

    public Duration getFlushInterval() { return flushInterval; }
    public void setFlushInterval(Duration flushInterval) { this.flushInterval = flushInterval; }

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }

    public List<String> getCategories() { return categories; }
    public void setCategories(List<String> categories) { this.categories = categories; }

    public boolean isRequeueOnFailure() { return requeueOnFailure; }
    public void setRequeueOnFailure(boolean requeueOnFailure) { this.requeueOnFailure = requeueOnFailure; }

    public boolean isFlushOnShutdown() { return flushOnShutdown; }
    public void setFlushOnShutdown(boolean flushOnShutdown) { this.flushOnShutdown = flushOnShutdown; }

    public FailurePolicy getFlushFailurePolicy() { return flushFailurePolicy; }
    public void setFlushFailurePolicy(FailurePolicy flushFailurePolicy) { this.flushFailurePolicy = flushFailurePolicy; }

    public String getRedisKeyPrefix() { return redisKeyPrefix; }
    public void setRedisKeyPrefix(String redisKeyPrefix) { this.redisKeyPrefix = redisKeyPrefix; }

    public Duration getRedisKeyTtl() { return redisKeyTtl; }
    public void setRedisKeyTtl(Duration redisKeyTtl) { this.redisKeyTtl = redisKeyTtl; }
}
