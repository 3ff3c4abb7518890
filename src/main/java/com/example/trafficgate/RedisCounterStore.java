package com.example.trafficgate;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;

/**
 * Redis のハッシュにカウントを加算する。
 *   key   : "{prefix}:{category}:{yyyy-MM-dd HH:mm}"
 *   field : views / clicks
 *
 * HINCRBY なので、複数プロセスが同じ時間窓を書いても加算される。
 */
@Component
@ConditionalOnProperty(prefix = "counters", name = "store", havingValue = "redis")
public class RedisCounterStore implements CounterStore {

    private final CounterProperties props;
    private final StringRedisTemplate redis;

    public RedisCounterStore(CounterProperties props, StringRedisTemplate redisTemplate) {
        this.props = props;
        this.redis = redisTemplate;
    }

    @Override
    public void upload(CounterSnapshot snapshot) throws CounterStoreException {
        HashOperations<String, String, String> hashes = redis.opsForHash();
        Duration ttl = props.getRedisKeyTtl();
        try {
            for (Map.Entry<MetricKey, CounterValues> e : snapshot.counters().entrySet()) {
                String hashKey = keyFor(e.getKey());
                CounterValues v = e.getValue();
                if (v.views() > 0) hashes.increment(hashKey, "views", v.views());
                if (v.clicks() > 0) hashes.increment(hashKey, "clicks", v.clicks());
                if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
                    redis.expire(hashKey, ttl);
                }
            }
        } catch (DataAccessException e) {
            throw new CounterStoreException("Redis upload failed for " + snapshot.size() + " counters", e);
        }
    }

    String keyFor(MetricKey key) {
        return props.getRedisKeyPrefix() + ":" + key.category() + ":" + key.windowLabel();
    }
}
