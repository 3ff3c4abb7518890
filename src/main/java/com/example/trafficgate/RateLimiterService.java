package com.example.trafficgate;

public interface RateLimiterService {

    AllowResult allow(String key);

    /**
     * しばらくアクセスのないクライアントの状態を捨てる。
     *
     * @return 削除した件数
     */
    int evictIdle();
}
