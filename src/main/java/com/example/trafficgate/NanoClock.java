package com.example.trafficgate;

/**
 * 単調増加するナノ秒時計。
 * 本番は {@link #system()}、テストでは手動で進める時計を差し込む。
 */
@FunctionalInterface
public interface NanoClock {

    long nowNanos();

    static NanoClock system() {
        return System::nanoTime;
    }
}
