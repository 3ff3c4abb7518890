package com.example.trafficgate;

/**
 * ドレインしたスナップショットの送り先。
 * 失敗したら {@link CounterStoreException} を投げる。
 */
public interface CounterStore {

    void upload(CounterSnapshot snapshot) throws CounterStoreException;
}
