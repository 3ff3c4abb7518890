package com.example.trafficgate;

public class CounterStoreException extends Exception {

    public CounterStoreException(String message) {
        super(message);
    }

    public CounterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
