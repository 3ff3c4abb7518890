package com.example.trafficgate;

public record CounterValues(long views, long clicks) {}
