package com.example.trafficgate;

public record ErrorResponse(String code, String message) {}
