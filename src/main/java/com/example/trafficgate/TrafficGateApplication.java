package com.example.trafficgate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrafficGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrafficGateApplication.class, args);
    }
}
