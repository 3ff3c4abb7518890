package com.example.trafficgate;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * 集計のグルーピングキー。カテゴリ + 分単位の時間窓。
 */
public record MetricKey(String category, LocalDateTime window) {

    private static final DateTimeFormatter WINDOW_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    public MetricKey {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(window, "window");
        window = window.truncatedTo(ChronoUnit.MINUTES);
    }

    public static MetricKey of(String category, LocalDateTime time) {
        return new MetricKey(category, time);
    }

    public String windowLabel() {
        return WINDOW_FORMAT.format(window);
    }

    @Override
    public String toString() {
        return category + ":" + windowLabel();
    }
}
