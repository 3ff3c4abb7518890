package com.example.trafficgate;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * AdmissionFilter を通過したリクエストだけがここに来る。
 *
 * 使い方:
 *  curl -i -X POST "http://localhost:8080/v1/views?category=sports"
 *  curl -i -X POST "http://localhost:8080/v1/clicks?category=sports"
 *  curl -i "http://localhost:8080/v1/stats"
 */
@RestController
public class ContentController {

    private final CounterAggregator aggregator;
    private final CounterProperties props;
    private final Clock clock;

    public ContentController(CounterAggregator aggregator, CounterProperties props, Clock clock) {
        this.aggregator = aggregator;
        this.props = props;
        this.clock = clock;
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    public String welcome() {
        return "Welcome to traffic-gate";
    }

    /**
     * category を省略したら設定済みカテゴリからランダムに選ぶ。
     */
    @PostMapping("/v1/views")
    public ResponseEntity<RecordResponse> view(@RequestParam(value = "category", required = false) String category) {
        String resolved = category == null ? randomCategory() : requireKnown(category);
        MetricKey key = MetricKey.of(resolved, LocalDateTime.now(clock));
        aggregator.recordView(key);
        return ResponseEntity.ok(new RecordResponse(key.category(), key.windowLabel(), "view"));
    }

    @PostMapping("/v1/clicks")
    public ResponseEntity<RecordResponse> click(@RequestParam("category") String category) {
        MetricKey key = MetricKey.of(requireKnown(category), LocalDateTime.now(clock));
        aggregator.recordClick(key);
        return ResponseEntity.ok(new RecordResponse(key.category(), key.windowLabel(), "click"));
    }

    /**
     * まだフラッシュされていない集計。リセットはしない。
     */
    @GetMapping("/v1/stats")
    public List<StatsEntry> stats() {
        return aggregator.peek().counters().entrySet().stream()
                .map(e -> new StatsEntry(e.getKey().category(), e.getKey().windowLabel(),
                        e.getValue().views(), e.getValue().clicks()))
                .sorted(Comparator.comparing(StatsEntry::window).thenComparing(StatsEntry::category))
                .toList();
    }

    private String requireKnown(String category) {
        String normalized = normalize(category);
        if (props.getCategories().stream().map(ContentController::normalize).noneMatch(normalized::equals)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "unknown category: " + category);
        }
        return normalized;
    }

    private String randomCategory() {
        List<String> categories = props.getCategories();
        if (categories.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "no categories configured");
        }
        return normalize(categories.get(ThreadLocalRandom.current().nextInt(categories.size())));
    }

    private static String normalize(String category) {
        return category.trim().toLowerCase(Locale.ROOT);
    }

    public record RecordResponse(String category, String window, String recorded) {}

    public record StatsEntry(String category, String window, long views, long clicks) {}
}
