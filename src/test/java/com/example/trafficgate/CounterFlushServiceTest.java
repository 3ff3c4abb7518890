package com.example.trafficgate;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CounterFlushServiceTest {

    private final CounterAggregator aggregator = new CounterAggregator(Clock.systemUTC());
    private final CounterProperties props = new CounterProperties();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final MetricKey key = MetricKey.of("sports", LocalDateTime.of(2024, 5, 1, 12, 0));

    @Test
    void uploadsDrainedSnapshot() throws Exception {
        RecordingStore store = new RecordingStore();
        CounterFlushService service = new CounterFlushService(aggregator, store, props, registry);
        aggregator.recordView(key);
        aggregator.recordClick(key);

        assertThat(service.flush()).isEqualTo(1);

        assertThat(store.uploaded).hasSize(1);
        assertThat(store.uploaded.get(0).get(key)).isEqualTo(new CounterValues(1, 1));
        assertThat(aggregator.size()).isZero();
        assertThat(registry.get("counters_flushed_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void emptySnapshotIsNotUploaded() throws Exception {
        RecordingStore store = new RecordingStore();
        CounterFlushService service = new CounterFlushService(aggregator, store, props, registry);

        assertThat(service.flush()).isZero();
        assertThat(store.uploaded).isEmpty();
    }

    @Test
    void failedUploadIsPutBackForNextFlush() {
        CounterStore failing = snapshot -> {
            throw new CounterStoreException("store down");
        };
        CounterFlushService service = new CounterFlushService(aggregator, failing, props, registry);
        aggregator.recordView(key);

        assertThatThrownBy(service::flush).isInstanceOf(CounterStoreException.class);

        aggregator.recordView(key);
        assertThat(aggregator.peek().get(key)).isEqualTo(new CounterValues(2, 0));
    }

    @Test
    void unexpectedStoreErrorAlsoPutsCountsBack() {
        CounterStore broken = snapshot -> {
            throw new IllegalStateException("connection factory stopped");
        };
        CounterFlushService service = new CounterFlushService(aggregator, broken, props, registry);
        aggregator.recordView(key);

        assertThatThrownBy(service::flush).isInstanceOf(IllegalStateException.class);

        assertThat(aggregator.size()).isEqualTo(1);
        assertThat(aggregator.peek().get(key)).isEqualTo(new CounterValues(1, 0));
        assertThat(registry.get("counters_requeued_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void failedUploadIsDroppedWhenRequeueDisabled() {
        props.setRequeueOnFailure(false);
        CounterStore failing = snapshot -> {
            throw new CounterStoreException("store down");
        };
        CounterFlushService service = new CounterFlushService(aggregator, failing, props, registry);
        aggregator.recordView(key);

        assertThatThrownBy(service::flush).isInstanceOf(CounterStoreException.class);
        assertThat(aggregator.size()).isZero();
    }

    private static final class RecordingStore implements CounterStore {
        private final List<CounterSnapshot> uploaded = new ArrayList<>();

        @Override
        public void upload(CounterSnapshot snapshot) {
            uploaded.add(snapshot);
        }
    }
}
