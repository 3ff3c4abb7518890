package com.example.trafficgate;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 集計をドレインしてストアへ送る。アップロードは集計のロックの外で行う。
 */
@Service
public class CounterFlushService {

    private static final Logger log = LoggerFactory.getLogger(CounterFlushService.class);

    private final CounterAggregator aggregator;
    private final CounterStore store;
    private final CounterProperties props;
    private final Counter flushedCounter;
    private final Counter requeuedCounter;

    public CounterFlushService(CounterAggregator aggregator, CounterStore store,
                               CounterProperties props, MeterRegistry registry) {
        this.aggregator = aggregator;
        this.store = store;
        this.props = props;
        this.flushedCounter = Counter.builder("counters_flushed_total").register(registry);
        this.requeuedCounter = Counter.builder("counters_requeued_total").register(registry);
    }

    /**
     * @return 送ったエントリ数。空なら 0 でストアは呼ばない
     */
    public int flush() throws CounterStoreException {
        CounterSnapshot snapshot = aggregator.drain();
        if (snapshot.isEmpty()) {
            return 0;
        }

        try {
            store.upload(snapshot);
        } catch (CounterStoreException | RuntimeException e) {
            requeue(snapshot);
            throw e;
        }

        flushedCounter.increment(snapshot.size());
        log.debug("Flushed {} counters", snapshot.size());
        return snapshot.size();
    }

    private void requeue(CounterSnapshot snapshot) {
        if (!props.isRequeueOnFailure()) {
            return;
        }
        aggregator.restore(snapshot);
        requeuedCounter.increment(snapshot.size());
        log.warn("Upload failed, {} counters put back for the next flush", snapshot.size());
    }
}
