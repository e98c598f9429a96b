package com.recnos.ratetelemetry.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide telemetry state, created once by the startup routine and passed by reference
 * to the ingress handler, the sampler consumers and the stats endpoint.
 */
public class TelemetryAggregator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TelemetryAggregator.class);

    private final EventCounter counter;
    private final RateSampler sampler;
    private final AtomicReference<Snapshot> latest;

    public TelemetryAggregator() {
        this(new EventCounter(), Clock.systemUTC());
    }

    public TelemetryAggregator(EventCounter counter, Clock clock) {
        this(counter, new RateSampler(counter, clock, RateSampler.DEFAULT_SECOND_INTERVAL, RateSampler.DEFAULT_MINUTE_INTERVAL), clock);
    }

    public TelemetryAggregator(EventCounter counter, RateSampler sampler, Clock clock) {
        this.counter = counter;
        this.sampler = sampler;
        this.latest = new AtomicReference<>(Snapshot.empty(clock.instant()));
        // registered first so /stats never lags behind the exporter
        sampler.addConsumer(latest::set);
    }

    /**
     * Called by the ingress layer once per accepted event.
     */
    public void recordEvent() {
        counter.increment();
    }

    public void addConsumer(SnapshotConsumer consumer) {
        sampler.addConsumer(consumer);
    }

    public List<SnapshotConsumer> consumers() {
        return sampler.consumers();
    }

    public Snapshot latestSnapshot() {
        return latest.get();
    }

    public long total() {
        return counter.total();
    }

    public RateSampler sampler() {
        return sampler;
    }

    public void start() {
        sampler.start();
        logger.info("TelemetryAggregator started");
    }

    @Override
    public void close() {
        sampler.close();
    }
}
