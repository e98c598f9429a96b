package com.recnos.ratetelemetry.service;

import com.recnos.ratetelemetry.telemetry.Snapshot;
import com.recnos.ratetelemetry.telemetry.SnapshotConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.LongAdder;

/**
 * Forwards each snapshot to the metrics exporter.
 * Best effort: a failure is logged and dropped, never retried.
 */
public class MetricsPublisher implements SnapshotConsumer {

    private static final Logger logger = LoggerFactory.getLogger(MetricsPublisher.class);

    private final MetricsExporter exporter;
    private final LongAdder failures = new LongAdder();

    public MetricsPublisher(MetricsExporter exporter) {
        this.exporter = exporter;
    }

    public void publish(Snapshot snapshot) {
        try {
            exporter.updateTotal(snapshot.total());
            exporter.updateRatePerSecond(snapshot.ratePerSecond());
            exporter.updateRatePerMinute(snapshot.ratePerMinute());
        } catch (RuntimeException e) {
            failures.increment();
            logger.warn("Failed to publish snapshot at {}: {}", snapshot.timestamp(), e.getMessage());
        }
    }

    @Override
    public void accept(Snapshot snapshot) {
        publish(snapshot);
    }

    public long failures() {
        return failures.sum();
    }

    @Override
    public String toString() {
        return "MetricsPublisher";
    }
}
