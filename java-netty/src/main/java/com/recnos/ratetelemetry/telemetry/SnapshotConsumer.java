package com.recnos.ratetelemetry.telemetry;

/**
 * Receives every snapshot the sampler produces, on the sampler's second-tick thread.
 * Implementations must return quickly and must not block.
 */
@FunctionalInterface
public interface SnapshotConsumer {

    void accept(Snapshot snapshot);
}
