package com.recnos.ratetelemetry.telemetry;

import java.time.Instant;

/**
 * Immutable telemetry sample produced once per second tick.
 */
public record Snapshot(long total, long ratePerSecond, long ratePerMinute, Instant timestamp) {

    public static Snapshot empty(Instant timestamp) {
        return new Snapshot(0, 0, 0, timestamp);
    }
}
