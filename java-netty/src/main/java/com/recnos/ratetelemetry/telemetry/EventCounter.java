package com.recnos.ratetelemetry.telemetry;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free event counter incremented from the request-handling path.
 *
 * Holds two values:
 * - the monotonic total, kept in a {@link LongAdder} (striped cells, no CAS spinning under contention)
 * - the minute accumulator, kept in an {@link AtomicLong} so the minute tick can drain it
 *   with a single atomic exchange
 *
 * Not final so tests can stand in a counter that misbehaves.
 */
public class EventCounter {

    private final LongAdder total = new LongAdder();
    private final AtomicLong minuteAccumulator = new AtomicLong();

    /**
     * Records one event. Never blocks and never fails.
     */
    public void increment() {
        total.increment();
        minuteAccumulator.incrementAndGet();
    }

    /**
     * Current total. Concurrent increments may or may not be visible yet;
     * with no intervening increment repeated calls return the same value.
     */
    public long total() {
        return total.sum();
    }

    /**
     * Events counted since the last {@link #drainMinute()}.
     */
    public long minuteCount() {
        return minuteAccumulator.get();
    }

    /**
     * Atomically swaps the minute accumulator for zero and returns the prior value.
     * An increment racing with the drain lands either in the returned value or in the next window.
     */
    public long drainMinute() {
        return minuteAccumulator.getAndSet(0);
    }
}
