package com.recnos.ratetelemetry.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic sampler turning {@link EventCounter} state into {@link Snapshot}s.
 *
 * Two independent timers, each on its own single-threaded scheduler:
 * - second tick: per-second delta of the total, builds and fans out the snapshot
 * - minute tick: drains the minute accumulator; the result is folded into the next snapshot
 *
 * A single-threaded scheduler never overlaps a task with its own previous run, so
 * {@code lastTotalAtSecondTick} has exactly one writer. The two ticks share nothing
 * but a read of the counter and the volatile {@code ratePerMinute} hand-off.
 */
public class RateSampler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RateSampler.class);

    public static final Duration DEFAULT_SECOND_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MINUTE_INTERVAL = Duration.ofSeconds(60);

    private static final long SHUTDOWN_TIMEOUT_MS = 5_000;

    private final EventCounter counter;
    private final Clock clock;
    private final Duration secondInterval;
    private final Duration minuteInterval;
    private final List<SnapshotConsumer> consumers = new CopyOnWriteArrayList<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private ScheduledExecutorService secondTimer;
    private ScheduledExecutorService minuteTimer;

    // written only by the second tick
    private long lastTotalAtSecondTick;

    // written by the minute tick, read by the second tick
    private volatile long ratePerMinute;

    public RateSampler(EventCounter counter) {
        this(counter, Clock.systemUTC(), DEFAULT_SECOND_INTERVAL, DEFAULT_MINUTE_INTERVAL);
    }

    public RateSampler(EventCounter counter, Clock clock, Duration secondInterval, Duration minuteInterval) {
        if (secondInterval.isZero() || secondInterval.isNegative()) {
            throw new IllegalArgumentException("secondInterval must be positive: " + secondInterval);
        }
        if (minuteInterval.isZero() || minuteInterval.isNegative()) {
            throw new IllegalArgumentException("minuteInterval must be positive: " + minuteInterval);
        }
        this.counter = counter;
        this.clock = clock;
        this.secondInterval = secondInterval;
        this.minuteInterval = minuteInterval;
        this.lastTotalAtSecondTick = counter.total();
    }

    /**
     * Registers a consumer for every subsequent snapshot.
     */
    public void addConsumer(SnapshotConsumer consumer) {
        consumers.add(consumer);
    }

    /**
     * Registered consumers, in delivery order.
     */
    public List<SnapshotConsumer> consumers() {
        return List.copyOf(consumers);
    }

    /**
     * Starts both timers. Calling it twice, or after {@link #close()}, is an error.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("RateSampler already closed");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("RateSampler already started");
        }
        secondTimer = Executors.newSingleThreadScheduledExecutor(daemon("rate-sampler-second"));
        minuteTimer = Executors.newSingleThreadScheduledExecutor(daemon("rate-sampler-minute"));

        long secondMs = secondInterval.toMillis();
        long minuteMs = minuteInterval.toMillis();
        secondTimer.scheduleAtFixedRate(() -> runTick("second", this::secondTick), secondMs, secondMs, TimeUnit.MILLISECONDS);
        minuteTimer.scheduleAtFixedRate(() -> runTick("minute", this::minuteTick), minuteMs, minuteMs, TimeUnit.MILLISECONDS);

        logger.info("RateSampler started (second tick every {} ms, minute tick every {} ms, {} consumers)",
                secondMs, minuteMs, consumers.size());
    }

    /**
     * One second tick: computes the per-second delta and hands the snapshot to every consumer.
     * Must only be called by a single thread at a time.
     */
    public Snapshot secondTick() {
        long total = counter.total();
        long delta = total - lastTotalAtSecondTick;
        if (delta < 0) {
            logger.debug("Counter went backwards ({} -> {}), clamping delta to 0", lastTotalAtSecondTick, total);
            delta = 0;
        }
        lastTotalAtSecondTick = total;

        Snapshot snapshot = new Snapshot(total, delta, ratePerMinute, clock.instant());
        for (SnapshotConsumer consumer : consumers) {
            try {
                consumer.accept(snapshot);
            } catch (RuntimeException e) {
                logger.warn("Snapshot consumer {} failed: {}", consumer, e.getMessage(), e);
            }
        }
        return snapshot;
    }

    /**
     * One minute tick: drains the minute accumulator in a single exchange.
     * The value appears in the snapshot of the next second tick.
     */
    public long minuteTick() {
        long drained = counter.drainMinute();
        ratePerMinute = drained;
        logger.debug("Minute window closed with {} events", drained);
        return drained;
    }

    public long ratePerMinute() {
        return ratePerMinute;
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    /**
     * Stops the second timer, then the minute timer, waiting for an in-flight tick to finish.
     * Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (!started.get()) {
            return;
        }
        stopTimer("second", secondTimer);
        stopTimer("minute", minuteTimer);
        logger.info("RateSampler stopped");
    }

    private static void runTick(String name, Runnable tick) {
        // an exception escaping a scheduleAtFixedRate task cancels every later run
        try {
            tick.run();
        } catch (RuntimeException e) {
            logger.error("Unexpected failure in {} tick", name, e);
        }
    }

    private static void stopTimer(String name, ScheduledExecutorService timer) {
        timer.shutdown();
        try {
            if (!timer.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                logger.warn("{} timer did not stop within {} ms, forcing shutdown", name, SHUTDOWN_TIMEOUT_MS);
                timer.shutdownNow();
            }
        } catch (InterruptedException e) {
            timer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
