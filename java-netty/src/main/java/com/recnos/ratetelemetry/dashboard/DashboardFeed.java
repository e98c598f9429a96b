package com.recnos.ratetelemetry.dashboard;

import com.recnos.ratetelemetry.telemetry.Snapshot;
import com.recnos.ratetelemetry.telemetry.SnapshotConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Feeds snapshots to the dashboard renderer, coalescing redraws.
 *
 * At most one snapshot is pending. A push that finds a pending snapshot replaces it
 * and relies on the redraw already queued; the draw task takes whatever is latest.
 */
public class DashboardFeed implements SnapshotConsumer {

    private static final Logger logger = LoggerFactory.getLogger(DashboardFeed.class);

    private final DisplayRenderer renderer;
    private final AtomicReference<Snapshot> pending = new AtomicReference<>();
    private final LongAdder coalesced = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    public DashboardFeed(DisplayRenderer renderer) {
        this.renderer = renderer;
    }

    public void push(Snapshot snapshot) {
        if (pending.getAndSet(snapshot) != null) {
            coalesced.increment();
            return;
        }
        try {
            renderer.requestRedraw(this::drawPending);
        } catch (RejectedExecutionException e) {
            // renderer gone; forget the frame so the next push asks again
            pending.set(null);
            dropped.increment();
            logger.debug("Redraw request rejected: {}", e.getMessage());
        } catch (RuntimeException e) {
            pending.set(null);
            dropped.increment();
            logger.debug("Redraw request failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public void accept(Snapshot snapshot) {
        push(snapshot);
    }

    private void drawPending() {
        Snapshot snapshot = pending.getAndSet(null);
        if (snapshot == null) {
            return;
        }
        try {
            renderer.draw(format(snapshot));
        } catch (RuntimeException e) {
            dropped.increment();
            logger.debug("Dashboard draw failed: {}", e.getMessage());
        }
    }

    public static String format(Snapshot snapshot) {
        return String.format(Locale.ROOT,
                "Total Requests: %d\nRequests per Second: %.2f\nRequests per Minute: %.2f",
                snapshot.total(), (double) snapshot.ratePerSecond(), (double) snapshot.ratePerMinute());
    }

    public long coalescedFrames() {
        return coalesced.sum();
    }

    public long droppedFrames() {
        return dropped.sum();
    }

    @Override
    public String toString() {
        return "DashboardFeed";
    }
}
