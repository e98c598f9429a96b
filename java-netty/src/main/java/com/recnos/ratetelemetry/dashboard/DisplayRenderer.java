package com.recnos.ratetelemetry.dashboard;

import java.util.concurrent.RejectedExecutionException;

/**
 * A terminal display with its own single-threaded draw loop.
 */
public interface DisplayRenderer {

    /**
     * Enqueues {@code drawTask} on the draw loop and returns immediately.
     *
     * @throws RejectedExecutionException if the draw loop is stopped or cannot take the task
     */
    void requestRedraw(Runnable drawTask);

    /**
     * Replaces the displayed text. Only called from the draw loop.
     */
    void draw(String text);
}
