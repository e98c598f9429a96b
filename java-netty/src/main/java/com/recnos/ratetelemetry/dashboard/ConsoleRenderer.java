package com.recnos.ratetelemetry.dashboard;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Full-screen text dashboard on an ANSI terminal.
 *
 * Draws on one daemon thread. The queue holds a single task; the feed never has
 * more than one redraw outstanding, so a full queue means the loop is stuck and the
 * request is rejected instead of piling up.
 */
public class ConsoleRenderer implements DisplayRenderer, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String CLEAR_SCREEN = "\u001b[H\u001b[2J";
    private static final int DEFAULT_WIDTH = 80;
    private static final int TOP_PADDING = 3;

    private final PrintStream out;
    private final int width;
    private final ExecutorService drawLoop;

    public ConsoleRenderer(PrintStream out) {
        this(out, DEFAULT_WIDTH);
    }

    public ConsoleRenderer(PrintStream out, int width) {
        this.out = out;
        this.width = width;
        this.drawLoop = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(1),
                r -> {
                    Thread t = new Thread(r, "dashboard-draw-loop");
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Override
    public void requestRedraw(Runnable drawTask) {
        drawLoop.execute(drawTask);
    }

    @Override
    public void draw(String text) {
        StringBuilder frame = new StringBuilder(CLEAR_SCREEN);
        frame.append(System.lineSeparator().repeat(TOP_PADDING));
        for (String line : text.split("\n")) {
            frame.append(center(line)).append(System.lineSeparator());
        }
        out.print(frame);
        out.flush();
    }

    String center(String line) {
        int padding = Math.max(0, (width - line.length()) / 2);
        return " ".repeat(padding) + line;
    }

    /**
     * Stops the draw loop. A queued frame is discarded.
     */
    @Override
    public void close() {
        if (drawLoop.isShutdown()) {
            return;
        }
        drawLoop.shutdownNow();
        try {
            if (!drawLoop.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.warn("Dashboard draw loop did not stop within 1s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Dashboard renderer stopped");
    }
}
