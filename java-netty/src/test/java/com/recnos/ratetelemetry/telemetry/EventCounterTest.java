package com.recnos.ratetelemetry.telemetry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class EventCounterTest {

    @Test
    @DisplayName("total is stable between increments")
    void totalIsIdempotentBetweenIncrements() {
        EventCounter counter = new EventCounter();
        counter.increment();
        counter.increment();
        counter.increment();

        assertThat(counter.total()).isEqualTo(3);
        assertThat(counter.total()).isEqualTo(3);
        assertThat(counter.minuteCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("drain returns the window and starts a new one at zero")
    void drainResetsMinuteButNotTotal() {
        EventCounter counter = new EventCounter();
        for (int i = 0; i < 7; i++) {
            counter.increment();
        }

        assertThat(counter.drainMinute()).isEqualTo(7);
        assertThat(counter.minuteCount()).isZero();
        assertThat(counter.total()).isEqualTo(7);

        counter.increment();
        assertThat(counter.drainMinute()).isEqualTo(1);
        assertThat(counter.total()).isEqualTo(8);
    }

    @Test
    @DisplayName("concurrent producers lose no increments")
    void concurrentIncrementsAreAllCounted() throws Exception {
        int threads = 8;
        int perThread = 10_000;
        EventCounter counter = new EventCounter();
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        counter.increment();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(counter.total()).isEqualTo((long) threads * perThread);
        assertThat(counter.minuteCount()).isEqualTo((long) threads * perThread);
    }

    @Test
    @DisplayName("events racing with a drain land in exactly one window")
    void drainRacingWithProducersCountsEachEventOnce() throws Exception {
        int producers = 4;
        int perProducer = 50_000;
        EventCounter counter = new EventCounter();
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(producers);
        try {
            for (int p = 0; p < producers; p++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        counter.increment();
                    }
                    done.countDown();
                    return null;
                });
            }

            long drained = 0;
            int drains = 0;
            start.countDown();
            while (done.getCount() > 0) {
                drained += counter.drainMinute();
                drains++;
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            drained += counter.drainMinute();

            assertThat(drains).isPositive();
            assertThat(drained).isEqualTo((long) producers * perProducer);
            assertThat(counter.total()).isEqualTo((long) producers * perProducer);
        } finally {
            pool.shutdownNow();
        }
    }
}
