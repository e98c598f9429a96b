package com.recnos.ratetelemetry.service;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.common.TextFormat;
import io.prometheus.client.hotspot.DefaultExports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus metrics for the rate telemetry service.
 *
 * Telemetry series, refreshed once per second by {@link MetricsPublisher}:
 * - total_requests (counter)
 * - requests_per_second (gauge)
 * - requests_per_minute (gauge)
 *
 * Ingress series, updated by the HTTP handler:
 * - http_requests_total, http_request_duration_seconds, http_requests_in_flight
 * - events_failed_total by reason
 */
public class PrometheusMetrics implements MetricsExporter {

    private static final Logger logger = LoggerFactory.getLogger(PrometheusMetrics.class);

    private final CollectorRegistry registry;

    // Telemetry Metrics
    public final Counter totalRequests;
    public final Gauge requestsPerSecond;
    public final Gauge requestsPerMinute;

    // HTTP Request Metrics
    public final Counter httpRequestsTotal;
    public final Histogram httpRequestDuration;
    public final Gauge httpRequestsInFlight;

    // Event Processing Metrics
    public final Counter eventsFailedTotal;

    private final AtomicLong lastExportedTotal = new AtomicLong();

    public PrometheusMetrics(CollectorRegistry registry) {
        this.registry = registry;

        totalRequests = Counter.build()
                .name("total_requests")
                .help("Total number of processed requests.")
                .register(registry);

        requestsPerSecond = Gauge.build()
                .name("requests_per_second")
                .help("Requests processed per second.")
                .register(registry);

        requestsPerMinute = Gauge.build()
                .name("requests_per_minute")
                .help("Requests processed per minute.")
                .register(registry);

        httpRequestsTotal = Counter.build()
                .name("http_requests_total")
                .help("Total number of HTTP requests")
                .labelNames("method", "endpoint", "status")
                .register(registry);

        httpRequestDuration = Histogram.build()
                .name("http_request_duration_seconds")
                .help("HTTP request duration in seconds")
                .labelNames("method", "endpoint")
                .buckets(0.0005, 0.001, 0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0)
                .register(registry);

        httpRequestsInFlight = Gauge.build()
                .name("http_requests_in_flight")
                .help("Number of HTTP requests currently being processed")
                .labelNames("method", "endpoint")
                .register(registry);

        eventsFailedTotal = Counter.build()
                .name("events_failed_total")
                .help("Total number of requests rejected before being counted")
                .labelNames("reason")
                .register(registry);

        logger.info("PrometheusMetrics initialized");
    }

    /**
     * Adds the default JVM collectors (GC, memory pools, threads) to this registry.
     */
    public void registerJvmMetrics() {
        DefaultExports.register(registry);
        logger.info("JVM metrics registered");
    }

    @Override
    public void updateTotal(long total) {
        long previous = lastExportedTotal.getAndAccumulate(total, Math::max);
        if (total > previous) {
            totalRequests.inc(total - previous);
        }
    }

    @Override
    public void updateRatePerSecond(double ratePerSecond) {
        requestsPerSecond.set(ratePerSecond);
    }

    @Override
    public void updateRatePerMinute(double ratePerMinute) {
        requestsPerMinute.set(ratePerMinute);
    }

    /**
     * Records an HTTP request with timing and status.
     */
    public void recordHttpRequest(String method, String endpoint, int status, double durationSeconds) {
        httpRequestsTotal.labels(method, endpoint, String.valueOf(status)).inc();
        httpRequestDuration.labels(method, endpoint).observe(durationSeconds);
    }

    /**
     * Records a request that was rejected and therefore not counted.
     */
    public void recordEventFailed(String reason) {
        eventsFailedTotal.labels(reason).inc();
    }

    /**
     * Renders every registered metric in the Prometheus text exposition format.
     */
    public String scrape() throws IOException {
        StringWriter writer = new StringWriter();
        TextFormat.write004(writer, registry.metricFamilySamples());
        return writer.toString();
    }

    public CollectorRegistry registry() {
        return registry;
    }
}
