package com.recnos.ratetelemetry.service;

/**
 * Counter/gauge surface of the external metrics exporter.
 */
public interface MetricsExporter {

    /**
     * Brings the exported request counter up to {@code total}. Never moves it backwards.
     */
    void updateTotal(long total);

    void updateRatePerSecond(double ratePerSecond);

    void updateRatePerMinute(double ratePerMinute);
}
