package com.recnos.ratetelemetry.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Startup settings. Defaults, then system properties, then positional arguments
 * {@code [ingressPort] [metricsPort]}. Port 0 binds an ephemeral port.
 */
public record ServerConfig(int ingressPort, int metricsPort, boolean dashboardEnabled) {

    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final int DEFAULT_INGRESS_PORT = 13000;
    public static final int DEFAULT_METRICS_PORT = 13100;

    public static final String INGRESS_PORT_PROPERTY = "telemetry.ingress.port";
    public static final String METRICS_PORT_PROPERTY = "telemetry.metrics.port";
    public static final String DASHBOARD_PROPERTY = "telemetry.dashboard.enabled";

    public ServerConfig {
        checkPort("ingressPort", ingressPort);
        checkPort("metricsPort", metricsPort);
        if (ingressPort != 0 && ingressPort == metricsPort) {
            throw new IllegalArgumentException("ingressPort and metricsPort must differ, both are " + ingressPort);
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_INGRESS_PORT, DEFAULT_METRICS_PORT, true);
    }

    public static ServerConfig load(String[] args) {
        return load(args, System.getProperties());
    }

    public static ServerConfig load(String[] args, Properties properties) {
        int ingressPort = parsePort(properties.getProperty(INGRESS_PORT_PROPERTY), DEFAULT_INGRESS_PORT);
        int metricsPort = parsePort(properties.getProperty(METRICS_PORT_PROPERTY), DEFAULT_METRICS_PORT);
        boolean dashboard = Boolean.parseBoolean(properties.getProperty(DASHBOARD_PROPERTY, "true"));

        // Allow port override via command line arguments
        if (args.length > 0) {
            ingressPort = parsePort(args[0], ingressPort);
        }
        if (args.length > 1) {
            metricsPort = parsePort(args[1], metricsPort);
        }
        return new ServerConfig(ingressPort, metricsPort, dashboard);
    }

    private static int parsePort(String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.error("Invalid port number: {}. Using port: {}", value, fallback);
            return fallback;
        }
    }

    private static void checkPort(String name, int port) {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(name + " out of range: " + port);
        }
    }
}
