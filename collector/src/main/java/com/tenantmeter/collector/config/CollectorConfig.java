package com.tenantmeter.collector.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Function;

/**
 * Configuration for the usage collector, loaded once from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class CollectorConfig {

    // Tenant namespace every query is scoped to
    String namespace;
    String location;

    // Prometheus base URL, e.g. http://prometheus.monitoring.svc.cluster.local:9090
    String promEndpoint;

    // Billing API
    String apiEndpoint;
    String token;

    int httpPort;
    Duration requestTimeout;

    // Scheduling
    Duration projectInterval;
    Duration deploymentInterval;
    int projectConcurrency;
    int finalizationCutoffHour;

    public static CollectorConfig fromEnv() {
        return load(System::getenv);
    }

    /**
     * Loads the configuration from the given variable lookup.
     *
     * @throws IllegalStateException if a required variable is missing or a numeric setting is out of range
     */
    static CollectorConfig load(Function<String, String> env) {
        CollectorConfig config = CollectorConfig.builder()
            .namespace(getEnv(env, "NAMESPACE", ""))
            .location(requireEnv(env, "LOCATION"))
            .promEndpoint(requireEnv(env, "PROM_ENDPOINT"))
            .apiEndpoint(getEnv(env, "API_ENDPOINT", "https://api.deploys.app"))
            .token(requireEnv(env, "TOKEN"))
            .httpPort(getInt(env, "HTTP_PORT", 8080))
            .requestTimeout(Duration.ofSeconds(getInt(env, "REQUEST_TIMEOUT_SEC", 10)))
            .projectInterval(Duration.ofSeconds(getInt(env, "PROJECT_INTERVAL_SEC", 1800)))
            .deploymentInterval(Duration.ofSeconds(getInt(env, "DEPLOYMENT_INTERVAL_SEC", 60)))
            .projectConcurrency(getInt(env, "PROJECT_CONCURRENCY", 10))
            .finalizationCutoffHour(getInt(env, "FINALIZATION_CUTOFF_HOUR", 5))
            .build();

        requirePositive("REQUEST_TIMEOUT_SEC", config.requestTimeout.getSeconds());
        requirePositive("PROJECT_INTERVAL_SEC", config.projectInterval.getSeconds());
        requirePositive("DEPLOYMENT_INTERVAL_SEC", config.deploymentInterval.getSeconds());
        requirePositive("PROJECT_CONCURRENCY", config.projectConcurrency);
        if (config.httpPort < 0 || config.httpPort > 65535) {
            throw new IllegalStateException("HTTP_PORT must be within 0..65535, got " + config.httpPort);
        }
        if (config.finalizationCutoffHour < 0 || config.finalizationCutoffHour > 23) {
            throw new IllegalStateException("FINALIZATION_CUTOFF_HOUR must be within 0..23, got " + config.finalizationCutoffHour);
        }
        return config;
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value != null ? value : defaultValue;
    }

    private static int getInt(Function<String, String> env, String key, int defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Environment variable " + key + " is not an integer: " + value, e);
        }
    }

    private static String requireEnv(Function<String, String> env, String key) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            throw new IllegalStateException("Missing required environment variable " + key);
        }
        return value;
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalStateException(key + " must be greater than 0, got " + value);
        }
    }
}
