package com.tenantmeter.collector.metrics;

import com.tenantmeter.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Backs the collector's {@code /metrics} endpoint.
 * <p>
 * The cycle, window and metric-kind counters of {@code UsageScheduler} and the two usage collectors are
 * registered on {@link #getRegistry()}, the global composite registry. A Prometheus registry is attached
 * to it, and every series is tagged with the collector's {@code location}.
 * </p>
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String location) {
        this.registry = Metrics.REGISTRY;

        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        }

        registry.config().commonTags(MetricsTags.LOCATION, location);
        log.info("Metrics exporter initialized for location {}", location);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
