package com.tenantmeter.collector;

import com.tenantmeter.collector.billing.BillingClient;
import com.tenantmeter.collector.billing.IBillingClient;
import com.tenantmeter.collector.config.CollectorConfig;
import com.tenantmeter.collector.http.HttpServer;
import com.tenantmeter.collector.metrics.PrometheusMetricsExporter;
import com.tenantmeter.collector.prom.IMetricsQueryGateway;
import com.tenantmeter.collector.prom.PrometheusQueryClient;
import com.tenantmeter.collector.prom.UsageQueries;
import com.tenantmeter.collector.schedule.UsageScheduler;
import com.tenantmeter.collector.usage.DeploymentUsageCollector;
import com.tenantmeter.collector.usage.ProjectUsageCollector;
import com.tenantmeter.core.window.UsageWindowCalculator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

public class CollectorApp {
    private static final Logger log = LoggerFactory.getLogger(CollectorApp.class);

    private static final Duration DRAIN_TIMEOUT = Duration.ofMinutes(2);

    public static void main(String[] args) {
        CollectorConfig config = CollectorConfig.fromEnv();

        log.info("Starting usage collector");
        log.info("  Location: {}", config.getLocation());
        log.info("  Namespace: {}", config.getNamespace());
        log.info("  Prometheus: {}", config.getPromEndpoint());
        log.info("  Billing API: {}", config.getApiEndpoint());

        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getLocation());
        MeterRegistry registry = metricsExporter.getRegistry();

        IMetricsQueryGateway gateway = new PrometheusQueryClient(config.getPromEndpoint(), config.getRequestTimeout());
        IBillingClient billingClient = new BillingClient(config.getApiEndpoint(), config.getToken(), config.getRequestTimeout());
        UsageQueries queries = new UsageQueries(config.getNamespace());

        ProjectUsageCollector projectCollector = new ProjectUsageCollector(
            config.getLocation(),
            gateway,
            billingClient,
            queries,
            new UsageWindowCalculator(config.getFinalizationCutoffHour()),
            Clock.systemUTC(),
            registry
        );
        DeploymentUsageCollector deploymentCollector = new DeploymentUsageCollector(
            config.getLocation(),
            gateway,
            billingClient,
            queries,
            registry
        );
        UsageScheduler scheduler = new UsageScheduler(config, billingClient, projectCollector, deploymentCollector, registry);

        HttpServer httpServer = new HttpServer(config.getHttpPort(), metricsExporter);
        httpServer.start();

        handleShutDown(scheduler, httpServer);

        log.info("Usage collector is ready");

        scheduler.run().block();
    }

    private static void handleShutDown(UsageScheduler scheduler, HttpServer httpServer) {
        // Graceful shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");

            scheduler.shutdown();
            if (!scheduler.awaitTermination(DRAIN_TIMEOUT)) {
                log.warn("Cycles did not finish within {}", DRAIN_TIMEOUT);
            }

            httpServer.stop();

            log.info("Shutdown complete");
        }));
    }
}
