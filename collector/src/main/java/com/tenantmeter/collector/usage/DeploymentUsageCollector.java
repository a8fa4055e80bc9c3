package com.tenantmeter.collector.usage;

import com.tenantmeter.collector.billing.IBillingClient;
import com.tenantmeter.collector.prom.IMetricsQueryGateway;
import com.tenantmeter.collector.prom.UsageQueries;
import com.tenantmeter.core.metrics.MetricsNames;
import com.tenantmeter.core.metrics.MetricsTags;
import com.tenantmeter.core.model.DeploymentMetric;
import com.tenantmeter.core.model.DeploymentUsageItem;
import com.tenantmeter.core.model.DeploymentUsageReport;
import com.tenantmeter.core.model.DiskMetric;
import com.tenantmeter.core.model.DiskUsageItem;
import com.tenantmeter.core.model.DiskUsageReport;
import com.tenantmeter.core.model.InstanceVector;
import com.tenantmeter.core.naming.Attribution;
import com.tenantmeter.core.naming.EntityAttributor;
import com.tenantmeter.core.naming.NameGrammar;
import com.tenantmeter.core.util.SampleValues;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reports the current per-instance usage of every deployment and disk in the namespace.
 * <p>
 * Each of the ten metric kinds is an independent unit: one vector query, attribution of every
 * sample to its project, one batch submission. All units run concurrently and a failed unit
 * never affects the others. Samples that cannot be attributed are dropped; samples whose value
 * cannot be parsed are kept with a value of zero.
 * </p>
 */
public class DeploymentUsageCollector implements IDeploymentUsageCollector {
    private static final Logger log = LoggerFactory.getLogger(DeploymentUsageCollector.class);

    private final String location;
    private final IMetricsQueryGateway gateway;
    private final IBillingClient billingClient;
    private final UsageQueries queries;
    private final MeterRegistry meterRegistry;

    public DeploymentUsageCollector(String location,
                                    IMetricsQueryGateway gateway,
                                    IBillingClient billingClient,
                                    UsageQueries queries,
                                    MeterRegistry meterRegistry) {
        this.location = location;
        this.gateway = gateway;
        this.billingClient = billingClient;
        this.queries = queries;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Mono<Void> collect() {
        List<Mono<Void>> units = new ArrayList<>();
        for (DeploymentMetric metric : DeploymentMetric.values()) {
            units.add(syncDeploymentMetric(metric));
        }
        for (DiskMetric metric : DiskMetric.values()) {
            units.add(syncDiskMetric(metric));
        }

        // Completes once every unit has finished; units never signal errors
        return Mono.when(units);
    }

    Mono<Void> syncDeploymentMetric(DeploymentMetric metric) {
        String name = metric.getMetricName();

        return Mono.defer(() -> {
                log.info("Syncing deployment metric {}", name);
                return gateway.queryVector(queries.deploymentVector(metric));
            })
            .map(vectors -> new DeploymentUsageReport(location, attributeDeployments(name, vectors)))
            .onErrorResume(err -> {
                metricFailed(name, MetricsTags.KIND_DEPLOYMENT, MetricsTags.REASON_QUERY).increment();
                log.error("Failed to query deployment metric {}", name, err);
                return Mono.empty();
            })
            .flatMap(report -> {
                if (report.isEmpty()) {
                    return Mono.empty();
                }
                return billingClient.submitDeploymentUsage(report)
                    .doOnSuccess(v -> itemsSubmitted(name, MetricsTags.KIND_DEPLOYMENT).increment(report.getList().size()))
                    .onErrorResume(err -> {
                        metricFailed(name, MetricsTags.KIND_DEPLOYMENT, MetricsTags.REASON_SUBMIT).increment();
                        log.error("Failed to submit deployment metric {} ({} items)", name, report.getList().size(), err);
                        return Mono.empty();
                    });
            });
    }

    Mono<Void> syncDiskMetric(DiskMetric metric) {
        String name = metric.getMetricName();

        return Mono.defer(() -> {
                log.info("Syncing disk metric {}", name);
                return gateway.queryVolumeVector(queries.diskVector(metric));
            })
            .map(vectors -> new DiskUsageReport(location, attributeDisks(name, vectors)))
            .onErrorResume(err -> {
                metricFailed(name, MetricsTags.KIND_DISK, MetricsTags.REASON_QUERY).increment();
                log.error("Failed to query disk metric {}", name, err);
                return Mono.empty();
            })
            .flatMap(report -> {
                if (report.isEmpty()) {
                    return Mono.empty();
                }
                return billingClient.submitDiskUsage(report)
                    .doOnSuccess(v -> itemsSubmitted(name, MetricsTags.KIND_DISK).increment(report.getList().size()))
                    .onErrorResume(err -> {
                        metricFailed(name, MetricsTags.KIND_DISK, MetricsTags.REASON_SUBMIT).increment();
                        log.error("Failed to submit disk metric {} ({} items)", name, report.getList().size(), err);
                        return Mono.empty();
                    });
            });
    }

    private static List<DeploymentUsageItem> attributeDeployments(String name, List<InstanceVector> vectors) {
        List<DeploymentUsageItem> items = new ArrayList<>(vectors.size());
        for (InstanceVector vector : vectors) {
            String instance;
            Optional<Attribution> owner;
            if (vector.hasPodName()) {
                instance = vector.getPodName();
                owner = EntityAttributor.attribute(instance, NameGrammar.POD);
            } else if (vector.hasServiceName()) {
                instance = vector.getServiceName();
                owner = EntityAttributor.attribute(instance, NameGrammar.SERVICE);
            } else {
                continue;
            }
            if (owner.isEmpty()) {
                continue;
            }

            items.add(DeploymentUsageItem.builder()
                .projectId(owner.get().getProjectId())
                .deploymentName(owner.get().getName())
                .name(name)
                .pod(instance)
                .value(SampleValues.parseOrZero(vector.getValue()))
                .at(vector.getTimestampUnix())
                .build());
        }
        log.debug("Attributed {} of {} {} samples", items.size(), vectors.size(), name);
        return List.copyOf(items);
    }

    private static List<DiskUsageItem> attributeDisks(String name, List<InstanceVector> vectors) {
        List<DiskUsageItem> items = new ArrayList<>(vectors.size());
        for (InstanceVector vector : vectors) {
            Optional<Attribution> owner = EntityAttributor.attribute(vector.getVolumeName(), NameGrammar.VOLUME);
            if (owner.isEmpty()) {
                continue;
            }

            items.add(DiskUsageItem.builder()
                .projectId(owner.get().getProjectId())
                .diskName(owner.get().getName())
                .name(name)
                .value(SampleValues.parseOrZero(vector.getValue()))
                .at(vector.getTimestampUnix())
                .build());
        }
        log.debug("Attributed {} of {} {} samples", items.size(), vectors.size(), name);
        return List.copyOf(items);
    }

    private Counter itemsSubmitted(String metric, String kind) {
        return Counter.builder(MetricsNames.ITEMS_SUBMITTED_TOTAL)
            .tag(MetricsTags.METRIC, metric)
            .tag(MetricsTags.KIND, kind)
            .register(meterRegistry);
    }

    private Counter metricFailed(String metric, String kind, String reason) {
        return Counter.builder(MetricsNames.METRIC_FAILURES_TOTAL)
            .tag(MetricsTags.METRIC, metric)
            .tag(MetricsTags.KIND, kind)
            .tag(MetricsTags.REASON, reason)
            .register(meterRegistry);
    }
}
