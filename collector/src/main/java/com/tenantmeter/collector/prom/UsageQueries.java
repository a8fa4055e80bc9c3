package com.tenantmeter.collector.prom;

import com.tenantmeter.core.model.DeploymentMetric;
import com.tenantmeter.core.model.DiskMetric;
import com.tenantmeter.core.model.ProjectResource;
import com.tenantmeter.core.model.UsageWindow;

/**
 * PromQL expressions for every usage figure the collector reports, scoped to one tenant namespace.
 * <p>
 * Project selectors mirror the naming grammars: pods match {@code .*-<projectId>-[^-]+-[^-]+$},
 * deployments and volume claims match {@code .*-<projectId>$}.
 * </p>
 */
public class UsageQueries {

    // kube-state-metrics scrape interval in seconds
    private static final int SCRAPE_INTERVAL_SECONDS = 15;

    private final String namespace;

    public UsageQueries(String namespace) {
        this.namespace = namespace;
    }

    /**
     * Expression summarizing one project resource over a day window.
     * Every expression falls back to {@code vector(0)}, so it always yields exactly one sample.
     */
    public String projectSummary(ProjectResource resource, long projectId, UsageWindow window) {
        String range = window.getDurationLabel();
        long rangeSeconds = window.getRangeSeconds();

        return switch (resource) {
            case CPU_USAGE -> String.format(
                    "sum(increase(container_cpu_usage_seconds_total{namespace=\"%s\",name=\"\",pod=~\".*-%d-[^-]+-[^-]+$\"}[%s])) or vector(0)",
                    namespace, projectId, range);
            case CPU -> String.format(
                    "(sum(avg_over_time(kube_pod_container_resource_requests{namespace=\"%s\",resource=\"cpu\",pod=~\".*-%d-[^-]+-[^-]+$\"}[%s])) or vector(0)) * %d",
                    namespace, projectId, range, rangeSeconds);
            case MEMORY -> String.format(
                    "(sum(sum_over_time(kube_pod_container_resource_requests{namespace=\"%s\",resource=\"memory\",pod=~\".*-%d-[^-]+-[^-]+$\"}[%s])) or vector(0)) * %d",
                    namespace, projectId, range, SCRAPE_INTERVAL_SECONDS);
            // max - min approximates the counter delta; under-reports when the counter resets more than once
            case EGRESS -> String.format(
                    "(sum(max_over_time(container_network_transmit_bytes_total{namespace=\"%1$s\",pod=~\".*-%2$d-[^-]+-[^-]+$\"}[%3$s]))"
                        + " - sum(min_over_time(container_network_transmit_bytes_total{namespace=\"%1$s\",pod=~\".*-%2$d-[^-]+-[^-]+$\"}[%3$s])))"
                        + " or vector(0)",
                    namespace, projectId, range);
            // GiB-hour
            case DISK -> String.format(
                    "((sum(avg_over_time(kube_persistentvolumeclaim_resource_requests_storage_bytes{namespace=\"%s\",persistentvolumeclaim=~\".*-%d$\"}[%s])) or vector(0)) * %d) / (1024 * 1024 * 1024 * 3600)",
                    namespace, projectId, range, rangeSeconds);
            case REPLICA -> String.format(
                    "(sum(avg_over_time(kube_deployment_status_replicas_available{namespace=\"%s\",deployment=~\".*-%d$\"}[%s])) or vector(0)) * %d",
                    namespace, projectId, range, rangeSeconds);
        };
    }

    /**
     * Instant vector expression over the whole namespace for one deployment metric kind.
     */
    public String deploymentVector(DeploymentMetric metric) {
        return switch (metric) {
            case CPU_USAGE -> String.format("irate(container_cpu_usage_seconds_total{namespace=\"%s\",name=\"\"}[1m])", namespace);
            case CPU -> String.format("kube_pod_container_resource_requests{namespace=\"%s\",resource=\"cpu\"}", namespace);
            case CPU_LIMIT -> String.format("kube_pod_container_resource_limits{namespace=\"%s\",resource=\"cpu\"} > 0", namespace);
            case MEMORY_USAGE -> String.format("container_memory_usage_bytes{namespace=\"%s\",name=\"\"}", namespace);
            case MEMORY -> String.format("kube_pod_container_resource_requests{namespace=\"%s\",resource=\"memory\"} > 0", namespace);
            case MEMORY_LIMIT -> String.format("kube_pod_container_resource_limits{namespace=\"%s\",resource=\"memory\"} > 0", namespace);
            case EGRESS -> String.format("rate(container_network_transmit_bytes_total{namespace=\"%s\"}[1m])", namespace);
            case REQUESTS -> String.format("sum(rate(parapet_requests{ingress_namespace=\"%s\"}[1m])) by (service_name)", namespace);
        };
    }

    /**
     * Instant vector expression over the whole namespace for one disk metric kind.
     */
    public String diskVector(DiskMetric metric) {
        return switch (metric) {
            case DISK_USAGE -> String.format("kubelet_volume_stats_used_bytes{namespace=\"%s\"}", namespace);
            case DISK_SIZE -> String.format("kube_persistentvolumeclaim_resource_requests_storage_bytes{namespace=\"%s\"}", namespace);
        };
    }
}
