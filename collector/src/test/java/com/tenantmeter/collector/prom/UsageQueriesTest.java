package com.tenantmeter.collector.prom;

import com.tenantmeter.core.model.DeploymentMetric;
import com.tenantmeter.core.model.DiskMetric;
import com.tenantmeter.core.model.ProjectResource;
import com.tenantmeter.core.model.UsageWindow;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The expressions are billed against, so they are pinned character for character.
 */
class UsageQueriesTest {

    private final UsageQueries queries = new UsageQueries("tenants");

    private final UsageWindow window = UsageWindow.builder()
        .start(Instant.parse("2026-10-18T00:00:00Z"))
        .end(Instant.parse("2026-10-19T00:00:00Z"))
        .durationLabel("1d")
        .rangeSeconds(50400)
        .build();

    private String summary(ProjectResource resource) {
        return queries.projectSummary(resource, 42, window);
    }

    @Test
    void testCpuUsage() {
        assertEquals("sum(increase(container_cpu_usage_seconds_total{namespace=\"tenants\",name=\"\",pod=~\".*-42-[^-]+-[^-]+$\"}[1d])) or vector(0)",
            summary(ProjectResource.CPU_USAGE));
    }

    @Test
    void testCpuRequests() {
        assertEquals("(sum(avg_over_time(kube_pod_container_resource_requests{namespace=\"tenants\",resource=\"cpu\",pod=~\".*-42-[^-]+-[^-]+$\"}[1d])) or vector(0)) * 50400",
            summary(ProjectResource.CPU));
    }

    @Test
    void testMemoryUsesScrapeInterval() {
        assertEquals("(sum(sum_over_time(kube_pod_container_resource_requests{namespace=\"tenants\",resource=\"memory\",pod=~\".*-42-[^-]+-[^-]+$\"}[1d])) or vector(0)) * 15",
            summary(ProjectResource.MEMORY));
    }

    @Test
    void testEgressIsMaxMinusMin() {
        assertEquals("(sum(max_over_time(container_network_transmit_bytes_total{namespace=\"tenants\",pod=~\".*-42-[^-]+-[^-]+$\"}[1d]))"
                + " - sum(min_over_time(container_network_transmit_bytes_total{namespace=\"tenants\",pod=~\".*-42-[^-]+-[^-]+$\"}[1d])))"
                + " or vector(0)",
            summary(ProjectResource.EGRESS));
    }

    @Test
    void testDiskIsGibHours() {
        assertEquals("((sum(avg_over_time(kube_persistentvolumeclaim_resource_requests_storage_bytes{namespace=\"tenants\",persistentvolumeclaim=~\".*-42$\"}[1d])) or vector(0)) * 50400) / (1024 * 1024 * 1024 * 3600)",
            summary(ProjectResource.DISK));
    }

    @Test
    void testReplica() {
        assertEquals("(sum(avg_over_time(kube_deployment_status_replicas_available{namespace=\"tenants\",deployment=~\".*-42$\"}[1d])) or vector(0)) * 50400",
            summary(ProjectResource.REPLICA));
    }

    @Test
    void testRequestsAreGroupedByService() {
        assertEquals("sum(rate(parapet_requests{ingress_namespace=\"tenants\"}[1m])) by (service_name)",
            queries.deploymentVector(DeploymentMetric.REQUESTS));
    }

    @Test
    void testNamespaceScopedVectors() {
        assertEquals("irate(container_cpu_usage_seconds_total{namespace=\"tenants\",name=\"\"}[1m])",
            queries.deploymentVector(DeploymentMetric.CPU_USAGE));
        assertEquals("kubelet_volume_stats_used_bytes{namespace=\"tenants\"}",
            queries.diskVector(DiskMetric.DISK_USAGE));
    }
}
