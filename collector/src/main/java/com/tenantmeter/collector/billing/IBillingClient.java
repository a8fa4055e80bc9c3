package com.tenantmeter.collector.billing;

import com.tenantmeter.core.model.DeploymentUsageReport;
import com.tenantmeter.core.model.DiskUsageReport;
import com.tenantmeter.core.model.Project;
import com.tenantmeter.core.model.ProjectUsageReport;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Interface for the billing/usage API (Dependency Inversion Principle).
 * Failures are signalled as {@link BillingException}.
 */
public interface IBillingClient {
    Mono<List<Project>> listProjectsByLocation(String location);
    Mono<Void> submitProjectUsage(ProjectUsageReport report);
    Mono<Void> submitDeploymentUsage(DeploymentUsageReport report);
    Mono<Void> submitDiskUsage(DiskUsageReport report);
}
