package com.tenantmeter.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * A deployment metric sample attributed to its owning project.
 */
@Value
@Builder
public class DeploymentUsageItem {
    long projectId;
    String deploymentName;

    /**
     * Metric kind, e.g. "cpu_usage".
     */
    String name;

    /**
     * Pod or service name the sample came from.
     */
    String pod;

    double value;

    /**
     * Sample time in unix seconds.
     */
    long at;
}
