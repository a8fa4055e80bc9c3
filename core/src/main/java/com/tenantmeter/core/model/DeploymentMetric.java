package com.tenantmeter.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Per-instance metric kinds reported as deployment usage.
 */
@Getter
@RequiredArgsConstructor
public enum DeploymentMetric {
    CPU_USAGE("cpu_usage"),
    CPU("cpu"),
    CPU_LIMIT("cpu_limit"),
    MEMORY_USAGE("memory_usage"),
    MEMORY("memory"),
    MEMORY_LIMIT("memory_limit"),
    EGRESS("egress"),
    REQUESTS("requests");

    private final String metricName;
}
