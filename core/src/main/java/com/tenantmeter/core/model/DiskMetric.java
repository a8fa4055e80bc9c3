package com.tenantmeter.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Per-volume metric kinds reported as disk usage.
 */
@Getter
@RequiredArgsConstructor
public enum DiskMetric {
    DISK_USAGE("disk_usage"),
    DISK_SIZE("disk_size");

    private final String metricName;
}
