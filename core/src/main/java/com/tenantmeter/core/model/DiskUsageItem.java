package com.tenantmeter.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * A volume metric sample attributed to its owning project.
 */
@Value
@Builder
public class DiskUsageItem {
    long projectId;
    String diskName;
    String name;
    double value;
    long at;
}
