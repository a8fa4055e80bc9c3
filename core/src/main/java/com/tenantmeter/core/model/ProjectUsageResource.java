package com.tenantmeter.core.model;

import lombok.Value;

/**
 * A single named usage value of a project. The value is kept exactly as returned by the metrics store.
 */
@Value
public class ProjectUsageResource {
    String name;
    String value;
}
