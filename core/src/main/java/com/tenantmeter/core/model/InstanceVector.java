package com.tenantmeter.core.model;

import lombok.Builder;
import lombok.Value;

/**
 * One raw sample of an instant vector query, keyed by the runtime instance it was scraped from.
 * <p>
 * Pod/service vectors carry {@code podName} and/or {@code serviceName}; volume vectors carry {@code volumeName}.
 * </p>
 */
@Value
@Builder
public class InstanceVector {
    String podName;
    String serviceName;
    String volumeName;

    /**
     * Sample time in whole unix seconds.
     */
    long timestampUnix;

    /**
     * Raw sample value, not parsed.
     */
    String value;

    public boolean hasPodName() {
        return podName != null && !podName.isEmpty();
    }

    public boolean hasServiceName() {
        return serviceName != null && !serviceName.isEmpty();
    }

    public boolean hasVolumeName() {
        return volumeName != null && !volumeName.isEmpty();
    }
}
