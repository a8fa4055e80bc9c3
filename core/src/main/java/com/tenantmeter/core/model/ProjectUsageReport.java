package com.tenantmeter.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated usage of one project over one day window.
 */
@Value
@Builder
public class ProjectUsageReport {
    String location;

    long projectId;

    /**
     * Start of the window the resources were integrated over, always a UTC midnight.
     */
    Instant at;

    @Singular
    List<ProjectUsageResource> resources;

    @JsonIgnore
    public boolean isEmpty() {
        return resources.isEmpty();
    }
}
