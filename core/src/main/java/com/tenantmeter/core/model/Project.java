package com.tenantmeter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A tenant project active in the collector's location.
 * <p>
 * Discovered fresh at the start of every project cycle and never cached across cycles.
 * Location membership is implied by the discovery request: every project returned for
 * {@code collector.location} belongs to the configured {@code LOCATION}, which is why only the
 * id is carried here. Reports name the location themselves.
 * </p>
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class Project {
    /**
     * Tenant-scoped project identifier.
     */
    @JsonProperty("id")
    long id;

    @JsonCreator
    public Project(@JsonProperty("id") long id) {
        this.id = id;
    }
}
