package com.tenantmeter.collector.billing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.tenantmeter.core.model.Project;
import lombok.Data;
import lombok.Value;

import java.util.List;

/**
 * Request and response bodies of the billing API that have no counterpart in the usage model.
 */
public final class ApiMessages {
    private ApiMessages() {
    }

    /**
     * Every response is wrapped as {@code {"ok": bool, "result": ..., "error": {"message": ...}}}.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiResponse {
        private boolean ok;
        private JsonNode result;
        private ApiError error;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiError {
        private String message;
    }

    @Value
    public static class LocationRequest {
        String location;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LocationResult {
        private List<Project> projects;
    }
}
