package com.tenantmeter.collector.prom;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Data class for the Prometheus HTTP API response envelope.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PrometheusResponse {
    private String status;
    private PrometheusData data;
    private String error;
    private String errorType;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusData {
        private String resultType;
        private List<PrometheusResult> result;
    }

    /**
     * One series. Instant queries fill {@code value}, range queries fill {@code values}.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResult {
        private Map<String, String> metric;
        private List<Object> value;
        private List<List<Object>> values;
    }
}
