package com.tenantmeter.collector.prom;

/**
 * A query against the metrics store failed: transport error, timeout, non-success status
 * or a result that does not have the expected shape.
 */
public class PrometheusQueryException extends RuntimeException {
    public PrometheusQueryException(String message) {
        super(message);
    }

    public PrometheusQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
