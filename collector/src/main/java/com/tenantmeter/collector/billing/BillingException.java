package com.tenantmeter.collector.billing;

/**
 * A billing API call failed: transport error, timeout, or a response with {@code ok=false}.
 */
public class BillingException extends RuntimeException {
    public BillingException(String message) {
        super(message);
    }

    public BillingException(String message, Throwable cause) {
        super(message, cause);
    }
}
