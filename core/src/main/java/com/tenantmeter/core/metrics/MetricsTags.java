package com.tenantmeter.core.metrics;

/**
 * Standard tag keys and values for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    /**
     * Tag key for the collector's location.
     */
    public static final String LOCATION = "location";

    /**
     * Tag key for the cycle: {@link #CYCLE_PROJECT} or {@link #CYCLE_DEPLOYMENT}.
     */
    public static final String CYCLE = "cycle";

    /**
     * Tag key for the metric kind (e.g. cpu_usage, disk_size).
     */
    public static final String METRIC = "metric";

    /**
     * Tag key for the report family: {@link #KIND_DEPLOYMENT} or {@link #KIND_DISK}.
     */
    public static final String KIND = "kind";

    /**
     * Tag key for failure reason: {@link #REASON_QUERY} or {@link #REASON_SUBMIT}.
     */
    public static final String REASON = "reason";

    public static final String CYCLE_PROJECT = "project";
    public static final String CYCLE_DEPLOYMENT = "deployment";

    public static final String KIND_DEPLOYMENT = "deployment";
    public static final String KIND_DISK = "disk";

    public static final String REASON_QUERY = "query";
    public static final String REASON_SUBMIT = "submit";
}
