package com.tenantmeter.core.metrics;

/**
 * Micrometer metric names of the collector itself.
 * <p>
 * <b>Naming convention:</b> {@code collector.<cycle>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Timers: {@code .duration} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: Cycle iterations started.
     * <p>
     * Tags: cycle (project/deployment)
     * </p>
     */
    public static final String CYCLE_RUNS_TOTAL = "collector.cycle.runs.total";

    /**
     * Counter: Cycle iterations aborted before fan-out (e.g. project discovery failed).
     * <p>
     * Tags: cycle
     * </p>
     */
    public static final String CYCLE_FAILURES_TOTAL = "collector.cycle.failures.total";

    /**
     * Timer: Wall time of one cycle iteration.
     * <p>
     * Tags: cycle
     * </p>
     */
    public static final String CYCLE_DURATION = "collector.cycle.duration";

    /**
     * Counter: Project day windows submitted to billing.
     */
    public static final String PROJECT_WINDOWS_SUBMITTED_TOTAL = "collector.project.windows.submitted.total";

    /**
     * Counter: Project day windows dropped.
     * <p>
     * Tags: reason (query/submit)
     * </p>
     */
    public static final String PROJECT_WINDOWS_FAILED_TOTAL = "collector.project.windows.failed.total";

    /**
     * Counter: Attributed items submitted to billing.
     * <p>
     * Tags: metric, kind (deployment/disk)
     * </p>
     */
    public static final String ITEMS_SUBMITTED_TOTAL = "collector.items.submitted.total";

    /**
     * Counter: Metric kinds whose batch was dropped.
     * <p>
     * Tags: metric, kind, reason (query/submit)
     * </p>
     */
    public static final String METRIC_FAILURES_TOTAL = "collector.metric.failures.total";
}
