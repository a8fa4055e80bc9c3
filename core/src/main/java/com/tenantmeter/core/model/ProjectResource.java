package com.tenantmeter.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Daily project resources, in the order they are collected and reported.
 */
@Getter
@RequiredArgsConstructor
public enum ProjectResource {
    /**
     * CPU-seconds consumed over the window.
     */
    CPU_USAGE("cpu_usage"),
    /**
     * Requested CPU integrated over the elapsed seconds.
     */
    CPU("cpu"),
    /**
     * Requested memory bytes integrated over the scrape interval.
     */
    MEMORY("memory"),
    /**
     * Bytes transmitted, max-over-window minus min-over-window.
     */
    EGRESS("egress"),
    /**
     * Requested storage in GiB-hours.
     */
    DISK("disk"),
    /**
     * Available replicas integrated over the elapsed seconds.
     */
    REPLICA("replica");

    private final String resourceName;
}
