package com.tenantmeter.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One UTC calendar day over which project usage is integrated.
 */
@Value
@Builder(toBuilder = true)
public class UsageWindow {
    /**
     * UTC midnight opening the day.
     */
    Instant start;

    /**
     * UTC midnight closing the day (start + 1 day). Queries are evaluated at this instant.
     */
    Instant end;

    /**
     * Lookback expression handed to range-vector selectors (e.g. "1d").
     */
    String durationLabel;

    /**
     * Seconds of the day elapsed up to now, within [0, 86400].
     */
    long rangeSeconds;
}
