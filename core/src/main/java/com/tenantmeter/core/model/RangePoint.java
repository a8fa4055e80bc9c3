package com.tenantmeter.core.model;

import lombok.Value;

/**
 * A {@code [timestamp, value]} pair of a range query series.
 */
@Value
public class RangePoint {
    double timestamp;
    String value;
}
