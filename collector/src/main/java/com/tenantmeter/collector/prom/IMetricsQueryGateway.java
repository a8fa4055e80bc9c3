package com.tenantmeter.collector.prom;

import com.tenantmeter.core.model.InstanceVector;
import com.tenantmeter.core.model.RangePoint;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Queries against the upstream metrics store. Each call is exactly one round trip;
 * failures are signalled as {@link PrometheusQueryException}.
 */
public interface IMetricsQueryGateway {
    /**
     * Instant query returning exactly one sample.
     */
    Mono<String> queryScalar(String query, Instant time);

    /**
     * Instant query returning one sample per pod or service.
     */
    Mono<List<InstanceVector>> queryVector(String query);

    /**
     * Instant query returning one sample per persistent volume claim.
     */
    Mono<List<InstanceVector>> queryVolumeVector(String query);

    /**
     * Range query returning exactly one series.
     */
    Mono<List<RangePoint>> queryRangeMatrix(String query, Instant start, Instant end, Duration step);
}
