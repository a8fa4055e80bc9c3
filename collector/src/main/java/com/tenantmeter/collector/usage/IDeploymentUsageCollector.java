package com.tenantmeter.collector.usage;

import reactor.core.publisher.Mono;

/**
 * Collects and submits current per-deployment and per-disk usage across the namespace.
 * The returned Mono never errors: failures are handled per metric kind.
 */
public interface IDeploymentUsageCollector {
    Mono<Void> collect();
}
