package com.tenantmeter.collector.usage;

import com.tenantmeter.core.model.Project;
import reactor.core.publisher.Mono;

/**
 * Collects and submits the daily usage of one project. The returned Mono never errors:
 * failures are handled per window.
 */
public interface IProjectUsageCollector {
    Mono<Void> collect(Project project);
}
