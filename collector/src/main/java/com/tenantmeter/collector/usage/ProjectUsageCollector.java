package com.tenantmeter.collector.usage;

import com.tenantmeter.collector.billing.IBillingClient;
import com.tenantmeter.collector.prom.IMetricsQueryGateway;
import com.tenantmeter.collector.prom.UsageQueries;
import com.tenantmeter.core.metrics.MetricsNames;
import com.tenantmeter.core.metrics.MetricsTags;
import com.tenantmeter.core.model.Project;
import com.tenantmeter.core.model.ProjectResource;
import com.tenantmeter.core.model.ProjectUsageReport;
import com.tenantmeter.core.model.ProjectUsageResource;
import com.tenantmeter.core.model.UsageWindow;
import com.tenantmeter.core.window.UsageWindowCalculator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Builds the daily usage report of a project.
 * <p>
 * For each day window the six {@link ProjectResource}s are queried one after another, in order.
 * A window is all-or-nothing: the first failed query stops the window, the resources collected
 * so far are discarded and nothing is submitted for it. Other windows and projects are unaffected.
 * </p>
 */
public class ProjectUsageCollector implements IProjectUsageCollector {
    private static final Logger log = LoggerFactory.getLogger(ProjectUsageCollector.class);

    private final String location;
    private final IMetricsQueryGateway gateway;
    private final IBillingClient billingClient;
    private final UsageQueries queries;
    private final UsageWindowCalculator windowCalculator;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public ProjectUsageCollector(String location,
                                 IMetricsQueryGateway gateway,
                                 IBillingClient billingClient,
                                 UsageQueries queries,
                                 UsageWindowCalculator windowCalculator,
                                 Clock clock,
                                 MeterRegistry meterRegistry) {
        this.location = location;
        this.gateway = gateway;
        this.billingClient = billingClient;
        this.queries = queries;
        this.windowCalculator = windowCalculator;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Mono<Void> collect(Project project) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            List<UsageWindow> windows = windowCalculator.windowsAt(now);
            log.info("Syncing project {} ({} window(s))", project.getId(), windows.size());

            return Flux.fromIterable(windows)
                .concatMap(window -> collectWindow(project, window))
                .then();
        });
    }

    /**
     * Collects and submits one day window of a project.
     */
    Mono<Void> collectWindow(Project project, UsageWindow window) {
        return Flux.fromArray(ProjectResource.values())
            .concatMap(resource -> queryResource(project, window, resource))
            .collectList()
            .map(resources -> ProjectUsageReport.builder()
                .location(location)
                .projectId(project.getId())
                .at(window.getStart())
                .resources(resources)
                .build())
            .onErrorResume(err -> {
                windowsFailed(MetricsTags.REASON_QUERY).increment();
                log.warn("Dropping usage of project {} for {}: {}", project.getId(), window.getStart(), err.getMessage());
                return Mono.empty();
            })
            .flatMap(this::submit);
    }

    private Mono<ProjectUsageResource> queryResource(Project project, UsageWindow window, ProjectResource resource) {
        String name = resource.getResourceName();
        String query = queries.projectSummary(resource, project.getId(), window);

        return gateway.queryScalar(query, window.getEnd())
            .doOnNext(value -> log.info("Project {} {} at {}: {}", project.getId(), name, window.getStart(), value))
            .doOnError(err -> log.error("Failed to query {} for project {} at {}", name, project.getId(), window.getStart(), err))
            .map(value -> new ProjectUsageResource(name, value));
    }

    private Mono<Void> submit(ProjectUsageReport report) {
        if (report.isEmpty()) {
            return Mono.empty();
        }

        return billingClient.submitProjectUsage(report)
            .doOnSuccess(v -> {
                meterRegistry.counter(MetricsNames.PROJECT_WINDOWS_SUBMITTED_TOTAL).increment();
                log.debug("Submitted usage of project {} for {}", report.getProjectId(), report.getAt());
            })
            .onErrorResume(err -> {
                windowsFailed(MetricsTags.REASON_SUBMIT).increment();
                log.error("Failed to submit usage of project {} for {}", report.getProjectId(), report.getAt(), err);
                return Mono.empty();
            });
    }

    private Counter windowsFailed(String reason) {
        return Counter.builder(MetricsNames.PROJECT_WINDOWS_FAILED_TOTAL)
            .tag(MetricsTags.REASON, reason)
            .register(meterRegistry);
    }
}
