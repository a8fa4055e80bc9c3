package com.tenantmeter.collector.schedule;

import com.tenantmeter.collector.billing.IBillingClient;
import com.tenantmeter.collector.config.CollectorConfig;
import com.tenantmeter.collector.usage.IDeploymentUsageCollector;
import com.tenantmeter.collector.usage.IProjectUsageCollector;
import com.tenantmeter.core.metrics.MetricsNames;
import com.tenantmeter.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Drives the two collection cycles until shutdown.
 * <p>
 * <b>Project cycle:</b> discovers the projects of the location, then collects each of them with at most
 * {@code projectConcurrency} projects in flight. A discovery failure skips the whole iteration.
 * </p>
 * <p>
 * <b>Deployment cycle:</b> runs the deployment/disk collector once per iteration.
 * </p>
 * <p>
 * Each cycle runs its first iteration immediately, then waits a full period (or until shutdown) after
 * every iteration, so start times drift by the duration of the work. Shutdown lets the current
 * iterations finish but starts no new project and no new iteration.
 * </p>
 */
public class UsageScheduler {
    private static final Logger log = LoggerFactory.getLogger(UsageScheduler.class);

    private final CollectorConfig config;
    private final IBillingClient billingClient;
    private final IProjectUsageCollector projectCollector;
    private final IDeploymentUsageCollector deploymentCollector;
    private final MeterRegistry meterRegistry;

    private final ShutdownSignal shutdown = new ShutdownSignal();
    private final Sinks.Empty<Void> terminated = Sinks.empty();

    public UsageScheduler(CollectorConfig config,
                          IBillingClient billingClient,
                          IProjectUsageCollector projectCollector,
                          IDeploymentUsageCollector deploymentCollector,
                          MeterRegistry meterRegistry) {
        this.config = config;
        this.billingClient = billingClient;
        this.projectCollector = projectCollector;
        this.deploymentCollector = deploymentCollector;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Runs both cycles.
     *
     * @return Mono completing once both cycles have observed shutdown and finished their current iteration
     */
    public Mono<Void> run() {
        return Mono.when(
                cycle(MetricsTags.CYCLE_PROJECT, config.getProjectInterval(), this::runProjectCycle),
                cycle(MetricsTags.CYCLE_DEPLOYMENT, config.getDeploymentInterval(), this::runDeploymentCycle))
            .doFinally(signal -> {
                terminated.tryEmitEmpty();
                log.info("Usage scheduler stopped");
            });
    }

    /**
     * Signals both cycles to stop after their current iteration.
     */
    public void shutdown() {
        log.info("Shutdown requested, draining current iterations");
        shutdown.signal();
    }

    /**
     * Blocks until {@link #run()} has completed.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitTermination(Duration timeout) {
        return Boolean.TRUE.equals(terminated.asMono()
            .thenReturn(true)
            .timeout(timeout, Mono.just(false))
            .block());
    }

    /**
     * One iteration of the project cycle.
     */
    public Mono<Void> runProjectCycle() {
        String location = config.getLocation();

        return billingClient.listProjectsByLocation(location)
            .doOnNext(projects -> log.info("Discovered {} project(s) in {}", projects.size(), location))
            .onErrorResume(err -> {
                cycleFailed(MetricsTags.CYCLE_PROJECT);
                log.error("Failed to list projects of location {}, skipping iteration", location, err);
                return Mono.empty();
            })
            .flatMapMany(Flux::fromIterable)
            // Projects not yet admitted when shutdown arrives are never started
            .takeUntilOther(shutdown.asMono())
            .flatMap(project -> projectCollector.collect(project)
                    .onErrorResume(err -> {
                        log.error("Unexpected failure collecting project {}", project.getId(), err);
                        return Mono.empty();
                    }),
                config.getProjectConcurrency())
            .then();
    }

    /**
     * One iteration of the deployment cycle.
     */
    public Mono<Void> runDeploymentCycle() {
        return deploymentCollector.collect()
            .onErrorResume(err -> {
                log.error("Unexpected failure collecting deployment usage", err);
                return Mono.empty();
            });
    }

    private Mono<Void> cycle(String name, Duration period, Supplier<Mono<Void>> iteration) {
        return Mono.defer(() -> timed(name, iteration))
            .then(Mono.firstWithSignal(Mono.delay(period).then(), shutdown.asMono()))
            .repeat(() -> !shutdown.isSignaled())
            .then()
            .doOnSubscribe(s -> log.info("Starting {} cycle, period {}", name, period))
            .doOnTerminate(() -> log.info("Stopped {} cycle", name));
    }

    private Mono<Void> timed(String name, Supplier<Mono<Void>> iteration) {
        meterRegistry.counter(MetricsNames.CYCLE_RUNS_TOTAL, MetricsTags.CYCLE, name).increment();
        Timer timer = Timer.builder(MetricsNames.CYCLE_DURATION)
            .tag(MetricsTags.CYCLE, name)
            .register(meterRegistry);
        long startNanos = System.nanoTime();

        log.info("Running {} cycle", name);
        return iteration.get()
            .doFinally(signal -> {
                long elapsed = System.nanoTime() - startNanos;
                timer.record(elapsed, TimeUnit.NANOSECONDS);
                log.info("Finished {} cycle in {} ms", name, TimeUnit.NANOSECONDS.toMillis(elapsed));
            });
    }

    private void cycleFailed(String name) {
        meterRegistry.counter(MetricsNames.CYCLE_FAILURES_TOTAL, MetricsTags.CYCLE, name).increment();
    }
}
