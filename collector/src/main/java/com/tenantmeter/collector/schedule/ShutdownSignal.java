package com.tenantmeter.collector.schedule;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * One-shot shutdown signal shared by both cycles. Late subscribers observe the signal immediately.
 */
public class ShutdownSignal {
    private final Sinks.Empty<Void> sink = Sinks.empty();
    private volatile boolean signaled;

    public void signal() {
        signaled = true;
        sink.tryEmitEmpty();
    }

    public boolean isSignaled() {
        return signaled;
    }

    /**
     * Completes when shutdown is signalled.
     */
    public Mono<Void> asMono() {
        return sink.asMono();
    }
}
