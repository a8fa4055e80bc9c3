package com.tenantmeter.collector.http;

import com.tenantmeter.collector.metrics.PrometheusMetricsExporter;
import com.tenantmeter.core.metrics.MetricsNames;
import com.tenantmeter.core.metrics.MetricsTags;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.netty.DisposableServer;
import reactor.netty.http.client.HttpClient;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class HttpServerTest {

    private PrometheusMetricsExporter exporter;
    private HttpServer httpServer;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        exporter = new PrometheusMetricsExporter("gke.cluster-rcf2");
        httpServer = new HttpServer(0, exporter);
        DisposableServer server = httpServer.start();
        client = HttpClient.create().baseUrl("http://localhost:" + server.port());
    }

    @AfterEach
    void tearDown() {
        httpServer.stop();
    }

    @Test
    void testHealthz() {
        StepVerifier.create(client.get().uri("/healthz")
                .responseSingle((res, body) -> body.asString().map(text -> res.status().code() + " " + text)))
            .expectNext("200 OK")
            .verifyComplete();
    }

    @Test
    void testMetricsScrape() {
        exporter.getRegistry().counter(MetricsNames.CYCLE_RUNS_TOTAL, MetricsTags.CYCLE, MetricsTags.CYCLE_DEPLOYMENT)
            .increment();

        StepVerifier.create(client.get().uri("/metrics")
                .responseSingle((res, body) -> body.asString()))
            .assertNext(text -> {
                assertTrue(text.contains("collector_cycle_runs_total"));
                assertTrue(text.contains("location=\"gke.cluster-rcf2\""));
            })
            .verifyComplete();
    }

    @Test
    void testUnknownPathIsNotFound() {
        StepVerifier.create(client.get().uri("/nope").response())
            .assertNext(res -> assertEquals(404, res.status().code()))
            .verifyComplete();
    }
}
