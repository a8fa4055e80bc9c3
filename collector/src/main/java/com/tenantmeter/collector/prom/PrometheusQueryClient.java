package com.tenantmeter.collector.prom;

import com.tenantmeter.core.model.InstanceVector;
import com.tenantmeter.core.model.RangePoint;
import com.tenantmeter.core.util.JsonUtils;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;

/**
 * Prometheus HTTP API client built on reactor-netty HttpClient.
 * <p>
 * Requests carry a fixed response timeout and are never retried; a failed query is left to the
 * caller's failure policy and picked up again by the next cycle.
 * </p>
 */
public class PrometheusQueryClient implements IMetricsQueryGateway {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryClient.class);

    private static final String QUERY_PATH = "/api/v1/query";
    private static final String QUERY_RANGE_PATH = "/api/v1/query_range";

    private final HttpClient httpClient;

    /**
     * Creates a Prometheus query client.
     *
     * @param endpoint Prometheus base URL (e.g. "http://prometheus-service.monitoring.svc.cluster.local:9090")
     * @param timeout  connect and response timeout of every request
     */
    public PrometheusQueryClient(String endpoint, Duration timeout) {
        this.httpClient = HttpClient.create()
            .baseUrl(stripTrailingSlash(endpoint))
            .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .responseTimeout(timeout);

        log.info("PrometheusQueryClient initialized with {}", endpoint);
    }

    @Override
    public Mono<String> queryScalar(String query, Instant time) {
        String uri = QUERY_PATH + "?query=" + encode(query) + "&time=" + time.getEpochSecond();
        return execute(uri, query, PrometheusQueryResult::getScalarValue);
    }

    @Override
    public Mono<List<InstanceVector>> queryVector(String query) {
        return execute(QUERY_PATH + "?query=" + encode(query), query, PrometheusQueryResult::getPodVectors);
    }

    @Override
    public Mono<List<InstanceVector>> queryVolumeVector(String query) {
        return execute(QUERY_PATH + "?query=" + encode(query), query, PrometheusQueryResult::getVolumeVectors);
    }

    @Override
    public Mono<List<RangePoint>> queryRangeMatrix(String query, Instant start, Instant end, Duration step) {
        String uri = QUERY_RANGE_PATH + "?query=" + encode(query)
            + "&start=" + start.getEpochSecond()
            + "&end=" + end.getEpochSecond()
            + "&step=" + step.getSeconds();
        return execute(uri, query, PrometheusQueryResult::getRangePoints);
    }

    private <T> Mono<T> execute(String uri, String query, Function<PrometheusQueryResult, T> extractor) {
        log.debug("Executing Prometheus query: {}", query);

        return httpClient.get()
            .uri(uri)
            .responseSingle((response, body) -> body.asString()
                .defaultIfEmpty("")
                .map(text -> decode(response.status().code(), text)))
            .map(extractor)
            .onErrorMap(err -> !(err instanceof PrometheusQueryException),
                err -> new PrometheusQueryException("query failed: " + describe(err), err));
    }

    // Prometheus sends the JSON envelope on 4xx/5xx as well, so the body decides
    private static PrometheusQueryResult decode(int statusCode, String body) {
        if (body.isEmpty()) {
            throw new PrometheusQueryException("empty response body (HTTP " + statusCode + ")");
        }

        PrometheusResponse response;
        try {
            response = JsonUtils.readValue(body, PrometheusResponse.class);
        } catch (RuntimeException e) {
            throw new PrometheusQueryException("malformed response body (HTTP " + statusCode + ")", e);
        }
        return PrometheusQueryResult.from(response);
    }

    private static String describe(Throwable err) {
        return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
    }

    private static String encode(String query) {
        return URLEncoder.encode(query, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String endpoint) {
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
