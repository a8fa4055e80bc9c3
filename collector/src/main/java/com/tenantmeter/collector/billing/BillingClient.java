package com.tenantmeter.collector.billing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tenantmeter.core.model.DeploymentUsageReport;
import com.tenantmeter.core.model.DiskUsageReport;
import com.tenantmeter.core.model.Project;
import com.tenantmeter.core.model.ProjectUsageReport;
import com.tenantmeter.core.util.JsonUtils;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Billing API client built on reactor-netty HttpClient.
 * <p>
 * Every call is a JSON {@code POST <endpoint>/<method>} authenticated with a bearer token.
 * Calls carry a fixed response timeout and are never retried.
 * </p>
 */
public class BillingClient implements IBillingClient {
    private static final Logger log = LoggerFactory.getLogger(BillingClient.class);

    static final String METHOD_LOCATION = "collector.location";
    static final String METHOD_SET_PROJECT_USAGE = "collector.setProjectUsage";
    static final String METHOD_SET_DEPLOYMENT_USAGE = "collector.setDeploymentUsage";
    static final String METHOD_SET_DISK_USAGE = "collector.setDiskUsage";

    private final HttpClient httpClient;

    /**
     * Creates a billing API client.
     *
     * @param endpoint API base URL (e.g. "https://api.deploys.app")
     * @param token    bearer token
     * @param timeout  connect and response timeout of every call
     */
    public BillingClient(String endpoint, String token, Duration timeout) {
        this.httpClient = HttpClient.create()
            .baseUrl(endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint)
            .headers(h -> h
                .set(HttpHeaderNames.AUTHORIZATION, "Bearer " + token)
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .responseTimeout(timeout);

        log.info("BillingClient initialized with {}", endpoint);
    }

    @Override
    public Mono<List<Project>> listProjectsByLocation(String location) {
        return call(METHOD_LOCATION, new ApiMessages.LocationRequest(location))
            .map(response -> {
                if (response.getResult() == null || response.getResult().isNull()) {
                    return Collections.<Project>emptyList();
                }
                try {
                    ApiMessages.LocationResult result =
                        JsonUtils.mapper().treeToValue(response.getResult(), ApiMessages.LocationResult.class);
                    return result.getProjects() != null ? result.getProjects() : Collections.<Project>emptyList();
                } catch (JsonProcessingException e) {
                    throw new BillingException(METHOD_LOCATION + ": malformed result", e);
                }
            });
    }

    @Override
    public Mono<Void> submitProjectUsage(ProjectUsageReport report) {
        return call(METHOD_SET_PROJECT_USAGE, report).then();
    }

    @Override
    public Mono<Void> submitDeploymentUsage(DeploymentUsageReport report) {
        return call(METHOD_SET_DEPLOYMENT_USAGE, report).then();
    }

    @Override
    public Mono<Void> submitDiskUsage(DiskUsageReport report) {
        return call(METHOD_SET_DISK_USAGE, report).then();
    }

    private Mono<ApiMessages.ApiResponse> call(String method, Object request) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(request))
            .flatMap(json -> {
                log.debug("Calling billing API {}", method);
                return httpClient.post()
                    .uri("/" + method)
                    .send(ByteBufFlux.fromString(Mono.just(json)))
                    .responseSingle((response, body) -> body.asString()
                        .defaultIfEmpty("")
                        .map(text -> decode(method, response.status().code(), text)));
            })
            .onErrorMap(err -> !(err instanceof BillingException),
                err -> new BillingException(method + ": " + describe(err), err));
    }

    private static ApiMessages.ApiResponse decode(String method, int statusCode, String body) {
        if (body.isEmpty()) {
            throw new BillingException(method + ": empty response body (HTTP " + statusCode + ")");
        }

        ApiMessages.ApiResponse response;
        try {
            response = JsonUtils.readValue(body, ApiMessages.ApiResponse.class);
        } catch (RuntimeException e) {
            throw new BillingException(method + ": malformed response body (HTTP " + statusCode + ")", e);
        }

        if (!response.isOk()) {
            String message = response.getError() != null ? response.getError().getMessage() : null;
            throw new BillingException(method + ": " + (message != null ? message : "HTTP " + statusCode));
        }
        return response;
    }

    private static String describe(Throwable err) {
        return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
    }
}
