package com.tenantmeter.collector.prom;

import com.tenantmeter.core.model.InstanceVector;
import com.tenantmeter.core.model.RangePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Wrapper for a successful Prometheus query result with strict, typed accessors.
 * <p>
 * Every accessor checks the shape the caller expects and throws {@link PrometheusQueryException}
 * instead of falling back to a default. Sample values are returned as the raw strings the store sent.
 * </p>
 */
public class PrometheusQueryResult {
    private static final Logger log = LoggerFactory.getLogger(PrometheusQueryResult.class);

    static final String LABEL_POD = "pod";
    static final String LABEL_SERVICE = "service_name";
    static final String LABEL_VOLUME = "persistentvolumeclaim";

    private final List<PrometheusResponse.PrometheusResult> results;

    private PrometheusQueryResult(List<PrometheusResponse.PrometheusResult> results) {
        this.results = results != null ? results : Collections.emptyList();
    }

    /**
     * Creates a result from a Prometheus API response.
     *
     * @param response decoded response envelope
     * @return the result
     * @throws PrometheusQueryException if the response is missing or its status is not "success"
     */
    public static PrometheusQueryResult from(PrometheusResponse response) {
        if (response == null) {
            throw new PrometheusQueryException("empty response");
        }
        if (!"success".equals(response.getStatus())) {
            throw new PrometheusQueryException(String.format("status %s: %s %s",
                response.getStatus(), response.getErrorType(), response.getError()));
        }
        if (response.getData() == null) {
            return new PrometheusQueryResult(Collections.emptyList());
        }
        return new PrometheusQueryResult(response.getData().getResult());
    }

    /**
     * Gets the value of a query that must return exactly one sample (e.g. {@code sum(...) or vector(0)}).
     *
     * @return the raw value string
     */
    public String getScalarValue() {
        if (results.size() != 1) {
            throw new PrometheusQueryException("expected exactly 1 result, got " + results.size());
        }
        return valueOf(results.get(0).getValue());
    }

    /**
     * Gets one sample per pod or service. Series carrying neither label are skipped.
     */
    public List<InstanceVector> getPodVectors() {
        List<InstanceVector> vectors = new ArrayList<>(results.size());
        for (PrometheusResponse.PrometheusResult result : results) {
            String pod = label(result, LABEL_POD);
            String service = label(result, LABEL_SERVICE);
            if (pod.isEmpty() && service.isEmpty()) {
                log.debug("Skipping series without pod or service label: {}", result.getMetric());
                continue;
            }

            vectors.add(InstanceVector.builder()
                .podName(pod)
                .serviceName(service)
                .timestampUnix((long) timestampOf(result.getValue()))
                .value(valueOf(result.getValue()))
                .build());
        }
        return vectors;
    }

    /**
     * Gets one sample per persistent volume claim. Series without the claim label are skipped.
     */
    public List<InstanceVector> getVolumeVectors() {
        List<InstanceVector> vectors = new ArrayList<>(results.size());
        for (PrometheusResponse.PrometheusResult result : results) {
            String volume = label(result, LABEL_VOLUME);
            if (volume.isEmpty()) {
                log.debug("Skipping series without volume label: {}", result.getMetric());
                continue;
            }

            vectors.add(InstanceVector.builder()
                .volumeName(volume)
                .timestampUnix((long) timestampOf(result.getValue()))
                .value(valueOf(result.getValue()))
                .build());
        }
        return vectors;
    }

    /**
     * Gets the points of a range query that must return exactly one series.
     */
    public List<RangePoint> getRangePoints() {
        if (results.size() != 1) {
            throw new PrometheusQueryException("expected exactly 1 series, got " + results.size());
        }
        List<List<Object>> values = results.get(0).getValues();
        if (values == null) {
            return Collections.emptyList();
        }

        List<RangePoint> points = new ArrayList<>(values.size());
        for (List<Object> pair : values) {
            points.add(new RangePoint(timestampOf(pair), valueOf(pair)));
        }
        return points;
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public int size() {
        return results.size();
    }

    // Prometheus returns [<unix seconds as float>, "<value>"]
    private static double timestampOf(List<Object> pair) {
        checkPair(pair);
        if (pair.get(0) instanceof Number ts) {
            return ts.doubleValue();
        }
        throw new PrometheusQueryException("sample timestamp is not a number: " + pair.get(0));
    }

    private static String valueOf(List<Object> pair) {
        checkPair(pair);
        if (pair.get(1) instanceof String value) {
            return value;
        }
        throw new PrometheusQueryException("sample value is not a string: " + pair.get(1));
    }

    private static void checkPair(List<Object> pair) {
        if (pair == null || pair.size() != 2) {
            throw new PrometheusQueryException("sample is not a [timestamp, value] pair: " + pair);
        }
    }

    private static String label(PrometheusResponse.PrometheusResult result, String name) {
        Map<String, String> metric = result.getMetric();
        if (metric == null) {
            return "";
        }
        String value = metric.get(name);
        return value != null ? value : "";
    }
}
