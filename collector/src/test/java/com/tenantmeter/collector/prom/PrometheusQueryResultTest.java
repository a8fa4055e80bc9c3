package com.tenantmeter.collector.prom;

import com.tenantmeter.core.model.InstanceVector;
import com.tenantmeter.core.model.RangePoint;
import com.tenantmeter.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusQueryResultTest {

    private static PrometheusQueryResult decode(String json) {
        return PrometheusQueryResult.from(JsonUtils.readValue(json, PrometheusResponse.class));
    }

    @Test
    void testScalarValueOfSingleSample() {
        PrometheusQueryResult result = decode("""
            {"status":"success","data":{"resultType":"vector","result":[
              {"metric":{},"value":[1760918400,"1523.75"]}]}}
            """);

        assertEquals("1523.75", result.getScalarValue());
    }

    @Test
    void testScalarRequiresExactlyOneSample() {
        PrometheusQueryResult none = decode("""
            {"status":"success","data":{"resultType":"vector","result":[]}}
            """);
        PrometheusQueryResult two = decode("""
            {"status":"success","data":{"resultType":"vector","result":[
              {"metric":{"pod":"a"},"value":[1760918400,"1"]},
              {"metric":{"pod":"b"},"value":[1760918400,"2"]}]}}
            """);

        assertThrows(PrometheusQueryException.class, none::getScalarValue);
        assertThrows(PrometheusQueryException.class, two::getScalarValue);
    }

    @Test
    void testErrorStatusFails() {
        PrometheusQueryException error = assertThrows(PrometheusQueryException.class, () -> decode("""
            {"status":"error","errorType":"bad_data","error":"1:5: parse error: unexpected end of input"}
            """));

        assertTrue(error.getMessage().contains("bad_data"));
        assertTrue(error.getMessage().contains("parse error"));
    }

    @Test
    void testMalformedSampleFails() {
        PrometheusQueryResult missingValue = decode("""
            {"status":"success","data":{"resultType":"vector","result":[
              {"metric":{},"value":[1760918400]}]}}
            """);
        PrometheusQueryResult numericValue = decode("""
            {"status":"success","data":{"resultType":"vector","result":[
              {"metric":{},"value":[1760918400,42]}]}}
            """);
        PrometheusQueryResult textTimestamp = decode("""
            {"status":"success","data":{"resultType":"vector","result":[
              {"metric":{"pod":"web-42-7d9f8b6c5-x2kqp"},"value":["now","42"]}]}}
            """);

        assertThrows(PrometheusQueryException.class, missingValue::getScalarValue);
        assertThrows(PrometheusQueryException.class, numericValue::getScalarValue);
        assertThrows(PrometheusQueryException.class, textTimestamp::getPodVectors);
    }

    @Test
    void testPodVectorsSkipUnlabeledSeries() {
        PrometheusQueryResult result = decode("""
            {"status":"success","data":{"resultType":"vector","result":[
              {"metric":{"pod":"web-42-7d9f8b6c5-x2kqp","container":"web"},"value":[1760918400.781,"0.25"]},
              {"metric":{"service_name":"api-15"},"value":[1760918401,"NaN"]},
              {"metric":{"instance":"10.0.0.7:9100"},"value":[1760918400,"9"]}]}}
            """);

        List<InstanceVector> vectors = result.getPodVectors();

        assertEquals(2, vectors.size());
        assertEquals("web-42-7d9f8b6c5-x2kqp", vectors.get(0).getPodName());
        assertFalse(vectors.get(0).hasServiceName());
        assertEquals(1760918400L, vectors.get(0).getTimestampUnix());
        assertEquals("0.25", vectors.get(0).getValue());
        assertEquals("api-15", vectors.get(1).getServiceName());
        assertFalse(vectors.get(1).hasPodName());
        assertEquals("NaN", vectors.get(1).getValue());
    }

    @Test
    void testVolumeVectors() {
        PrometheusQueryResult result = decode("""
            {"status":"success","data":{"resultType":"vector","result":[
              {"metric":{"persistentvolumeclaim":"data-7"},"value":[1760918400,"10737418240"]},
              {"metric":{"pod":"web-42-7d9f8b6c5-x2kqp"},"value":[1760918400,"1"]}]}}
            """);

        List<InstanceVector> vectors = result.getVolumeVectors();

        assertEquals(1, vectors.size());
        assertEquals("data-7", vectors.get(0).getVolumeName());
        assertEquals("10737418240", vectors.get(0).getValue());
    }

    @Test
    void testRangePoints() {
        PrometheusQueryResult result = decode("""
            {"status":"success","data":{"resultType":"matrix","result":[
              {"metric":{},"values":[[1760918400,"1"],[1760922000,"2.5"]]}]}}
            """);

        List<RangePoint> points = result.getRangePoints();

        assertEquals(2, points.size());
        assertEquals(1760918400.0, points.get(0).getTimestamp());
        assertEquals("2.5", points.get(1).getValue());
    }
}
