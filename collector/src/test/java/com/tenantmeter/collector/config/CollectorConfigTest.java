package com.tenantmeter.collector.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CollectorConfigTest {

    private static Map<String, String> requiredOnly() {
        Map<String, String> env = new HashMap<>();
        env.put("LOCATION", "gke.cluster-rcf2");
        env.put("PROM_ENDPOINT", "http://prometheus:9090");
        env.put("TOKEN", "s3cr3t");
        return env;
    }

    @Test
    void testDefaults() {
        CollectorConfig config = CollectorConfig.load(requiredOnly()::get);

        assertEquals("gke.cluster-rcf2", config.getLocation());
        assertEquals("https://api.deploys.app", config.getApiEndpoint());
        assertEquals(8080, config.getHttpPort());
        assertEquals(Duration.ofSeconds(10), config.getRequestTimeout());
        assertEquals(Duration.ofMinutes(30), config.getProjectInterval());
        assertEquals(Duration.ofMinutes(1), config.getDeploymentInterval());
        assertEquals(10, config.getProjectConcurrency());
        assertEquals(5, config.getFinalizationCutoffHour());
    }

    @Test
    void testOverrides() {
        Map<String, String> env = requiredOnly();
        env.put("PROJECT_CONCURRENCY", "4");
        env.put("DEPLOYMENT_INTERVAL_SEC", "30");

        CollectorConfig config = CollectorConfig.load(env::get);

        assertEquals(4, config.getProjectConcurrency());
        assertEquals(Duration.ofSeconds(30), config.getDeploymentInterval());
    }

    @Test
    void testMissingRequiredVariable() {
        Map<String, String> env = requiredOnly();
        env.remove("TOKEN");

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> CollectorConfig.load(env::get));
        assertTrue(error.getMessage().contains("TOKEN"));
    }

    @Test
    void testNonPositiveConcurrencyIsRejected() {
        Map<String, String> env = requiredOnly();
        env.put("PROJECT_CONCURRENCY", "0");

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> CollectorConfig.load(env::get));
        assertTrue(error.getMessage().contains("PROJECT_CONCURRENCY"));

        env.put("PROJECT_CONCURRENCY", "-3");
        assertThrows(IllegalStateException.class, () -> CollectorConfig.load(env::get));
    }

    @Test
    void testNonPositiveIntervalsAreRejected() {
        Map<String, String> projectCycle = requiredOnly();
        projectCycle.put("PROJECT_INTERVAL_SEC", "0");
        Map<String, String> deploymentCycle = requiredOnly();
        deploymentCycle.put("DEPLOYMENT_INTERVAL_SEC", "-60");

        assertThrows(IllegalStateException.class, () -> CollectorConfig.load(projectCycle::get));
        assertThrows(IllegalStateException.class, () -> CollectorConfig.load(deploymentCycle::get));
    }

    @Test
    void testMalformedNumberIsRejected() {
        Map<String, String> env = requiredOnly();
        env.put("FINALIZATION_CUTOFF_HOUR", "five");

        assertThrows(IllegalStateException.class, () -> CollectorConfig.load(env::get));

        env.put("FINALIZATION_CUTOFF_HOUR", "24");
        assertThrows(IllegalStateException.class, () -> CollectorConfig.load(env::get));
    }
}
