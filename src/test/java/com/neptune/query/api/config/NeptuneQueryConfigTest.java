package com.neptune.query.api.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.Test;

public class NeptuneQueryConfigTest {

    private static Properties properties(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    public void testDefaultsWhenNothingIsSet() {
        NeptuneQueryConfig config = new NeptuneQueryConfig(new Properties(), Collections.emptyMap(), new Properties());

        assertNull(config.getApiToken());
        assertEquals(NeptuneQueryConfig.DEFAULT_API_URL, config.getApiUrl());
        QueryLimits limits = config.getLimits();
        assertEquals(QueryLimits.DEFAULT_MAX_WORKERS, limits.getMaxWorkers());
        assertEquals(QueryLimits.DEFAULT_MAX_REQUEST_SIZE, limits.getMaxRequestSize());
        assertEquals(Duration.ofSeconds(QueryLimits.DEFAULT_HTTP_REQUEST_TIMEOUT_SECONDS),
                limits.getHttpRequestTimeout());
        assertFalse(config.hasRequiredCredentials());
    }

    @Test
    public void testPrecedenceFileThenEnvironmentThenSystemProperties() {
        Properties file = properties(
                NeptuneQueryConfig.API_TOKEN, "from-file",
                NeptuneQueryConfig.PROJECT, "ws/file-project",
                NeptuneQueryConfig.MAX_WORKERS, "4");
        Map<String, String> env = new HashMap<>();
        env.put("NEPTUNE_PROJECT", "ws/env-project");
        env.put("NEPTUNE_QUERY_MAX_WORKERS", "8");
        Properties system = properties("neptune." + NeptuneQueryConfig.MAX_WORKERS, "16", "unrelated.key", "x");

        NeptuneQueryConfig config = new NeptuneQueryConfig(file, env, system);

        assertEquals("from-file", config.getApiToken());
        assertEquals("ws/env-project", config.getProject());
        assertEquals(16, config.getLimits().getMaxWorkers());
        assertNull(config.getProperty("unrelated.key"));
    }

    @Test
    public void testEnvironmentOverridesLimits() {
        Map<String, String> env = new HashMap<>();
        env.put("NEPTUNE_QUERY_SERIES_BATCH_SIZE", " 250 ");
        env.put("NEPTUNE_QUERY_RETRY_MAX_BACKOFF_MILLIS", "1500");
        env.put("NEPTUNE_QUERY_METADATA", "{\"team\":\"x\"}");

        NeptuneQueryConfig config = new NeptuneQueryConfig(new Properties(), env, new Properties());

        assertEquals(250, config.getLimits().getSeriesBatchSize());
        assertEquals(Duration.ofMillis(1500), config.getLimits().getRetryMaxBackoff());
        assertEquals("{\"team\":\"x\"}", config.getQueryMetadata());
    }

    @Test
    public void testInvalidValuesFallBackToDefaults() {
        Properties file = properties(
                NeptuneQueryConfig.MAX_WORKERS, "many",
                NeptuneQueryConfig.SERIES_BATCH_SIZE, "0",
                NeptuneQueryConfig.RETRY_MAX_ATTEMPTS, "-2",
                NeptuneQueryConfig.MAX_REQUEST_SIZE, "99999999999");

        QueryLimits limits = new NeptuneQueryConfig(file, Collections.emptyMap(), new Properties()).getLimits();

        assertEquals(QueryLimits.DEFAULT_MAX_WORKERS, limits.getMaxWorkers());
        assertEquals(QueryLimits.DEFAULT_SERIES_BATCH_SIZE, limits.getSeriesBatchSize());
        assertEquals(QueryLimits.DEFAULT_RETRY_MAX_ATTEMPTS, limits.getRetryMaxAttempts());
        assertEquals(QueryLimits.DEFAULT_MAX_REQUEST_SIZE, limits.getMaxRequestSize());
    }

    @Test
    public void testValidateConfigurationRequiresToken() {
        NeptuneQueryConfig missing = new NeptuneQueryConfig(new Properties(), Collections.emptyMap(), new Properties());
        assertThrows(IllegalStateException.class, missing::validateConfiguration);

        NeptuneQueryConfig blank = new NeptuneQueryConfig(properties(NeptuneQueryConfig.API_TOKEN, "  "),
                Collections.emptyMap(), new Properties());
        assertThrows(IllegalStateException.class, blank::validateConfiguration);

        NeptuneQueryConfig present = new NeptuneQueryConfig(properties(NeptuneQueryConfig.API_TOKEN, "token"),
                Collections.emptyMap(), new Properties());
        assertDoesNotThrow(present::validateConfiguration);
        assertTrue(present.hasRequiredCredentials());
    }

    @Test
    public void testLimitsBuilderRejectsNonPositiveValues() {
        assertThrows(IllegalArgumentException.class, () -> QueryLimits.builder().maxWorkers(0).build());
        assertThrows(IllegalArgumentException.class, () -> QueryLimits.builder().seriesBatchSize(-1).build());
        assertEquals(3, QueryLimits.builder().maxWorkers(3).build().getMaxWorkers());
    }
}
