package com.neptune.query.api.config;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration of the Neptune query client.
 * Supports properties files, environment variables and system properties with precedence:
 * 1. System properties (command line -Dneptune.&lt;key&gt;)
 * 2. Environment variables
 * 3. Properties file (neptune-query.properties)
 * 4. Default values
 */
public class NeptuneQueryConfig {

    private static final Logger logger = LoggerFactory.getLogger(NeptuneQueryConfig.class);

    // Configuration keys
    public static final String API_TOKEN = "apiToken";
    public static final String PROJECT = "project";
    public static final String API_URL = "apiUrl";
    public static final String QUERY_METADATA = "queryMetadata";
    public static final String MAX_WORKERS = "maxWorkers";
    public static final String MAX_REQUEST_SIZE = "maxRequestSize";
    public static final String SYS_ATTRS_BATCH_SIZE = "sysAttrsBatchSize";
    public static final String ATTRIBUTE_VALUES_BATCH_SIZE = "attributeValuesBatchSize";
    public static final String SERIES_BATCH_SIZE = "seriesBatchSize";
    public static final String MAX_ATTRIBUTE_FILTER_SIZE = "maxAttributeFilterSize";
    public static final String HTTP_REQUEST_TIMEOUT_SECONDS = "httpRequestTimeoutSeconds";
    public static final String RETRY_MAX_ATTEMPTS = "retryMaxAttempts";
    public static final String RETRY_INITIAL_BACKOFF_MILLIS = "retryInitialBackoffMillis";
    public static final String RETRY_MAX_BACKOFF_MILLIS = "retryMaxBackoffMillis";

    public static final String DEFAULT_API_URL = "https://app.neptune.ai";
    public static final String DEFAULT_PROPERTIES_FILE = "neptune-query.properties";
    public static final String SYSTEM_PROPERTY_PREFIX = "neptune.";

    /** Environment variable for each key. */
    static final Map<String, String> ENVIRONMENT_KEYS = new LinkedHashMap<>();

    static {
        ENVIRONMENT_KEYS.put("NEPTUNE_API_TOKEN", API_TOKEN);
        ENVIRONMENT_KEYS.put("NEPTUNE_PROJECT", PROJECT);
        ENVIRONMENT_KEYS.put("NEPTUNE_API_URL", API_URL);
        ENVIRONMENT_KEYS.put("NEPTUNE_QUERY_METADATA", QUERY_METADATA);
        ENVIRONMENT_KEYS.put("NEPTUNE_QUERY_MAX_WORKERS", MAX_WORKERS);
        ENVIRONMENT_KEYS.put("NEPTUNE_QUERY_MAX_REQUEST_SIZE", MAX_REQUEST_SIZE);
        ENVIRONMENT_KEYS.put("NEPTUNE_QUERY_SYS_ATTRS_BATCH_SIZE", SYS_ATTRS_BATCH_SIZE);
        ENVIRONMENT_KEYS.put("NEPTUNE_QUERY_ATTRIBUTE_VALUES_BATCH_SIZE", ATTRIBUTE_VALUES_BATCH_SIZE);
        ENVIRONMENT_KEYS.put("NEPTUNE_QUERY_SERIES_BATCH_SIZE", SERIES_BATCH_SIZE);
        ENVIRONMENT_KEYS.put("NEPTUNE_QUERY_MAX_ATTRIBUTE_FILTER_SIZE", MAX_ATTRIBUTE_FILTER_SIZE);
        ENVIRONMENT_KEYS.put("NEPTUNE_HTTP_REQUEST_TIMEOUT_SECONDS", HTTP_REQUEST_TIMEOUT_SECONDS);
        ENVIRONMENT_KEYS.put("NEPTUNE_QUERY_RETRY_MAX_ATTEMPTS", RETRY_MAX_ATTEMPTS);
        ENVIRONMENT_KEYS.put("NEPTUNE_QUERY_RETRY_INITIAL_BACKOFF_MILLIS", RETRY_INITIAL_BACKOFF_MILLIS);
        ENVIRONMENT_KEYS.put("NEPTUNE_QUERY_RETRY_MAX_BACKOFF_MILLIS", RETRY_MAX_BACKOFF_MILLIS);
    }

    private static NeptuneQueryConfig instance;

    private final Properties properties;
    private final QueryLimits limits;

    private NeptuneQueryConfig() {
        this(loadPropertiesFile(DEFAULT_PROPERTIES_FILE), System.getenv(), System.getProperties());
    }

    /**
     * Resolves configuration from explicit sources, lowest precedence first.
     */
    NeptuneQueryConfig(Properties fileProperties, Map<String, String> environment, Properties systemProperties) {
        Properties config = new Properties();
        config.putAll(fileProperties);
        loadFromEnvironmentVariables(config, environment);
        loadFromSystemProperties(config, systemProperties);
        this.properties = config;
        this.limits = resolveLimits();
        logConfigurationStatus();
    }

    /**
     * Get singleton instance of configuration
     */
    public static synchronized NeptuneQueryConfig getInstance() {
        if (instance == null) {
            instance = new NeptuneQueryConfig();
        }
        return instance;
    }

    static Properties loadPropertiesFile(String resource) {
        Properties config = new Properties();
        try (InputStream input = NeptuneQueryConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input != null) {
                config.load(input);
                logger.info("Loaded configuration from {}", resource);
            } else {
                logger.debug("Properties file {} not found in classpath", resource);
            }
        } catch (IOException e) {
            logger.warn("Failed to load properties file {}: {}", resource, e.getMessage());
        }
        return config;
    }

    private static void loadFromEnvironmentVariables(Properties config, Map<String, String> environment) {
        for (Map.Entry<String, String> entry : ENVIRONMENT_KEYS.entrySet()) {
            String value = environment.get(entry.getKey());
            if (value != null && !value.trim().isEmpty()) {
                config.setProperty(entry.getValue(), value.trim());
            }
        }
    }

    private static void loadFromSystemProperties(Properties config, Properties systemProperties) {
        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PROPERTY_PREFIX)) {
                config.setProperty(name.substring(SYSTEM_PROPERTY_PREFIX.length()), systemProperties.getProperty(name));
            }
        }
    }

    private QueryLimits resolveLimits() {
        return QueryLimits.builder()
                .maxWorkers(positiveInt(MAX_WORKERS, QueryLimits.DEFAULT_MAX_WORKERS))
                .maxRequestSize(positiveInt(MAX_REQUEST_SIZE, QueryLimits.DEFAULT_MAX_REQUEST_SIZE))
                .sysAttrsBatchSize(positiveInt(SYS_ATTRS_BATCH_SIZE, QueryLimits.DEFAULT_SYS_ATTRS_BATCH_SIZE))
                .attributeValuesBatchSize(positiveInt(ATTRIBUTE_VALUES_BATCH_SIZE,
                        QueryLimits.DEFAULT_ATTRIBUTE_VALUES_BATCH_SIZE))
                .seriesBatchSize(positiveInt(SERIES_BATCH_SIZE, QueryLimits.DEFAULT_SERIES_BATCH_SIZE))
                .maxAttributeFilterSize(positiveInt(MAX_ATTRIBUTE_FILTER_SIZE,
                        QueryLimits.DEFAULT_MAX_ATTRIBUTE_FILTER_SIZE))
                .httpRequestTimeout(Duration.ofSeconds(positiveInt(HTTP_REQUEST_TIMEOUT_SECONDS,
                        QueryLimits.DEFAULT_HTTP_REQUEST_TIMEOUT_SECONDS)))
                .retryMaxAttempts(positiveInt(RETRY_MAX_ATTEMPTS, QueryLimits.DEFAULT_RETRY_MAX_ATTEMPTS))
                .retryInitialBackoff(Duration.ofMillis(positiveLong(RETRY_INITIAL_BACKOFF_MILLIS,
                        QueryLimits.DEFAULT_RETRY_INITIAL_BACKOFF_MILLIS)))
                .retryMaxBackoff(Duration.ofMillis(positiveLong(RETRY_MAX_BACKOFF_MILLIS,
                        QueryLimits.DEFAULT_RETRY_MAX_BACKOFF_MILLIS)))
                .build();
    }

    private int positiveInt(String key, int defaultValue) {
        long value = positiveLong(key, defaultValue);
        if (value > Integer.MAX_VALUE) {
            logger.warn("Value of {} is too large, using default {}", key, defaultValue);
            return defaultValue;
        }
        return (int) value;
    }

    private long positiveLong(String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}, using default {}", raw, key, defaultValue);
            return defaultValue;
        }
        if (value <= 0) {
            logger.warn("Value of {} must be positive, got {}, using default {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    /**
     * Log configuration status without revealing secrets
     */
    private void logConfigurationStatus() {
        logger.debug("Neptune query configuration:");
        logger.debug("  API token: {}", isConfigured(API_TOKEN) ? "configured" : "missing");
        logger.debug("  Project: {}", getProperty(PROJECT, "not set"));
        logger.debug("  API URL: {}", getApiUrl());
        logger.debug("  Limits: {}", limits);
    }

    private boolean isConfigured(String key) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty();
    }

    // Getters for configuration values

    public String getApiToken() {
        return properties.getProperty(API_TOKEN);
    }

    public String getProject() {
        return properties.getProperty(PROJECT);
    }

    public String getApiUrl() {
        return properties.getProperty(API_URL, DEFAULT_API_URL);
    }

    public String getQueryMetadata() {
        return properties.getProperty(QUERY_METADATA);
    }

    public QueryLimits getLimits() {
        return limits;
    }

    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public boolean hasRequiredCredentials() {
        return isConfigured(API_TOKEN);
    }

    public void validateConfiguration() throws IllegalStateException {
        if (!hasRequiredCredentials()) {
            throw new IllegalStateException("Neptune API token not configured. Please set " + API_TOKEN
                    + " in " + DEFAULT_PROPERTIES_FILE + " or the NEPTUNE_API_TOKEN environment variable.");
        }
    }
}
