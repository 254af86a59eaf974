package com.neptune.query.api.config;

import java.time.Duration;

/**
 * Resolved numeric limits consumed by the retrieval engine. Immutable; built from
 * {@link NeptuneQueryConfig} or directly in tests.
 */
public final class QueryLimits {

    public static final int DEFAULT_MAX_WORKERS = 32;
    public static final int DEFAULT_MAX_REQUEST_SIZE = 220_000;
    public static final int DEFAULT_SYS_ATTRS_BATCH_SIZE = 10_000;
    public static final int DEFAULT_ATTRIBUTE_VALUES_BATCH_SIZE = 10_000;
    public static final int DEFAULT_SERIES_BATCH_SIZE = 10_000;
    public static final int DEFAULT_MAX_ATTRIBUTE_FILTER_SIZE = 20_000;
    public static final int DEFAULT_HTTP_REQUEST_TIMEOUT_SECONDS = 60;
    public static final int DEFAULT_RETRY_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_RETRY_INITIAL_BACKOFF_MILLIS = 500;
    public static final long DEFAULT_RETRY_MAX_BACKOFF_MILLIS = 30_000;

    private final int maxWorkers;
    private final int maxRequestSize;
    private final int sysAttrsBatchSize;
    private final int attributeValuesBatchSize;
    private final int seriesBatchSize;
    private final int maxAttributeFilterSize;
    private final Duration httpRequestTimeout;
    private final int retryMaxAttempts;
    private final Duration retryInitialBackoff;
    private final Duration retryMaxBackoff;

    private QueryLimits(Builder builder) {
        this.maxWorkers = builder.maxWorkers;
        this.maxRequestSize = builder.maxRequestSize;
        this.sysAttrsBatchSize = builder.sysAttrsBatchSize;
        this.attributeValuesBatchSize = builder.attributeValuesBatchSize;
        this.seriesBatchSize = builder.seriesBatchSize;
        this.maxAttributeFilterSize = builder.maxAttributeFilterSize;
        this.httpRequestTimeout = builder.httpRequestTimeout;
        this.retryMaxAttempts = builder.retryMaxAttempts;
        this.retryInitialBackoff = builder.retryInitialBackoff;
        this.retryMaxBackoff = builder.retryMaxBackoff;
    }

    public static QueryLimits defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxWorkers(maxWorkers)
                .maxRequestSize(maxRequestSize)
                .sysAttrsBatchSize(sysAttrsBatchSize)
                .attributeValuesBatchSize(attributeValuesBatchSize)
                .seriesBatchSize(seriesBatchSize)
                .maxAttributeFilterSize(maxAttributeFilterSize)
                .httpRequestTimeout(httpRequestTimeout)
                .retryMaxAttempts(retryMaxAttempts)
                .retryInitialBackoff(retryInitialBackoff)
                .retryMaxBackoff(retryMaxBackoff);
    }

    /** Worker pool size, and the batch-count ceiling for the heuristic series split. */
    public int getMaxWorkers() {
        return maxWorkers;
    }

    /** Estimated request body budget in bytes. */
    public int getMaxRequestSize() {
        return maxRequestSize;
    }

    /** Max runs per run-id batch, also the page size of run searches. */
    public int getSysAttrsBatchSize() {
        return sysAttrsBatchSize;
    }

    /** Max runs x attributes per attribute-values batch. */
    public int getAttributeValuesBatchSize() {
        return attributeValuesBatchSize;
    }

    /** Max series per series-values batch. */
    public int getSeriesBatchSize() {
        return seriesBatchSize;
    }

    /** Size budget in bytes for a list of attribute names sent as a filter. */
    public int getMaxAttributeFilterSize() {
        return maxAttributeFilterSize;
    }

    public Duration getHttpRequestTimeout() {
        return httpRequestTimeout;
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public Duration getRetryInitialBackoff() {
        return retryInitialBackoff;
    }

    public Duration getRetryMaxBackoff() {
        return retryMaxBackoff;
    }

    @Override
    public String toString() {
        return "QueryLimits{maxWorkers=" + maxWorkers
                + ", maxRequestSize=" + maxRequestSize
                + ", sysAttrsBatchSize=" + sysAttrsBatchSize
                + ", attributeValuesBatchSize=" + attributeValuesBatchSize
                + ", seriesBatchSize=" + seriesBatchSize
                + ", maxAttributeFilterSize=" + maxAttributeFilterSize
                + ", httpRequestTimeout=" + httpRequestTimeout
                + ", retryMaxAttempts=" + retryMaxAttempts
                + ", retryInitialBackoff=" + retryInitialBackoff
                + ", retryMaxBackoff=" + retryMaxBackoff + "}";
    }

    public static final class Builder {
        private int maxWorkers = DEFAULT_MAX_WORKERS;
        private int maxRequestSize = DEFAULT_MAX_REQUEST_SIZE;
        private int sysAttrsBatchSize = DEFAULT_SYS_ATTRS_BATCH_SIZE;
        private int attributeValuesBatchSize = DEFAULT_ATTRIBUTE_VALUES_BATCH_SIZE;
        private int seriesBatchSize = DEFAULT_SERIES_BATCH_SIZE;
        private int maxAttributeFilterSize = DEFAULT_MAX_ATTRIBUTE_FILTER_SIZE;
        private Duration httpRequestTimeout = Duration.ofSeconds(DEFAULT_HTTP_REQUEST_TIMEOUT_SECONDS);
        private int retryMaxAttempts = DEFAULT_RETRY_MAX_ATTEMPTS;
        private Duration retryInitialBackoff = Duration.ofMillis(DEFAULT_RETRY_INITIAL_BACKOFF_MILLIS);
        private Duration retryMaxBackoff = Duration.ofMillis(DEFAULT_RETRY_MAX_BACKOFF_MILLIS);

        private Builder() {
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = requirePositive(maxWorkers, "maxWorkers");
            return this;
        }

        /** Zero or negative means every item is sent on its own. */
        public Builder maxRequestSize(int maxRequestSize) {
            this.maxRequestSize = maxRequestSize;
            return this;
        }

        public Builder sysAttrsBatchSize(int sysAttrsBatchSize) {
            this.sysAttrsBatchSize = requirePositive(sysAttrsBatchSize, "sysAttrsBatchSize");
            return this;
        }

        public Builder attributeValuesBatchSize(int attributeValuesBatchSize) {
            this.attributeValuesBatchSize = requirePositive(attributeValuesBatchSize, "attributeValuesBatchSize");
            return this;
        }

        public Builder seriesBatchSize(int seriesBatchSize) {
            this.seriesBatchSize = requirePositive(seriesBatchSize, "seriesBatchSize");
            return this;
        }

        public Builder maxAttributeFilterSize(int maxAttributeFilterSize) {
            this.maxAttributeFilterSize = maxAttributeFilterSize;
            return this;
        }

        public Builder httpRequestTimeout(Duration httpRequestTimeout) {
            this.httpRequestTimeout = httpRequestTimeout;
            return this;
        }

        public Builder retryMaxAttempts(int retryMaxAttempts) {
            this.retryMaxAttempts = requirePositive(retryMaxAttempts, "retryMaxAttempts");
            return this;
        }

        public Builder retryInitialBackoff(Duration retryInitialBackoff) {
            this.retryInitialBackoff = retryInitialBackoff;
            return this;
        }

        public Builder retryMaxBackoff(Duration retryMaxBackoff) {
            this.retryMaxBackoff = retryMaxBackoff;
            return this;
        }

        public QueryLimits build() {
            return new QueryLimits(this);
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
            return value;
        }
    }
}
