package com.neptune.query.api.clients;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.neptune.query.api.concurrency.FanOutExecutor;
import com.neptune.query.api.concurrency.QueryContext;
import com.neptune.query.api.config.NeptuneQueryConfig;
import com.neptune.query.api.config.QueryLimits;
import com.neptune.query.api.split.BatchSplitter;

/**
 * Main entry point for Neptune retrieval.
 * Provides access to specialized clients, the batch splitter and the shared worker pool.
 */
public class NeptuneApiClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NeptuneApiClient.class);

    private final NeptuneApiBase apiBase;
    private final RunSearchClient runs;
    private final AttributeValuesClient attributeValues;
    private final SeriesValuesClient series;
    private final BatchSplitter splitter;
    private final FanOutExecutor fanOut;
    private final String apiToken;
    private final String userData;

    public NeptuneApiClient(NeptuneQueryConfig config) {
        this(new NeptuneApiBase(config.getApiUrl(), config.getLimits()), config.getApiToken(), config.getQueryMetadata());
    }

    public NeptuneApiClient(String apiUrl, String apiToken, QueryLimits limits) {
        this(new NeptuneApiBase(apiUrl, limits), apiToken, null);
    }

    /**
     * @param apiBase  transport to use
     * @param apiToken bearer credential sent with every call
     * @param userData optional tag added to the client metadata of every query, may be null
     */
    public NeptuneApiClient(NeptuneApiBase apiBase, String apiToken, String userData) {
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalArgumentException("An API token is required");
        }
        this.apiBase = Objects.requireNonNull(apiBase, "apiBase");
        this.apiToken = apiToken;
        this.userData = userData;
        this.runs = new RunSearchClient(apiBase);
        this.attributeValues = new AttributeValuesClient(apiBase);
        this.series = new SeriesValuesClient(apiBase);
        this.splitter = new BatchSplitter(apiBase.getLimits());
        this.fanOut = new FanOutExecutor(apiBase.getLimits().getMaxWorkers());
    }

    /**
     * Starts a logical query. The returned context is handed to every call made for it.
     *
     * @param apiFunction public operation being served, e.g. {@code fetch_metrics}
     */
    public QueryContext newQuery(String apiFunction) {
        QueryContext context = QueryContext.start(apiFunction, apiToken, userData);
        logger.debug("Starting {}", context);
        return context;
    }

    /**
     * Get the run search client
     */
    public RunSearchClient runs() {
        return runs;
    }

    /**
     * Get the attribute values client
     */
    public AttributeValuesClient attributeValues() {
        return attributeValues;
    }

    /**
     * Get the series values client
     */
    public SeriesValuesClient series() {
        return series;
    }

    public BatchSplitter splitter() {
        return splitter;
    }

    public FanOutExecutor fanOut() {
        return fanOut;
    }

    /**
     * Access base functionality (request stats, limits, retry policy)
     */
    public NeptuneApiBase base() {
        return apiBase;
    }

    @Override
    public void close() {
        fanOut.close();
        apiBase.close();
    }
}
