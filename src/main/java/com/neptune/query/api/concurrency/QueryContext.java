package com.neptune.query.api.concurrency;

import java.security.SecureRandom;
import java.util.Objects;

/**
 * Per-query context captured once when a logical query starts and handed by value to every
 * worker. The transport reads it just before each network call.
 */
public final class QueryContext {

    private static final String QUERY_ID_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom random = new SecureRandom();

    private final String apiToken;
    private final QueryMetadata metadata;

    public QueryContext(String apiToken, QueryMetadata metadata) {
        this.apiToken = Objects.requireNonNull(apiToken, "apiToken");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    /**
     * Starts a new query with a fresh random query id.
     *
     * @param apiFunction public operation being served, e.g. {@code fetch_metrics}
     * @param apiToken    bearer credential
     * @param userData    optional caller tag, may be null
     */
    public static QueryContext start(String apiFunction, String apiToken, String userData) {
        QueryMetadata metadata = new QueryMetadata(apiFunction, clientVersion(), newQueryId(), userData);
        return new QueryContext(apiToken, metadata);
    }

    public String getApiToken() {
        return apiToken;
    }

    public QueryMetadata getMetadata() {
        return metadata;
    }

    public String getQueryId() {
        return metadata.getQueryId();
    }

    static String newQueryId() {
        StringBuilder id = new StringBuilder(QueryMetadata.QUERY_ID_LENGTH);
        for (int i = 0; i < QueryMetadata.QUERY_ID_LENGTH; i++) {
            id.append(QUERY_ID_ALPHABET.charAt(random.nextInt(QUERY_ID_ALPHABET.length())));
        }
        return id.toString();
    }

    public static String clientVersion() {
        String version = QueryContext.class.getPackage().getImplementationVersion();
        return "nq-java/" + (version != null ? version : "unknown");
    }

    @Override
    public String toString() {
        // no token
        return "QueryContext{queryId=" + metadata.getQueryId() + ", fn=" + metadata.getApiFunction() + "}";
    }
}
