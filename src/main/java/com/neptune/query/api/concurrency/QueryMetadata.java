package com.neptune.query.api.concurrency;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Describes the logical query a request belongs to. Serialized into the
 * {@code X-Neptune-Client-Metadata} header of every call made on its behalf.
 */
public final class QueryMetadata {

    private static final Logger logger = LoggerFactory.getLogger(QueryMetadata.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final int MAX_API_FUNCTION_LENGTH = 32;
    static final int MAX_CLIENT_VERSION_LENGTH = 24;
    static final int QUERY_ID_LENGTH = 8;
    static final int MAX_USER_DATA_JSON_LENGTH = 82;
    static final String USER_DATA_TOO_LONG = "NEPTUNE_QUERY_METADATA too long";

    private final String apiFunction;
    private final String clientVersion;
    private final String queryId;
    private final Object userData;

    public QueryMetadata(String apiFunction, String clientVersion, String queryId, String userData) {
        this.apiFunction = truncate(apiFunction, MAX_API_FUNCTION_LENGTH);
        this.clientVersion = truncate(clientVersion, MAX_CLIENT_VERSION_LENGTH);
        this.queryId = truncate(queryId, QUERY_ID_LENGTH);
        this.userData = processUserData(userData);
    }

    public String getApiFunction() {
        return apiFunction;
    }

    public String getClientVersion() {
        return clientVersion;
    }

    public String getQueryId() {
        return queryId;
    }

    /** Parsed JSON value, the raw string when it is not JSON, or null. */
    public Object getUserData() {
        return userData;
    }

    public String toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("fn", apiFunction);
        json.put("v", clientVersion);
        json.put("qid", queryId);
        json.put("ud", userData);
        try {
            return objectMapper.writeValueAsString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize query metadata", e);
        }
    }

    static Object processUserData(String userData) {
        if (userData == null || userData.isEmpty()) {
            return null;
        }

        Object value;
        try {
            value = objectMapper.readValue(userData, Object.class);
        } catch (JsonProcessingException e) {
            logger.debug("NEPTUNE_QUERY_METADATA is not valid JSON, sending it as text");
            value = userData;
        }

        try {
            if (objectMapper.writeValueAsString(value).length() > MAX_USER_DATA_JSON_LENGTH) {
                logger.debug("NEPTUNE_QUERY_METADATA is too long, replacing it with a marker");
                return USER_DATA_TOO_LONG;
            }
        } catch (JsonProcessingException e) {
            return USER_DATA_TOO_LONG;
        }
        return value;
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
