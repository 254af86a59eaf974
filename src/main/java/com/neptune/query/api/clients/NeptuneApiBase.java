package com.neptune.query.api.clients;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.neptune.query.api.concurrency.QueryContext;
import com.neptune.query.api.config.QueryLimits;
import com.neptune.query.api.warnings.WarningRegistry;

/**
 * Base Neptune API client that owns the HTTP transport, request headers and response parsing.
 * Specialized clients for the different retrieval endpoints are built on top of this.
 *
 * <p>Calls never throw on an HTTP error status: every response is turned into an
 * {@link ApiResponse} and classified by the shared {@link RetryingCaller}.
 */
public class NeptuneApiBase implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(NeptuneApiBase.class);
    private static final Logger requestLogger = LoggerFactory.getLogger("NeptuneRequestLogger");

    public static final String DEFAULT_API_URL = "https://app.neptune.ai";
    public static final String CLIENT_METADATA_HEADER = "X-Neptune-Client-Metadata";

    private static final String USER_AGENT = buildUserAgent();

    private final String apiUrl;
    private final QueryLimits limits;
    private final RestClient restClient;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RetryingCaller retryingCaller;

    private final Map<String, AtomicInteger> endpointCounts = new ConcurrentHashMap<>();
    private final AtomicInteger totalRequests = new AtomicInteger();

    public NeptuneApiBase(String apiUrl, QueryLimits limits) {
        this(apiUrl, limits, createHttpClient(limits));
    }

    private NeptuneApiBase(String apiUrl, QueryLimits limits, CloseableHttpClient httpClient) {
        this(apiUrl, limits, RestClient.builder().requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient)),
                new RetryingCaller(BackoffPolicy.from(limits), new WarningRegistry()), httpClient);
    }

    /**
     * Builds on a caller-supplied RestClient builder, e.g. one bound to a mock server.
     */
    public NeptuneApiBase(String apiUrl, QueryLimits limits, RestClient.Builder restClientBuilder,
                          RetryingCaller retryingCaller) {
        this(apiUrl, limits, restClientBuilder, retryingCaller, null);
    }

    private NeptuneApiBase(String apiUrl, QueryLimits limits, RestClient.Builder restClientBuilder,
                           RetryingCaller retryingCaller, CloseableHttpClient httpClient) {
        this.apiUrl = stripTrailingSlash(apiUrl != null ? apiUrl : DEFAULT_API_URL);
        this.limits = limits;
        this.restClient = restClientBuilder.baseUrl(this.apiUrl).build();
        this.httpClient = httpClient;
        this.retryingCaller = retryingCaller;
        this.objectMapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .build();

        logger.info("Neptune API client initialized for {} with {} workers", this.apiUrl, limits.getMaxWorkers());
    }

    private static CloseableHttpClient createHttpClient(QueryLimits limits) {
        Timeout timeout = Timeout.ofMilliseconds(limits.getHttpRequestTimeout().toMillis());

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(limits.getMaxWorkers())
                .setMaxConnPerRoute(limits.getMaxWorkers())
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(timeout)
                        .setSocketTimeout(timeout)
                        .build())
                .build();

        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom().setResponseTimeout(timeout).build())
                .build();
    }

    /**
     * Core HTTP POST. Sends a JSON body with the bearer token, the client metadata of the query
     * and the user agent, and returns the parsed body on 2xx or the raw body otherwise.
     *
     * @throws IOException on transport failure, so the caller can retry it
     */
    protected ApiResponse<JsonNode> postJson(String path, Object requestBody, QueryContext context) throws IOException {
        String json = writeJson(requestBody);
        int requestNum = trackRequest(path);
        requestLogger.debug("[{}] Request #{}: POST {}", context.getQueryId(), requestNum, path);

        long startTime = System.currentTimeMillis();
        ApiResponse<String> raw;
        try {
            raw = restClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + context.getApiToken())
                    .header(CLIENT_METADATA_HEADER, context.getMetadata().toJson())
                    .header(HttpHeaders.USER_AGENT, USER_AGENT)
                    .body(json)
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        String body = StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
                        Duration retryAfter = parseRetryAfter(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
                        return new ApiResponse<>(status, body, body, retryAfter);
                    });
        } catch (RuntimeException e) {
            requestLogger.debug("[{}] Request #{} failed: POST {} - {}", context.getQueryId(), requestNum, path,
                    e.getMessage());
            throw e;
        }
        requestLogger.debug("[{}] Response #{}: status {} in {} ms", context.getQueryId(), requestNum,
                raw.getStatusCode(), System.currentTimeMillis() - startTime);

        if (!raw.isSuccessful()) {
            return raw.withBody(null);
        }
        return raw.withBody(parseResponse(raw.getBody()));
    }

    /**
     * Parses a response body. An empty body is read as an empty JSON object.
     */
    protected JsonNode parseResponse(String responseBody) {
        if (responseBody == null || responseBody.isEmpty()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse JSON response: {}", e.getMessage());
            throw new NeptuneApiException("Failed to parse JSON response", e);
        }
    }

    private String writeJson(Object requestBody) {
        try {
            return objectMapper.writeValueAsString(requestBody);
        } catch (JsonProcessingException e) {
            throw new NeptuneApiException("Failed to serialize request body", e);
        }
    }

    /**
     * Reads {@code Retry-After} as delta seconds or an HTTP date. Unparseable values are ignored.
     */
    static Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            long seconds = Long.parseLong(trimmed);
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration delay = Duration.between(ZonedDateTime.now(at.getZone()), at);
                return delay.isNegative() ? Duration.ZERO : delay;
            } catch (DateTimeParseException dateError) {
                logger.debug("Ignoring unparseable Retry-After header: {}", value);
                return null;
            }
        }
    }

    static String buildUserAgent() {
        String version = NeptuneApiBase.class.getPackage().getImplementationVersion();
        return "neptune-query-java/" + sanitize(version != null ? version : "unknown")
                + " (java=" + sanitize(System.getProperty("java.version", "unknown"))
                + "; os=" + sanitize(System.getProperty("os.name", "unknown")) + ")";
    }

    private static String sanitize(String value) {
        return value.replaceAll("[ ();/]", "_");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private int trackRequest(String path) {
        endpointCounts.computeIfAbsent(path, k -> new AtomicInteger()).incrementAndGet();
        return totalRequests.incrementAndGet();
    }

    public Map<String, Object> getApiStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("totalRequests", totalRequests.get());
        Map<String, Integer> endpointStats = new HashMap<>();
        endpointCounts.forEach((endpoint, count) -> endpointStats.put(endpoint, count.get()));
        stats.put("endpointStats", endpointStats);
        return stats;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public QueryLimits getLimits() {
        return limits;
    }

    public RetryingCaller getRetryingCaller() {
        return retryingCaller;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String getUserAgent() {
        return USER_AGENT;
    }

    @Override
    public void close() {
        if (httpClient == null) {
            return;
        }
        try {
            httpClient.close();
        } catch (IOException e) {
            logger.warn("Failed to close HTTP client: {}", e.getMessage());
        }
    }
}
