package com.neptune.query.api.clients;

import java.time.Duration;
import java.util.function.Function;

/**
 * Outcome of one network call: a status code, the body (parsed or raw) and an optional
 * server delay hint taken from {@code Retry-After}.
 */
public final class ApiResponse<T> {

    private final int statusCode;
    private final T body;
    private final String rawBody;
    private final Duration retryAfter;

    public ApiResponse(int statusCode, T body, String rawBody, Duration retryAfter) {
        this.statusCode = statusCode;
        this.body = body;
        this.rawBody = rawBody;
        this.retryAfter = retryAfter;
    }

    public static <T> ApiResponse<T> ok(T body) {
        return new ApiResponse<>(200, body, null, null);
    }

    public static <T> ApiResponse<T> error(int statusCode, String rawBody) {
        return new ApiResponse<>(statusCode, null, rawBody, null);
    }

    public static <T> ApiResponse<T> error(int statusCode, String rawBody, Duration retryAfter) {
        return new ApiResponse<>(statusCode, null, rawBody, retryAfter);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public T getBody() {
        return body;
    }

    public String getRawBody() {
        return rawBody;
    }

    /** Server-provided delay before the next attempt, or null. */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    public <R> ApiResponse<R> withBody(R newBody) {
        return new ApiResponse<>(statusCode, newBody, rawBody, retryAfter);
    }

    /**
     * Converts the body of a successful response; error responses keep their status and raw body.
     */
    public <R> ApiResponse<R> map(Function<? super T, ? extends R> mapper) {
        R mapped = isSuccessful() ? mapper.apply(body) : null;
        return withBody(mapped);
    }
}
