package com.neptune.query.api.clients;

import java.io.IOException;
import java.time.Duration;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.ResourceAccessException;

import com.neptune.query.api.warnings.WarningCategory;
import com.neptune.query.api.warnings.WarningRegistry;

/**
 * Wraps a single network call and classifies its outcome.
 *
 * <ul>
 * <li>2xx: the body is returned.</li>
 * <li>Transport failure, timeout, 5xx: retried with backoff; {@link RetriesExhaustedException}
 * once the attempt budget is spent.</li>
 * <li>429: retried honouring {@code Retry-After}; {@link RateLimitedException} once spent.</li>
 * <li>401, 403: {@link AuthorizationException} immediately.</li>
 * <li>400, 404, 408, 409, 422: no data; the caller's empty result is returned.</li>
 * <li>Anything else: {@link UnexpectedResponseException} with status and body.</li>
 * </ul>
 */
public class RetryingCaller {

    private static final Logger logger = LoggerFactory.getLogger(RetryingCaller.class);

    private static final Set<Integer> NO_DATA_STATUSES = Set.of(400, 404, 408, 409, 422);

    private final BackoffPolicy backoff;
    private final WarningRegistry warnings;
    private final Sleeper sleeper;

    public RetryingCaller(BackoffPolicy backoff, WarningRegistry warnings) {
        this(backoff, warnings, Sleeper.THREAD);
    }

    public RetryingCaller(BackoffPolicy backoff, WarningRegistry warnings, Sleeper sleeper) {
        this.backoff = backoff;
        this.warnings = warnings;
        this.sleeper = sleeper;
    }

    public WarningRegistry getWarnings() {
        return warnings;
    }

    /**
     * Executes the call, retrying transient failures.
     *
     * @param operation   name used in logs and error messages
     * @param call        the network call
     * @param emptyResult returned when the server answers with a client-data error
     */
    public <T> T execute(String operation, ApiCall<T> call, T emptyResult) {
        int maxAttempts = backoff.getMaxAttempts();
        Throwable lastFailure = null;
        ApiResponse<T> lastResponse = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Duration serverHint = null;
            try {
                ApiResponse<T> response = call.call();
                lastResponse = response;
                lastFailure = null;
                int status = response.getStatusCode();

                if (response.isSuccessful()) {
                    if (attempt > 1) {
                        logger.debug("{} succeeded on attempt {}/{}", operation, attempt, maxAttempts);
                    }
                    return response.getBody();
                }
                if (status == 401 || status == 403) {
                    throw new AuthorizationException(operation + " was rejected with status " + status
                            + "; check the API token and project access", status, response.getRawBody());
                }
                if (NO_DATA_STATUSES.contains(status)) {
                    logger.debug("{} returned status {}, treating as no data: {}",
                            operation, status, response.getRawBody());
                    return emptyResult;
                }
                if (status == 429) {
                    warnings.warn(WarningCategory.HTTP_429, "The server is rate limiting requests ("
                            + operation + "); retrying with backoff");
                    serverHint = response.getRetryAfter();
                } else if (status >= 500 && status < 600) {
                    warnings.warn(WarningCategory.HTTP_5XX, "The server responded with status " + status
                            + " (" + operation + "); retrying");
                } else {
                    throw new UnexpectedResponseException(operation + " returned unexpected status " + status,
                            status, response.getRawBody());
                }
            } catch (IOException | ResourceAccessException e) {
                lastFailure = e;
                lastResponse = null;
                logger.info("{} failed on attempt {}/{}: {}", operation, attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts) {
                Duration delay = backoff.delayAfter(attempt, serverHint);
                logger.debug("Retrying {} in {} ms (attempt {}/{})", operation, delay.toMillis(), attempt + 1, maxAttempts);
                pause(operation, delay);
            }
        }

        if (lastResponse != null && lastResponse.getStatusCode() == 429) {
            throw new RateLimitedException(operation + " was rate limited on all " + maxAttempts + " attempts",
                    maxAttempts, lastResponse.getRawBody());
        }
        int lastStatus = lastResponse != null ? lastResponse.getStatusCode() : NeptuneApiException.NO_STATUS;
        String lastBody = lastResponse != null ? lastResponse.getRawBody() : null;
        throw new RetriesExhaustedException(operation + " failed after " + maxAttempts + " attempts",
                lastFailure, maxAttempts, lastStatus, lastBody);
    }

    private void pause(String operation, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NeptuneApiException("Interrupted while waiting to retry " + operation, e);
        }
    }
}
