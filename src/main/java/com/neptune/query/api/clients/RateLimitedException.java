package com.neptune.query.api.clients;

/**
 * The server kept answering 429 until the attempt budget ran out.
 */
public class RateLimitedException extends RetriesExhaustedException {

    private static final long serialVersionUID = 1L;

    public RateLimitedException(String message, int attempts, String lastBody) {
        super(message, null, attempts, 429, lastBody);
    }
}
