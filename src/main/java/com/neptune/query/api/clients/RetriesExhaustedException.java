package com.neptune.query.api.clients;

/**
 * A call kept failing transiently (transport error, timeout, 5xx) until the attempt budget ran out.
 */
public class RetriesExhaustedException extends NeptuneApiException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public RetriesExhaustedException(String message, Throwable cause, int attempts, int lastStatus, String lastBody) {
        super(message, cause, lastStatus, lastBody);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
