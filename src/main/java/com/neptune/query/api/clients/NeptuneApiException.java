package com.neptune.query.api.clients;

/**
 * Base class of every error raised by the retrieval client.
 */
public class NeptuneApiException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String responseBody;

    public NeptuneApiException(String message) {
        this(message, null, NO_STATUS, null);
    }

    public NeptuneApiException(String message, Throwable cause) {
        this(message, cause, NO_STATUS, null);
    }

    public NeptuneApiException(String message, Throwable cause, int statusCode, String responseBody) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /** HTTP status of the failing response, or {@link #NO_STATUS} for transport failures. */
    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
