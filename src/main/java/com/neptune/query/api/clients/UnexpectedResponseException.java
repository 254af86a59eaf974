package com.neptune.query.api.clients;

/**
 * A status code outside every documented class.
 */
public class UnexpectedResponseException extends NeptuneApiException {

    private static final long serialVersionUID = 1L;

    public UnexpectedResponseException(String message, int statusCode, String responseBody) {
        super(message, null, statusCode, responseBody);
    }
}
