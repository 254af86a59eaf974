package com.neptune.query.api.clients;

/**
 * 401 or 403. Never retried and never turned into an empty result.
 */
public class AuthorizationException extends NeptuneApiException {

    private static final long serialVersionUID = 1L;

    public AuthorizationException(String message, int statusCode, String responseBody) {
        super(message, null, statusCode, responseBody);
    }
}
