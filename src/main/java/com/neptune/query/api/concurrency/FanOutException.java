package com.neptune.query.api.concurrency;

import com.neptune.query.api.clients.NeptuneApiException;

/**
 * A batch worker failed with something other than a {@link NeptuneApiException}.
 */
public class FanOutException extends NeptuneApiException {

    private static final long serialVersionUID = 1L;

    public FanOutException(String message, Throwable cause) {
        super(message, cause);
    }
}
