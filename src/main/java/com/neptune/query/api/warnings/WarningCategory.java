package com.neptune.query.api.warnings;

/**
 * Kinds of user-visible warnings and how often each may be shown.
 */
public enum WarningCategory {
    /** Shown every time. */
    GENERIC(Throttle.NONE),
    /** Shown once per distinct message for the lifetime of the registry. */
    EXPERIMENTAL(Throttle.ONCE_PER_MESSAGE),
    /** Rate limiting; at most once per window regardless of message. */
    HTTP_429(Throttle.ONCE_PER_WINDOW),
    /** Server errors being retried; at most once per window regardless of message. */
    HTTP_5XX(Throttle.ONCE_PER_WINDOW);

    enum Throttle {
        NONE, ONCE_PER_MESSAGE, ONCE_PER_WINDOW
    }

    private final Throttle throttle;

    WarningCategory(Throttle throttle) {
        this.throttle = throttle;
    }

    Throttle getThrottle() {
        return throttle;
    }
}
