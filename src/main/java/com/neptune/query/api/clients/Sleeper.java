package com.neptune.query.api.clients;

import java.time.Duration;

/**
 * Blocks the calling worker between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
