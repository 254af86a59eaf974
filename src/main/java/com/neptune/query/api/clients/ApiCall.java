package com.neptune.query.api.clients;

import java.io.IOException;

/**
 * One network call. Transport failures surface as {@link IOException} or as Spring's
 * {@code ResourceAccessException}; both are treated as transient.
 */
@FunctionalInterface
public interface ApiCall<T> {

    ApiResponse<T> call() throws IOException;
}
