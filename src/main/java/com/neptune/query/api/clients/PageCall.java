package com.neptune.query.api.clients;

import java.io.IOException;
import java.util.List;

/**
 * Fetches {@code count} items of one batch starting at {@code offset}.
 */
@FunctionalInterface
public interface PageCall<T> {

    ApiResponse<List<T>> fetch(int offset, int count) throws IOException;
}
