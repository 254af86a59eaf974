package com.neptune.query.api.concurrency;

import java.util.Iterator;

import com.neptune.query.api.model.Page;

/**
 * Fetches one batch as a sequence of pages. Runs on a pool thread; everything it needs about
 * the query arrives in the {@link QueryContext} argument.
 */
@FunctionalInterface
public interface BatchWorker<B, R> {

    Iterator<Page<R>> fetch(B batch, QueryContext context);
}
