package com.neptune.query.api.clients;

import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.neptune.query.api.model.Page;

/**
 * Offset pagination over one batch. Requests {@code min(pageSize, remaining)} items at each
 * offset and stops when the server returns fewer items than requested or the overall limit is
 * reached, truncating the last page so exactly {@code limit} items are delivered.
 */
public class PaginatedFetch<T> extends PageSequence<T> {

    private static final Logger logger = LoggerFactory.getLogger(PaginatedFetch.class);

    private final PageCall<T> pageCall;
    private final int pageSize;
    private final Integer limit;

    private int offset = 0;
    private int delivered = 0;

    /**
     * @param operation name used in logs and errors
     * @param caller    classifies and retries each call
     * @param pageCall  issues one page request
     * @param pageSize  items requested per call
     * @param limit     overall number of items wanted, or null for everything
     */
    public PaginatedFetch(String operation, RetryingCaller caller, PageCall<T> pageCall, int pageSize, Integer limit) {
        super(operation, caller);
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive, got " + pageSize);
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got " + limit);
        }
        this.pageCall = pageCall;
        this.pageSize = pageSize;
        this.limit = limit;
        if (limit != null && limit == 0) {
            markLastPage();
        }
    }

    /**
     * A sequence that starts a fresh fetch every time it is iterated.
     */
    public static <T> Iterable<Page<T>> pages(String operation, RetryingCaller caller, PageCall<T> pageCall,
                                              int pageSize, Integer limit) {
        return () -> new PaginatedFetch<>(operation, caller, pageCall, pageSize, limit);
    }

    public int getDelivered() {
        return delivered;
    }

    @Override
    protected List<T> fetchPage() {
        int requested = limit == null ? pageSize : Math.min(pageSize, limit - delivered);
        int requestOffset = offset;

        List<T> items = caller.execute(operation, () -> pageCall.fetch(requestOffset, requested),
                Collections.emptyList());
        if (items == null) {
            items = Collections.emptyList();
        }

        int fetched = items.size();
        if (fetched > requested) {
            items = items.subList(0, requested);
        }
        offset += items.size();
        delivered += items.size();

        if (fetched < requested || (limit != null && delivered >= limit)) {
            markLastPage();
        }
        logger.debug("{}: {} items at offset {} ({} delivered)", operation, items.size(), requestOffset, delivered);
        return items;
    }
}
