package com.neptune.query.api.clients;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.neptune.query.api.model.Page;

/**
 * Pull-based sequence of pages for one batch.
 *
 * <p>Nothing is fetched until {@link #hasNext()} is called, and each call fetches at most what is
 * needed for one non-empty page, so a consumer can stop at any point. A failure while fetching
 * moves the sequence to {@link State#FAILED}; the same exception is then rethrown by every later
 * call instead of the sequence ending as if it were complete.
 */
public abstract class PageSequence<T> implements Iterator<Page<T>> {

    public enum State {
        NOT_STARTED, AWAITING_PAGE, HAS_MORE, EXHAUSTED, FAILED
    }

    protected final String operation;
    protected final RetryingCaller caller;

    private State state = State.NOT_STARTED;
    private boolean lastPage;
    private Page<T> buffered;
    private RuntimeException failure;
    private int pagesFetched;

    protected PageSequence(String operation, RetryingCaller caller) {
        this.operation = operation;
        this.caller = caller;
    }

    /**
     * Performs the next network round-trip. Implementations call {@link #markLastPage()} once
     * no further round-trip is needed; an empty result alone does not end the sequence.
     */
    protected abstract List<T> fetchPage();

    protected final void markLastPage() {
        lastPage = true;
    }

    public State getState() {
        return state;
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    @Override
    public boolean hasNext() {
        if (buffered != null) {
            return true;
        }
        while (state != State.EXHAUSTED) {
            if (state == State.FAILED) {
                throw failure;
            }
            if (lastPage) {
                state = State.EXHAUSTED;
                break;
            }
            state = State.AWAITING_PAGE;
            List<T> items;
            try {
                items = fetchPage();
            } catch (RuntimeException e) {
                state = State.FAILED;
                failure = e;
                throw e;
            }
            pagesFetched++;
            state = lastPage ? State.EXHAUSTED : State.HAS_MORE;
            if (items != null && !items.isEmpty()) {
                buffered = new Page<>(items);
                return true;
            }
        }
        return false;
    }

    @Override
    public Page<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException(operation + " has no more pages");
        }
        Page<T> page = buffered;
        buffered = null;
        return page;
    }
}
