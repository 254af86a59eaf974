package com.neptune.query.api.model;

import java.util.Collections;
import java.util.List;

/**
 * Items returned by one network round-trip.
 */
public final class Page<T> {

    private final List<T> items;

    public Page(List<T> items) {
        this.items = Collections.unmodifiableList(items);
    }

    public List<T> getItems() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public String toString() {
        return "Page" + items;
    }
}
