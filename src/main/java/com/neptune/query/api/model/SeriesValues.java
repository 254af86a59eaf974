package com.neptune.query.api.model;

import java.util.Collections;
import java.util.List;

/**
 * A chunk of points of one series as returned by a single page.
 */
public final class SeriesValues {

    private final RunAttributeDefinition definition;
    private final List<SeriesPoint> points;

    public SeriesValues(RunAttributeDefinition definition, List<SeriesPoint> points) {
        this.definition = definition;
        this.points = Collections.unmodifiableList(points);
    }

    public RunAttributeDefinition getDefinition() {
        return definition;
    }

    public List<SeriesPoint> getPoints() {
        return points;
    }
}
