package com.neptune.query.api.clients;

/**
 * Options of a float series fetch: an optional step window, an optional tail limit, whether
 * point timestamps are wanted, whether inherited points from ancestor runs are included and
 * whether preview points are returned.
 */
public final class SeriesQuery {

    private static final SeriesQuery ALL = new SeriesQuery(null, null, null, false, false, false);

    private final Double stepFrom;
    private final Double stepTo;
    private final Integer tailLimit;
    private final boolean includeTimestamp;
    private final boolean lineageToTheRoot;
    private final boolean includePointPreviews;

    private SeriesQuery(Double stepFrom, Double stepTo, Integer tailLimit, boolean includeTimestamp,
                        boolean lineageToTheRoot, boolean includePointPreviews) {
        if (tailLimit != null && tailLimit <= 0) {
            throw new IllegalArgumentException("tailLimit must be positive, got " + tailLimit);
        }
        if (stepFrom != null && stepTo != null && stepFrom > stepTo) {
            throw new IllegalArgumentException("Invalid step range [" + stepFrom + ", " + stepTo + "]");
        }
        this.stepFrom = stepFrom;
        this.stepTo = stepTo;
        this.tailLimit = tailLimit;
        this.includeTimestamp = includeTimestamp;
        this.lineageToTheRoot = lineageToTheRoot;
        this.includePointPreviews = includePointPreviews;
    }

    /** Every point of every series. */
    public static SeriesQuery all() {
        return ALL;
    }

    /** Either bound may be null for an open end. */
    public SeriesQuery withStepRange(Double from, Double to) {
        return new SeriesQuery(from, to, tailLimit, includeTimestamp, lineageToTheRoot, includePointPreviews);
    }

    /** Only the last {@code n} points of each series. */
    public SeriesQuery withTailLimit(Integer n) {
        return new SeriesQuery(stepFrom, stepTo, n, includeTimestamp, lineageToTheRoot, includePointPreviews);
    }

    public SeriesQuery withTimestamps(boolean include) {
        return new SeriesQuery(stepFrom, stepTo, tailLimit, include, lineageToTheRoot, includePointPreviews);
    }

    /** Also return the points a forked run inherits from its ancestors, up to the root run. */
    public SeriesQuery withLineageToTheRoot(boolean include) {
        return new SeriesQuery(stepFrom, stepTo, tailLimit, includeTimestamp, include, includePointPreviews);
    }

    /** Also return preview points, each with its preview flag and completion ratio. */
    public SeriesQuery withPointPreviews(boolean include) {
        return new SeriesQuery(stepFrom, stepTo, tailLimit, includeTimestamp, lineageToTheRoot, include);
    }

    public Double getStepFrom() {
        return stepFrom;
    }

    public Double getStepTo() {
        return stepTo;
    }

    public Integer getTailLimit() {
        return tailLimit;
    }

    public boolean isIncludeTimestamp() {
        return includeTimestamp;
    }

    public boolean isLineageToTheRoot() {
        return lineageToTheRoot;
    }

    public boolean isIncludePointPreviews() {
        return includePointPreviews;
    }

    @Override
    public String toString() {
        return "SeriesQuery{steps=[" + stepFrom + ", " + stepTo + "], tail=" + tailLimit
                + ", timestamps=" + includeTimestamp + ", lineage=" + lineageToTheRoot
                + ", previews=" + includePointPreviews + "}";
    }
}
