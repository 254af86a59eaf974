package com.neptune.query.api.model;

import java.util.Objects;

/**
 * One (x, y) sample of a float series. {@code y} may be NaN or infinite. Timestamp and preview
 * fields are null unless they were requested.
 */
public final class SeriesPoint {

    private final double x;
    private final double y;
    private final Long timestampMillis;
    private final Boolean preview;
    private final Double completionRatio;

    public SeriesPoint(double x, double y) {
        this(x, y, null);
    }

    public SeriesPoint(double x, double y, Long timestampMillis) {
        this(x, y, timestampMillis, null, null);
    }

    public SeriesPoint(double x, double y, Long timestampMillis, Boolean preview, Double completionRatio) {
        this.x = x;
        this.y = y;
        this.timestampMillis = timestampMillis;
        this.preview = preview;
        this.completionRatio = completionRatio;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    /** Absolute time of the sample, or null when it was not requested. */
    public Long getTimestampMillis() {
        return timestampMillis;
    }

    /** Whether the point is a preview that may still change. */
    public Boolean getPreview() {
        return preview;
    }

    public Double getCompletionRatio() {
        return completionRatio;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SeriesPoint)) {
            return false;
        }
        SeriesPoint that = (SeriesPoint) o;
        return Double.compare(x, that.x) == 0 && Double.compare(y, that.y) == 0
                && Objects.equals(timestampMillis, that.timestampMillis)
                && Objects.equals(preview, that.preview)
                && Objects.equals(completionRatio, that.completionRatio);
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, timestampMillis, preview, completionRatio);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
