package com.neptune.query.api.buckets;

/**
 * Half-open x interval {@code (fromX, toX]} of one bucket. Either end may be infinite.
 */
public final class BucketRange {

    private final int index;
    private final double fromX;
    private final double toX;

    public BucketRange(int index, double fromX, double toX) {
        this.index = index;
        this.fromX = fromX;
        this.toX = toX;
    }

    public int getIndex() {
        return index;
    }

    public double getFromX() {
        return fromX;
    }

    public double getToX() {
        return toX;
    }

    /**
     * Whether {@code x} falls in this range. The first bucket also admits its lower bound, which
     * is what keeps the single point of a degenerate range.
     */
    public boolean contains(double x) {
        return (fromX < x && x <= toX) || (index == 0 && x == fromX);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BucketRange)) {
            return false;
        }
        BucketRange other = (BucketRange) o;
        return index == other.index
                && Double.compare(fromX, other.fromX) == 0
                && Double.compare(toX, other.toX) == 0;
    }

    @Override
    public int hashCode() {
        int result = index;
        result = 31 * result + Double.hashCode(fromX);
        result = 31 * result + Double.hashCode(toX);
        return result;
    }

    @Override
    public String toString() {
        return "#" + index + " (" + fromX + ", " + toX + "]";
    }
}
