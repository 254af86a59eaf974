package com.neptune.query.api.buckets;

/**
 * Summary of the points of one series that fall in one {@link BucketRange}.
 *
 * <p>First and last are the finite points with the smallest and largest x; they are NaN when
 * the bucket holds only NaN or infinite values. Those values are counted separately and never
 * enter the min, max or sum.
 */
public final class TimeseriesBucket {

    private final int index;
    private final double fromX;
    private final double toX;
    private final double firstX;
    private final double firstY;
    private final double lastX;
    private final double lastY;
    private final double yMin;
    private final double yMax;
    private final int finitePointCount;
    private final double finitePointsSum;
    private final int nanCount;
    private final int positiveInfCount;
    private final int negativeInfCount;

    TimeseriesBucket(BucketRange range, double firstX, double firstY, double lastX, double lastY,
                     double yMin, double yMax, int finitePointCount, double finitePointsSum,
                     int nanCount, int positiveInfCount, int negativeInfCount) {
        this.index = range.getIndex();
        this.fromX = range.getFromX();
        this.toX = range.getToX();
        this.firstX = firstX;
        this.firstY = firstY;
        this.lastX = lastX;
        this.lastY = lastY;
        this.yMin = yMin;
        this.yMax = yMax;
        this.finitePointCount = finitePointCount;
        this.finitePointsSum = finitePointsSum;
        this.nanCount = nanCount;
        this.positiveInfCount = positiveInfCount;
        this.negativeInfCount = negativeInfCount;
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

    public double getFirstX() {
        return firstX;
    }

    public double getFirstY() {
        return firstY;
    }

    public double getLastX() {
        return lastX;
    }

    public double getLastY() {
        return lastY;
    }

    public double getYMin() {
        return yMin;
    }

    public double getYMax() {
        return yMax;
    }

    public int getFinitePointCount() {
        return finitePointCount;
    }

    public double getFinitePointsSum() {
        return finitePointsSum;
    }

    public int getNanCount() {
        return nanCount;
    }

    public int getPositiveInfCount() {
        return positiveInfCount;
    }

    public int getNegativeInfCount() {
        return negativeInfCount;
    }

    /** All points that fell in the bucket, sentinels included. */
    public int getTotalCount() {
        return finitePointCount + nanCount + positiveInfCount + negativeInfCount;
    }

    @Override
    public String toString() {
        return String.format("Bucket #%d (%s, %s]: first=(%s, %s) last=(%s, %s) finite=%d nan=%d +inf=%d -inf=%d",
                index, fromX, toX, firstX, firstY, lastX, lastY, finitePointCount, nanCount,
                positiveInfCount, negativeInfCount);
    }
}
