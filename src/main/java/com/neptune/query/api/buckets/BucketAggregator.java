package com.neptune.query.api.buckets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.neptune.query.api.model.SeriesPoint;

/**
 * Reduces a series to a fixed set of x buckets.
 *
 * <p>For {@code limit} buckets over {@code [from, to]} the width is {@code (to - from) / (limit - 1)}
 * and {@code limit + 1} ranges are produced: {@code (-inf, from]}, then {@code limit - 1}
 * interior ranges, then {@code (to, +inf)}. A range with {@code from == to} collapses to the single
 * range {@code [from, +inf)}. Buckets that receive no point are left out of the result.
 */
public final class BucketAggregator {

    private static final Logger logger = LoggerFactory.getLogger(BucketAggregator.class);

    private BucketAggregator() {
    }

    public static List<BucketRange> bucketRanges(double from, double to, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Bucket limit must be positive, got " + limit);
        }
        if (Double.isNaN(from) || Double.isNaN(to) || from > to) {
            throw new IllegalArgumentException("Invalid bucket range [" + from + ", " + to + "]");
        }
        if (from == to) {
            return Collections.singletonList(new BucketRange(0, from, Double.POSITIVE_INFINITY));
        }
        if (limit == 1) {
            List<BucketRange> ranges = new ArrayList<>(2);
            ranges.add(new BucketRange(0, Double.NEGATIVE_INFINITY, from));
            ranges.add(new BucketRange(1, from, Double.POSITIVE_INFINITY));
            return ranges;
        }

        double width = (to - from) / (limit - 1);
        List<BucketRange> ranges = new ArrayList<>(limit + 1);
        for (int i = 0; i <= limit; i++) {
            double fromX = i == 0 ? Double.NEGATIVE_INFINITY : from + width * (i - 1);
            double toX = i == limit ? Double.POSITIVE_INFINITY : from + width * i;
            ranges.add(new BucketRange(i, fromX, toX));
        }
        return ranges;
    }

    /**
     * Aggregates the points over {@code xRange}, or over the min and max x of the points when
     * {@code xRange} is null.
     *
     * @param points series points in any order; y may be NaN or infinite
     * @param limit  bucket count, must be positive
     * @param xRange two-element {@code {from, to}}, or null
     */
    public static List<TimeseriesBucket> aggregate(List<SeriesPoint> points, int limit, double[] xRange) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Bucket limit must be positive, got " + limit);
        }
        double from;
        double to;
        if (xRange != null) {
            if (xRange.length != 2) {
                throw new IllegalArgumentException("xRange must hold exactly two values");
            }
            from = xRange[0];
            to = xRange[1];
        } else {
            if (points.isEmpty()) {
                return Collections.emptyList();
            }
            from = Double.POSITIVE_INFINITY;
            to = Double.NEGATIVE_INFINITY;
            for (SeriesPoint point : points) {
                from = Math.min(from, point.getX());
                to = Math.max(to, point.getX());
            }
        }
        return aggregate(points, bucketRanges(from, to, limit));
    }

    /**
     * Aggregates the points into the given ranges in a single pass. The ranges must be ordered
     * by x and must not overlap, as {@link #bucketRanges} returns them; each point is placed by a
     * binary search over the upper bounds.
     */
    public static List<TimeseriesBucket> aggregate(List<SeriesPoint> points, List<BucketRange> ranges) {
        double[] upperBounds = new double[ranges.size()];
        for (int i = 0; i < upperBounds.length; i++) {
            upperBounds[i] = ranges.get(i).getToX();
        }

        Accumulator[] accumulators = new Accumulator[ranges.size()];
        for (SeriesPoint point : points) {
            int slot = firstUpperBoundAtLeast(upperBounds, point.getX());
            if (slot < upperBounds.length && ranges.get(slot).contains(point.getX())) {
                if (accumulators[slot] == null) {
                    accumulators[slot] = new Accumulator();
                }
                accumulators[slot].add(point.getX(), point.getY());
            }
        }

        List<TimeseriesBucket> buckets = new ArrayList<>();
        for (int i = 0; i < accumulators.length; i++) {
            if (accumulators[i] != null) {
                buckets.add(accumulators[i].toBucket(ranges.get(i)));
            }
        }
        logger.trace("Aggregated {} points into {} of {} buckets", points.size(), buckets.size(), ranges.size());
        return buckets;
    }

    // NaN compares false everywhere and falls past the last slot
    private static int firstUpperBoundAtLeast(double[] upperBounds, double x) {
        int low = 0;
        int high = upperBounds.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (upperBounds[mid] >= x) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }

    private static final class Accumulator {
        private int finite;
        private int nan;
        private int positiveInf;
        private int negativeInf;
        private double sum;
        private double yMin = Double.NaN;
        private double yMax = Double.NaN;
        private double firstX = Double.NaN;
        private double firstY = Double.NaN;
        private double lastX = Double.NaN;
        private double lastY = Double.NaN;

        void add(double x, double y) {
            if (Double.isNaN(y)) {
                nan++;
                return;
            }
            if (y == Double.POSITIVE_INFINITY) {
                positiveInf++;
                return;
            }
            if (y == Double.NEGATIVE_INFINITY) {
                negativeInf++;
                return;
            }
            if (finite == 0) {
                firstX = x;
                firstY = y;
                lastX = x;
                lastY = y;
                yMin = y;
                yMax = y;
            } else {
                if (x < firstX) {
                    firstX = x;
                    firstY = y;
                }
                if (x >= lastX) {
                    lastX = x;
                    lastY = y;
                }
                yMin = Math.min(yMin, y);
                yMax = Math.max(yMax, y);
            }
            finite++;
            sum += y;
        }

        TimeseriesBucket toBucket(BucketRange range) {
            return new TimeseriesBucket(range, firstX, firstY, lastX, lastY, yMin, yMax, finite, sum,
                    nan, positiveInf, negativeInf);
        }
    }
}
