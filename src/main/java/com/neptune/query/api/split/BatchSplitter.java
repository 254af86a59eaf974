package com.neptune.query.api.split;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.ToIntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.neptune.query.api.config.QueryLimits;
import com.neptune.query.api.model.AttributeDefinition;
import com.neptune.query.api.model.RunAttributeDefinition;
import com.neptune.query.api.model.RunIdentifier;
import com.neptune.query.api.model.SizeEstimable;

/**
 * Partitions large logical requests into batches the server accepts.
 *
 * <p>Every method is a pure function of its input and the {@link QueryLimits} given at
 * construction: concatenating the returned batches in order gives back the input, and no
 * batch exceeds the count or size limit unless it holds a single item. Returned batches are
 * {@link List#subList} views over the input list.
 */
public class BatchSplitter {

    private static final Logger logger = LoggerFactory.getLogger(BatchSplitter.class);

    private final QueryLimits limits;

    public BatchSplitter(QueryLimits limits) {
        this.limits = limits;
    }

    public QueryLimits getLimits() {
        return limits;
    }

    /**
     * Run ids for a single request, split into the fewest batches the request size budget and
     * the run batch size allow, cut into equal chunks with the remainder last.
     */
    public List<List<RunIdentifier>> splitRunIdentifiers(List<RunIdentifier> runs) {
        return splitBalanced(runs, RunIdentifier::estimatedSizeBytes,
                limits.getSysAttrsBatchSize(), limits.getMaxRequestSize());
    }

    /**
     * Attribute names for a name filter, packed greedily under the filter size budget.
     */
    public List<List<String>> splitAttributeNames(List<String> names) {
        return splitGreedy(names, name -> name.getBytes(StandardCharsets.UTF_8).length,
                Integer.MAX_VALUE, limits.getMaxAttributeFilterSize());
    }

    /**
     * Splits a runs x attributes cross product into grid cells. Attributes are packed greedily
     * so that one run plus the group fits the request budget; each run group is then as large
     * as both the pair count cap and the remaining budget allow. Run groups are the outer loop.
     *
     * <p>Greedy attribute groups leave little budget for run ids, so this shape can hold more
     * cells than there are workers. In that case smaller attribute groups are tried and the grid
     * with the fewest cells is kept; the request size and pair count limits still hold for every
     * cell, so the result exceeds the worker count only when no grid within those limits fits.
     */
    public List<RunAttributeBatch> splitRunsAttributes(List<RunIdentifier> runs,
                                                       List<AttributeDefinition> attributes) {
        if (runs.isEmpty() || attributes.isEmpty()) {
            return Collections.emptyList();
        }

        int pairLimit = limits.getAttributeValuesBatchSize();
        int maxWorkers = limits.getMaxWorkers();

        List<List<AttributeDefinition>> attributeGroups = attributeGroups(attributes, pairLimit);
        int cells = cellCount(runs.size(), attributeGroups);

        if (cells > maxWorkers) {
            int bestCap = pairLimit;
            int bestCells = cells;
            for (int cap = Math.min(attributes.size(), pairLimit) - 1; cap >= 1; cap--) {
                int candidate = cellCount(runs.size(), attributeGroups(attributes, cap));
                if (candidate < bestCells) {
                    bestCells = candidate;
                    bestCap = cap;
                }
            }
            if (bestCells < cells) {
                logger.debug("Coarsened grid of {} runs x {} attributes from {} to {} batches ({} attributes per group)",
                        runs.size(), attributes.size(), cells, bestCells, bestCap);
                attributeGroups = attributeGroups(attributes, bestCap);
                cells = bestCells;
            }
            if (cells > maxWorkers) {
                logger.debug("Grid split of {} runs x {} attributes needs {} batches for {} workers",
                        runs.size(), attributes.size(), cells, maxWorkers);
            }
        }

        List<List<RunIdentifier>> runGroups = splitBalanced(runs, RunIdentifier::estimatedSizeBytes,
                runsPerBatch(attributeGroups), Long.MAX_VALUE);

        List<RunAttributeBatch> batches = new ArrayList<>(runGroups.size() * attributeGroups.size());
        for (List<RunIdentifier> runGroup : runGroups) {
            for (List<AttributeDefinition> attributeGroup : attributeGroups) {
                batches.add(new RunAttributeBatch(runGroup, attributeGroup));
            }
        }
        return batches;
    }

    private List<List<AttributeDefinition>> attributeGroups(List<AttributeDefinition> attributes, int countCap) {
        return splitGreedy(attributes, AttributeDefinition::estimatedSizeBytes, countCap,
                (long) limits.getMaxRequestSize() - RunIdentifier.ESTIMATED_SIZE_BYTES);
    }

    /** Runs per cell so that the widest and the largest attribute group stay within both limits. */
    private int runsPerBatch(List<List<AttributeDefinition>> attributeGroups) {
        int widestGroup = 1;
        long largestGroupSize = 0;
        for (List<AttributeDefinition> group : attributeGroups) {
            widestGroup = Math.max(widestGroup, group.size());
            largestGroupSize = Math.max(largestGroupSize, totalSize(group, AttributeDefinition::estimatedSizeBytes));
        }
        long runsByBudget = ((long) limits.getMaxRequestSize() - largestGroupSize) / RunIdentifier.ESTIMATED_SIZE_BYTES;
        long runsByPairs = limits.getAttributeValuesBatchSize() / widestGroup;
        return (int) Math.max(1, Math.min(runsByBudget, runsByPairs));
    }

    // run groups have equal length with unbounded size, as splitBalanced cuts them
    private int cellCount(int runCount, List<List<AttributeDefinition>> attributeGroups) {
        int runsPerBatch = Math.min(runCount, runsPerBatch(attributeGroups));
        return ceilDiv(runCount, runsPerBatch) * attributeGroups.size();
    }

    /**
     * Splits an already flattened runs x series cross product. The target batch length is
     * n^(2/3), which gives roughly n^(1/3) batches of comparable size. When that would need
     * more batches than there are workers the target grows to n / maxWorkers, and the series
     * batch size and request budget cap it in the end.
     */
    public List<List<RunAttributeDefinition>> splitSeriesAttributes(List<RunAttributeDefinition> items) {
        int n = items.size();
        if (n == 0) {
            return Collections.emptyList();
        }

        double cubeRoot = Math.cbrt(n);
        long target = (long) Math.ceil(cubeRoot * cubeRoot);
        target = Math.max(target, ceilDiv(n, limits.getMaxWorkers()));
        int batchLength = (int) Math.max(1, Math.min(target, limits.getSeriesBatchSize()));

        return splitGreedy(items, RunAttributeDefinition::estimatedSizeBytes,
                batchLength, limits.getMaxRequestSize());
    }

    /**
     * Balanced split: finds the fewest batches {@code k} such that chunks of {@code ceil(n / k)}
     * consecutive items respect both limits, then cuts the input into such chunks. All batches
     * but the last have equal length.
     */
    public static <T> List<List<T>> splitBalanced(List<T> items, ToIntFunction<? super T> sizer,
                                                  int countLimit, long sizeLimit) {
        int n = items.size();
        if (n == 0) {
            return Collections.emptyList();
        }
        if (countLimit <= 0) {
            throw new IllegalArgumentException("countLimit must be positive, got " + countLimit);
        }

        long[] prefix = prefixSizes(items, sizer);
        int longestFitting = longestFittingWindow(prefix, Math.min(n, countLimit), sizeLimit);
        int batchCount = ceilDiv(n, longestFitting);
        int chunk = ceilDiv(n, batchCount);

        List<List<T>> batches = new ArrayList<>(batchCount);
        for (int from = 0; from < n; from += chunk) {
            batches.add(items.subList(from, Math.min(n, from + chunk)));
        }
        return batches;
    }

    /**
     * Greedy split: fills each batch in input order until the next item would break the count
     * or size limit. A single oversized item still forms its own batch.
     */
    public static <T> List<List<T>> splitGreedy(List<T> items, ToIntFunction<? super T> sizer,
                                                int countLimit, long sizeLimit) {
        if (items.isEmpty()) {
            return Collections.emptyList();
        }
        if (countLimit <= 0) {
            throw new IllegalArgumentException("countLimit must be positive, got " + countLimit);
        }

        List<List<T>> batches = new ArrayList<>();
        int start = 0;
        long batchSize = 0;
        for (int i = 0; i < items.size(); i++) {
            long itemSize = sizer.applyAsInt(items.get(i));
            int batchCount = i - start;
            if (batchCount > 0 && (batchCount >= countLimit || batchSize + itemSize > sizeLimit)) {
                batches.add(items.subList(start, i));
                start = i;
                batchSize = 0;
            }
            batchSize += itemSize;
        }
        batches.add(items.subList(start, items.size()));
        return batches;
    }

    /** Convenience overload for items that estimate their own size. */
    public static <T extends SizeEstimable> List<List<T>> splitBalanced(List<T> items, int countLimit, long sizeLimit) {
        return splitBalanced(items, SizeEstimable::estimatedSizeBytes, countLimit, sizeLimit);
    }

    private static <T> long[] prefixSizes(List<T> items, ToIntFunction<? super T> sizer) {
        long[] prefix = new long[items.size() + 1];
        for (int i = 0; i < items.size(); i++) {
            prefix[i + 1] = prefix[i] + sizer.applyAsInt(items.get(i));
        }
        return prefix;
    }

    /**
     * Largest window length in [1, maxLength] whose every placement sums to at most sizeLimit.
     * The predicate is monotone in the length, so a binary search suffices.
     */
    private static int longestFittingWindow(long[] prefix, int maxLength, long sizeLimit) {
        int low = 1;
        int high = maxLength;
        while (low < high) {
            int mid = low + (high - low + 1) / 2;
            if (maxWindowSum(prefix, mid) <= sizeLimit) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    private static long maxWindowSum(long[] prefix, int length) {
        long max = 0;
        for (int end = length; end < prefix.length; end++) {
            max = Math.max(max, prefix[end] - prefix[end - length]);
        }
        return max;
    }

    private static <T> long totalSize(List<T> items, ToIntFunction<? super T> sizer) {
        long total = 0;
        for (T item : items) {
            total += sizer.applyAsInt(item);
        }
        return total;
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }
}
