package com.neptune.query.api.metrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.neptune.query.api.buckets.BucketAggregator;
import com.neptune.query.api.buckets.BucketRange;
import com.neptune.query.api.buckets.TimeseriesBucket;
import com.neptune.query.api.clients.NeptuneApiClient;
import com.neptune.query.api.clients.SeriesQuery;
import com.neptune.query.api.concurrency.QueryContext;
import com.neptune.query.api.model.RunAttributeDefinition;
import com.neptune.query.api.model.RunIdentifier;
import com.neptune.query.api.model.SeriesPoint;

/**
 * Fetches metrics and summarizes every series into buckets. All series share the same bucket
 * ranges so their buckets line up.
 */
public class MetricBucketsFetcher {

    private static final Logger logger = LoggerFactory.getLogger(MetricBucketsFetcher.class);

    static final String API_FUNCTION = "fetch_metric_buckets";

    private final NeptuneApiClient client;
    private final MetricsFetcher metricsFetcher;

    public MetricBucketsFetcher(NeptuneApiClient client) {
        this.client = client;
        this.metricsFetcher = new MetricsFetcher(client);
    }

    /**
     * @param bucketLimit number of buckets, must be positive
     * @param xRange      {@code {from, to}} shared by all series, or null for the x extent of all
     *                    fetched points
     */
    public Map<RunAttributeDefinition, List<TimeseriesBucket>> fetchMetricBuckets(
            String projectIdentifier, String runQuery, Integer runLimit, List<String> metricNames,
            int bucketLimit, double[] xRange) {
        if (bucketLimit <= 0) {
            throw new IllegalArgumentException("Bucket limit must be positive, got " + bucketLimit);
        }
        QueryContext context = client.newQuery(API_FUNCTION);
        List<RunIdentifier> runs = client.runs().listRuns(projectIdentifier, runQuery, runLimit, context);
        Map<RunAttributeDefinition, List<SeriesPoint>> series =
                metricsFetcher.fetchMetrics(runs, metricNames, SeriesQuery.all(), context);
        return aggregate(series, bucketLimit, xRange);
    }

    static Map<RunAttributeDefinition, List<TimeseriesBucket>> aggregate(
            Map<RunAttributeDefinition, List<SeriesPoint>> series, int bucketLimit, double[] xRange) {
        Map<RunAttributeDefinition, List<TimeseriesBucket>> result = new LinkedHashMap<>();
        double[] range = xRange != null ? xRange : globalRange(series);
        if (range == null) {
            return result;
        }

        List<BucketRange> ranges = BucketAggregator.bucketRanges(range[0], range[1], bucketLimit);
        for (Map.Entry<RunAttributeDefinition, List<SeriesPoint>> entry : series.entrySet()) {
            result.put(entry.getKey(), BucketAggregator.aggregate(entry.getValue(), ranges));
        }
        logger.debug("Bucketed {} series into {} ranges over [{}, {}]", series.size(), ranges.size(), range[0], range[1]);
        return result;
    }

    private static double[] globalRange(Map<RunAttributeDefinition, List<SeriesPoint>> series) {
        double from = Double.POSITIVE_INFINITY;
        double to = Double.NEGATIVE_INFINITY;
        for (List<SeriesPoint> points : series.values()) {
            for (SeriesPoint point : points) {
                from = Math.min(from, point.getX());
                to = Math.max(to, point.getX());
            }
        }
        return from <= to ? new double[] {from, to} : null;
    }
}
