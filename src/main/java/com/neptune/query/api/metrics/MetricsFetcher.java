package com.neptune.query.api.metrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.neptune.query.api.clients.NeptuneApiClient;
import com.neptune.query.api.clients.SeriesQuery;
import com.neptune.query.api.concurrency.QueryContext;
import com.neptune.query.api.model.AttributeDefinition;
import com.neptune.query.api.model.AttributeType;
import com.neptune.query.api.model.Page;
import com.neptune.query.api.model.RunAttributeDefinition;
import com.neptune.query.api.model.RunIdentifier;
import com.neptune.query.api.model.SeriesPoint;
import com.neptune.query.api.model.SeriesValues;

/**
 * Fetches float series for many runs: splits the runs x metrics product into batches, fetches
 * the batches on the worker pool and merges the chunks of each series.
 */
public class MetricsFetcher {

    private static final Logger logger = LoggerFactory.getLogger(MetricsFetcher.class);

    static final String API_FUNCTION = "fetch_metrics";

    private final NeptuneApiClient client;

    public MetricsFetcher(NeptuneApiClient client) {
        this.client = client;
    }

    /**
     * Finds the runs matching {@code runQuery} and fetches the named metrics for each of them.
     * A run that does not log a metric has no entry for it.
     *
     * @param projectIdentifier {@code workspace/project}
     * @param runQuery          run filter, or null for all runs
     * @param runLimit          maximum number of runs, or null
     * @param metricNames       float series attribute names
     */
    public Map<RunAttributeDefinition, List<SeriesPoint>> fetchMetrics(String projectIdentifier, String runQuery,
                                                                       Integer runLimit, List<String> metricNames,
                                                                       SeriesQuery query) {
        QueryContext context = client.newQuery(API_FUNCTION);
        List<RunIdentifier> runs = client.runs().listRuns(projectIdentifier, runQuery, runLimit, context);
        return fetchMetrics(runs, metricNames, query, context);
    }

    /**
     * Runs are first cut into run-id batches; the series of each run batch are then split on
     * their own, so no series request mixes runs from two run batches.
     */
    public Map<RunAttributeDefinition, List<SeriesPoint>> fetchMetrics(List<RunIdentifier> runs,
                                                                       List<String> metricNames,
                                                                       SeriesQuery query, QueryContext context) {
        List<List<RunAttributeDefinition>> batches = new ArrayList<>();
        for (List<RunIdentifier> runGroup : client.splitter().splitRunIdentifiers(runs)) {
            List<RunAttributeDefinition> definitions = new ArrayList<>(runGroup.size() * metricNames.size());
            for (RunIdentifier run : runGroup) {
                for (String name : metricNames) {
                    definitions.add(new RunAttributeDefinition(run,
                            new AttributeDefinition(name, AttributeType.FLOAT_SERIES)));
                }
            }
            batches.addAll(client.splitter().splitSeriesAttributes(definitions));
        }
        return fetchBatches(batches, query, context);
    }

    /**
     * Fetches the given series. The result is ordered by run and attribute; the points of each
     * series are in ascending x order.
     */
    public Map<RunAttributeDefinition, List<SeriesPoint>> fetchSeries(List<RunAttributeDefinition> definitions,
                                                                      SeriesQuery query, QueryContext context) {
        return fetchBatches(client.splitter().splitSeriesAttributes(definitions), query, context);
    }

    private Map<RunAttributeDefinition, List<SeriesPoint>> fetchBatches(List<List<RunAttributeDefinition>> batches,
                                                                        SeriesQuery query, QueryContext context) {
        long start = System.currentTimeMillis();
        List<Page<SeriesValues>> pages = client.fanOut().fetchAll("fetchMetrics", batches, context,
                (batch, ctx) -> client.series().fetchSeries(batch, query, ctx));

        Map<RunAttributeDefinition, List<SeriesPoint>> merged = new TreeMap<>();
        int pointCount = 0;
        for (Page<SeriesValues> page : pages) {
            for (SeriesValues chunk : page.getItems()) {
                merged.computeIfAbsent(chunk.getDefinition(), k -> new ArrayList<>()).addAll(chunk.getPoints());
                pointCount += chunk.getPoints().size();
            }
        }
        for (List<SeriesPoint> points : merged.values()) {
            points.sort(Comparator.comparingDouble(SeriesPoint::getX));
        }

        logger.info("Fetched {} points of {} series in {} batches ({} ms) [{}]", pointCount, merged.size(),
                batches.size(), System.currentTimeMillis() - start, context.getQueryId());
        return new LinkedHashMap<>(merged);
    }
}
