package com.neptune.query.api.clients;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.neptune.query.api.concurrency.QueryContext;
import com.neptune.query.api.model.Page;
import com.neptune.query.api.model.RunAttributeDefinition;
import com.neptune.query.api.model.SeriesPoint;
import com.neptune.query.api.model.SeriesValues;

/**
 * Client for float series values. Many series share one request; each page returns up to
 * {@code perSeriesPointsLimit} points per series, and only series whose page came back full are
 * requested again, continuing after their last step.
 */
public class SeriesValuesClient {

    private static final Logger logger = LoggerFactory.getLogger(SeriesValuesClient.class);

    static final String SERIES_PATH = "/api/leaderboard/v1/attributes/series/float";

    /** Points the server returns at most in one response, summed over series. */
    public static final int TOTAL_POINT_LIMIT = 1_000_000;

    private final NeptuneApiBase apiBase;
    private final int totalPointLimit;

    public SeriesValuesClient(NeptuneApiBase apiBase) {
        this(apiBase, TOTAL_POINT_LIMIT);
    }

    SeriesValuesClient(NeptuneApiBase apiBase, int totalPointLimit) {
        this.apiBase = apiBase;
        this.totalPointLimit = totalPointLimit;
    }

    /**
     * Pages of series chunks for one batch. A series can appear in several pages; within each
     * chunk points are in ascending step order.
     */
    public Iterator<Page<SeriesValues>> fetchSeries(List<RunAttributeDefinition> batch, SeriesQuery query,
                                                    QueryContext context) {
        if (batch.size() > totalPointLimit) {
            throw new IllegalArgumentException("Cannot request more than " + totalPointLimit
                    + " series at once, got " + batch.size());
        }
        return new SeriesFetch(batch, query, context);
    }

    static int perSeriesPointsLimit(int totalPointLimit, int seriesInRequest, Integer tailLimit, int alreadyFetched) {
        int limit = Math.max(1, totalPointLimit / seriesInRequest);
        if (tailLimit != null) {
            limit = Math.min(limit, Math.max(1, tailLimit - alreadyFetched));
        }
        return limit;
    }

    private final class SeriesFetch extends PageSequence<SeriesValues> {

        private final SeriesQuery query;
        private final QueryContext context;
        private final Map<String, RunAttributeDefinition> byRequestId = new LinkedHashMap<>();
        private final Map<String, Double> afterStep = new HashMap<>();
        private final Map<String, Integer> fetchedPoints = new HashMap<>();
        private List<String> pending;

        SeriesFetch(List<RunAttributeDefinition> batch, SeriesQuery query, QueryContext context) {
            super("fetchSeriesValues", apiBase.getRetryingCaller());
            this.query = query;
            this.context = context;

            int width = String.valueOf(Math.max(0, batch.size() - 1)).length();
            for (int i = 0; i < batch.size(); i++) {
                byRequestId.put(String.format("%0" + width + "d", i), batch.get(i));
            }
            this.pending = new ArrayList<>(byRequestId.keySet());
            if (pending.isEmpty()) {
                markLastPage();
            }
        }

        @Override
        protected List<SeriesValues> fetchPage() {
            int alreadyFetched = fetchedPoints.getOrDefault(pending.get(0), 0);
            int pointsLimit = perSeriesPointsLimit(totalPointLimit, pending.size(), query.getTailLimit(),
                    alreadyFetched);
            Map<String, Object> body = requestBody(pointsLimit);

            List<ParsedSeries> parsed = caller.execute(operation,
                    () -> apiBase.postJson(SERIES_PATH, body, context).map(this::parse),
                    Collections.emptyList());

            List<String> nextPending = new ArrayList<>();
            List<SeriesValues> chunks = new ArrayList<>(parsed.size());
            for (ParsedSeries series : parsed) {
                int total = fetchedPoints.merge(series.requestId, series.points.size(), Integer::sum);
                boolean pageFull = series.points.size() == pointsLimit;
                boolean needMore = query.getTailLimit() == null || total < query.getTailLimit();
                if (pageFull && needMore && series.lastStep != null) {
                    afterStep.put(series.requestId, series.lastStep);
                    nextPending.add(series.requestId);
                }
                if (!series.points.isEmpty()) {
                    chunks.add(new SeriesValues(byRequestId.get(series.requestId), series.points));
                }
            }

            logger.debug("{}: {} series returned, {} need another page", operation, parsed.size(), nextPending.size());
            pending = nextPending;
            if (pending.isEmpty()) {
                markLastPage();
            }
            return chunks;
        }

        private Map<String, Object> requestBody(int pointsLimit) {
            List<Map<String, Object>> requests = new ArrayList<>(pending.size());
            for (String requestId : pending) {
                RunAttributeDefinition definition = byRequestId.get(requestId);

                Map<String, Object> holder = new LinkedHashMap<>();
                holder.put("identifier", definition.getRunIdentifier().toString());
                holder.put("type", "experiment");

                Map<String, Object> series = new LinkedHashMap<>();
                series.put("holder", holder);
                series.put("attribute", definition.getAttributeDefinition().getName());
                series.put("lineage", query.isLineageToTheRoot() ? "FULL" : "NONE");
                series.put("includePreview", query.isIncludePointPreviews());

                Map<String, Object> request = new LinkedHashMap<>();
                request.put("requestId", requestId);
                request.put("series", series);
                if (afterStep.containsKey(requestId)) {
                    request.put("afterStep", afterStep.get(requestId));
                }
                requests.add(request);
            }

            Map<String, Object> stepRange = new LinkedHashMap<>();
            stepRange.put("from", query.getStepFrom());
            stepRange.put("to", query.getStepTo());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("requests", requests);
            body.put("stepRange", stepRange);
            body.put("order", query.getTailLimit() == null ? "ascending" : "descending");
            body.put("perSeriesPointsLimit", pointsLimit);
            return body;
        }

        private List<ParsedSeries> parse(JsonNode body) {
            boolean descending = query.getTailLimit() != null;
            List<ParsedSeries> result = new ArrayList<>();
            for (JsonNode entry : body.path("series")) {
                String requestId = entry.path("requestId").asText();
                if (!byRequestId.containsKey(requestId)) {
                    throw new NeptuneApiException("Series response names unknown request " + requestId);
                }
                List<SeriesPoint> points = new ArrayList<>();
                Double lastStep = null;
                for (JsonNode value : entry.path("series").path("values")) {
                    double step = value.path("step").asDouble();
                    Long timestamp = query.isIncludeTimestamp() && value.hasNonNull("timestampMillis")
                            ? value.get("timestampMillis").asLong() : null;
                    Boolean preview = null;
                    Double completionRatio = null;
                    if (query.isIncludePointPreviews()) {
                        preview = value.path("isPreview").asBoolean(false);
                        completionRatio = value.path("completionRatio").asDouble(1.0);
                    }
                    points.add(new SeriesPoint(step, value.path("value").asDouble(Double.NaN), timestamp,
                            preview, completionRatio));
                    lastStep = step;
                }
                if (descending) {
                    Collections.reverse(points);
                }
                result.add(new ParsedSeries(requestId, points, lastStep));
            }
            return result;
        }
    }

    private static final class ParsedSeries {
        private final String requestId;
        private final List<SeriesPoint> points;
        private final Double lastStep;

        ParsedSeries(String requestId, List<SeriesPoint> points, Double lastStep) {
            this.requestId = requestId;
            this.points = points;
            this.lastStep = lastStep;
        }
    }
}
