package com.neptune.query.api.metrics;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.neptune.query.api.clients.NeptuneApiClient;
import com.neptune.query.api.concurrency.QueryContext;
import com.neptune.query.api.model.AttributeDefinition;
import com.neptune.query.api.model.AttributeValue;
import com.neptune.query.api.model.Page;
import com.neptune.query.api.model.RunAttributeDefinition;
import com.neptune.query.api.model.RunIdentifier;
import com.neptune.query.api.split.RunAttributeBatch;

/**
 * Fetches scalar attribute values for a runs x attributes grid, one worker per grid cell.
 */
public class AttributeValuesFetcher {

    private static final Logger logger = LoggerFactory.getLogger(AttributeValuesFetcher.class);

    static final String API_FUNCTION = "fetch_runs_table";

    private final NeptuneApiClient client;

    public AttributeValuesFetcher(NeptuneApiClient client) {
        this.client = client;
    }

    public Map<RunAttributeDefinition, Object> fetchAttributeValues(String projectIdentifier, String runQuery,
                                                                    Integer runLimit,
                                                                    List<AttributeDefinition> attributes) {
        QueryContext context = client.newQuery(API_FUNCTION);
        List<RunIdentifier> runs = client.runs().listRuns(projectIdentifier, runQuery, runLimit, context);
        return fetchAttributeValues(runs, attributes, context);
    }

    /**
     * Values ordered by run and attribute. Missing values are absent, not null.
     */
    public Map<RunAttributeDefinition, Object> fetchAttributeValues(List<RunIdentifier> runs,
                                                                    List<AttributeDefinition> attributes,
                                                                    QueryContext context) {
        List<RunAttributeBatch> batches = client.splitter().splitRunsAttributes(runs, attributes);
        List<Page<AttributeValue>> pages = client.fanOut().fetchAll("fetchAttributeValues", batches, context,
                (batch, ctx) -> client.attributeValues().fetchAttributeValues(batch, ctx));

        Map<RunAttributeDefinition, Object> values = new TreeMap<>();
        for (Page<AttributeValue> page : pages) {
            for (AttributeValue value : page.getItems()) {
                values.put(value.getDefinition(), value.getValue());
            }
        }
        logger.info("Fetched {} values for {} runs x {} attributes in {} batches [{}]", values.size(), runs.size(),
                attributes.size(), batches.size(), context.getQueryId());
        return values;
    }
}
