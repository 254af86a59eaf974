package com.neptune.query.api.clients;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neptune.query.api.concurrency.QueryContext;
import com.neptune.query.api.model.AttributeDefinition;
import com.neptune.query.api.model.AttributeType;
import com.neptune.query.api.model.AttributeValue;
import com.neptune.query.api.model.Page;
import com.neptune.query.api.model.RunAttributeDefinition;
import com.neptune.query.api.model.RunIdentifier;
import com.neptune.query.api.split.RunAttributeBatch;

/**
 * Client for scalar attribute values of a runs x attributes grid cell.
 */
public class AttributeValuesClient {

    static final String VALUES_PATH = "/api/leaderboard/v1/leaderboard/attributes/values/query";

    private final NeptuneApiBase apiBase;

    public AttributeValuesClient(NeptuneApiBase apiBase) {
        this.apiBase = apiBase;
    }

    /**
     * Pages of values for one grid cell. A run that lacks an attribute simply has no entry.
     */
    public Iterator<Page<AttributeValue>> fetchAttributeValues(RunAttributeBatch batch, QueryContext context) {
        Map<String, RunIdentifier> runsById = new HashMap<>();
        List<String> runIds = new ArrayList<>(batch.getRuns().size());
        for (RunIdentifier run : batch.getRuns()) {
            runsById.put(run.toString(), run);
            runIds.add(run.toString());
        }
        List<String> names = new ArrayList<>(batch.getAttributes().size());
        for (AttributeDefinition attribute : batch.getAttributes()) {
            names.add(attribute.getName());
        }

        return new PaginatedFetch<>("fetchAttributeValues", apiBase.getRetryingCaller(),
                (offset, count) -> apiBase.postJson(VALUES_PATH, valuesBody(runIds, names, offset, count), context)
                        .map(body -> toAttributeValues(body, runsById, apiBase.getObjectMapper())),
                apiBase.getLimits().getAttributeValuesBatchSize(), null);
    }

    static Map<String, Object> valuesBody(List<String> runIds, List<String> attributeNames, int offset, int count) {
        Map<String, Object> pagination = new LinkedHashMap<>();
        pagination.put("limit", count);
        pagination.put("offset", offset);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("experimentIdsFilter", runIds);
        body.put("attributeNamesFilter", attributeNames);
        body.put("pagination", pagination);
        return body;
    }

    static List<AttributeValue> toAttributeValues(JsonNode body, Map<String, RunIdentifier> runsById,
                                                  ObjectMapper objectMapper) {
        List<AttributeValue> values = new ArrayList<>();
        for (JsonNode entry : body.path("entries")) {
            String runId = entry.path("experimentId").asText();
            RunIdentifier run = runsById.get(runId);
            if (run == null) {
                throw new NeptuneApiException("Attribute values response names unknown run " + runId);
            }
            AttributeType type;
            try {
                type = AttributeType.fromWireName(entry.path("type").asText());
            } catch (IllegalArgumentException e) {
                throw new NeptuneApiException("Attribute values response has an invalid type", e);
            }
            AttributeDefinition attribute = new AttributeDefinition(entry.path("name").asText(), type);
            Object value = objectMapper.convertValue(entry.get("value"), Object.class);
            values.add(new AttributeValue(new RunAttributeDefinition(run, attribute), value));
        }
        return values;
    }
}
