package com.neptune.query.api.clients;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.neptune.query.api.concurrency.QueryContext;
import com.neptune.query.api.model.Page;
import com.neptune.query.api.model.RunIdentifier;

/**
 * Client for run search. Results are offset-paginated with the run batch size as page size.
 */
public class RunSearchClient {

    private static final Logger logger = LoggerFactory.getLogger(RunSearchClient.class);

    static final String SEARCH_PATH = "/api/leaderboard/v1/leaderboard/entries/searchUserRuns";
    static final String SYS_ID = "sys/id";
    static final String DEFAULT_SORT_ATTRIBUTE = "sys/creation_time";

    private final NeptuneApiBase apiBase;

    public RunSearchClient(NeptuneApiBase apiBase) {
        this.apiBase = apiBase;
    }

    /**
     * Pages of runs of a project, newest first.
     *
     * @param projectIdentifier {@code workspace/project}
     * @param query             server-side filter expression, or null for all runs
     * @param limit             maximum number of runs, or null for no limit
     */
    public Iterator<Page<RunIdentifier>> searchRuns(String projectIdentifier, String query, Integer limit,
                                                    QueryContext context) {
        return new PaginatedFetch<>("searchRuns", apiBase.getRetryingCaller(),
                (offset, count) -> apiBase.postJson(SEARCH_PATH, searchBody(projectIdentifier, query, offset, count), context)
                        .map(body -> toRunIdentifiers(body, projectIdentifier)),
                apiBase.getLimits().getSysAttrsBatchSize(), limit);
    }

    /**
     * All runs matching the query, up to {@code limit}.
     */
    public List<RunIdentifier> listRuns(String projectIdentifier, String query, Integer limit, QueryContext context) {
        List<RunIdentifier> runs = new ArrayList<>();
        Iterator<Page<RunIdentifier>> pages = searchRuns(projectIdentifier, query, limit, context);
        while (pages.hasNext()) {
            runs.addAll(pages.next().getItems());
        }
        logger.debug("Found {} runs in {}", runs.size(), projectIdentifier);
        return runs;
    }

    static Map<String, Object> searchBody(String projectIdentifier, String query, int offset, int count) {
        Map<String, Object> pagination = new LinkedHashMap<>();
        pagination.put("limit", count);
        pagination.put("offset", offset);

        Map<String, Object> sortBy = new LinkedHashMap<>();
        sortBy.put("name", DEFAULT_SORT_ATTRIBUTE);
        sortBy.put("type", "datetime");
        Map<String, Object> sorting = new LinkedHashMap<>();
        sorting.put("sortBy", sortBy);
        sorting.put("dir", "descending");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("projectIdentifier", projectIdentifier);
        body.put("experimentLeader", false);
        body.put("pagination", pagination);
        body.put("sorting", sorting);
        if (query != null && !query.isBlank()) {
            body.put("query", Map.of("query", query));
        }
        return body;
    }

    static List<RunIdentifier> toRunIdentifiers(JsonNode body, String requestedProject) {
        List<RunIdentifier> runs = new ArrayList<>();
        for (JsonNode entry : body.path("entries")) {
            String sysId = stringAttribute(entry, SYS_ID);
            if (sysId == null) {
                sysId = entry.path("experimentId").asText(null);
            }
            if (sysId == null) {
                throw new NeptuneApiException("Expected " + SYS_ID + " in run search response");
            }
            runs.add(new RunIdentifier(projectOf(entry, requestedProject), sysId));
        }
        return runs;
    }

    private static String projectOf(JsonNode entry, String requestedProject) {
        String organization = entry.path("organizationName").asText("");
        String project = entry.path("projectName").asText("");
        if (organization.isEmpty() || project.isEmpty()) {
            return requestedProject;
        }
        return organization + "/" + project;
    }

    private static String stringAttribute(JsonNode entry, String name) {
        for (JsonNode attribute : entry.path("attributes")) {
            if (name.equals(attribute.path("name").asText())) {
                JsonNode value = attribute.path("stringProperties").path("value");
                return value.isMissingNode() || value.isNull() ? null : value.asText();
            }
        }
        return null;
    }
}
