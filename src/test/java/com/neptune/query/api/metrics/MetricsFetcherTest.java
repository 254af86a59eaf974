package com.neptune.query.api.metrics;

import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.neptune.query.api.clients.AuthorizationException;
import com.neptune.query.api.clients.BackoffPolicy;
import com.neptune.query.api.clients.NeptuneApiBase;
import com.neptune.query.api.clients.NeptuneApiClient;
import com.neptune.query.api.clients.RetryingCaller;
import com.neptune.query.api.clients.SeriesQuery;
import com.neptune.query.api.config.QueryLimits;
import com.neptune.query.api.model.AttributeDefinition;
import com.neptune.query.api.model.AttributeType;
import com.neptune.query.api.model.RunAttributeDefinition;
import com.neptune.query.api.model.RunIdentifier;
import com.neptune.query.api.model.SeriesPoint;
import com.neptune.query.api.warnings.MutableClock;
import com.neptune.query.api.warnings.WarningRegistry;

public class MetricsFetcherTest {

    static final String BASE_URL = "http://localhost";
    static final String SEARCH_URL = BASE_URL + "/api/leaderboard/v1/leaderboard/entries/searchUserRuns";
    static final String SERIES_URL = BASE_URL + "/api/leaderboard/v1/attributes/series/float";

    static final String TWO_RUNS = "{\"entries\":["
            + "{\"organizationName\":\"ws\",\"projectName\":\"proj\",\"attributes\":[{\"name\":\"sys/id\",\"stringProperties\":{\"value\":\"RUN-2\"}}]},"
            + "{\"organizationName\":\"ws\",\"projectName\":\"proj\",\"attributes\":[{\"name\":\"sys/id\",\"stringProperties\":{\"value\":\"RUN-1\"}}]}]}";

    private MockRestServiceServer server;
    private NeptuneApiClient client;

    @BeforeEach
    public void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        RetryingCaller caller = new RetryingCaller(new BackoffPolicy(2, Duration.ofMillis(1), Duration.ofMillis(1)),
                new WarningRegistry(new MutableClock(Instant.EPOCH), Duration.ofSeconds(60)), duration -> { });
        QueryLimits limits = QueryLimits.builder().maxWorkers(2).build();
        client = new NeptuneApiClient(new NeptuneApiBase(BASE_URL, limits, builder, caller), "token", null);
    }

    @AfterEach
    public void tearDown() {
        client.close();
    }

    static RunAttributeDefinition loss(String sysId) {
        return new RunAttributeDefinition(new RunIdentifier("ws/proj", sysId),
                new AttributeDefinition("loss", AttributeType.FLOAT_SERIES));
    }

    @Test
    public void testFetchMetricsForMatchingRuns() {
        server.expect(requestTo(SEARCH_URL))
                .andExpect(header(NeptuneApiBase.CLIENT_METADATA_HEADER, containsString("\"fn\":\"fetch_metrics\"")))
                .andRespond(withSuccess(TWO_RUNS, MediaType.APPLICATION_JSON));
        server.expect(requestTo(SERIES_URL))
                .andExpect(header(NeptuneApiBase.CLIENT_METADATA_HEADER, containsString("\"fn\":\"fetch_metrics\"")))
                .andExpect(content().string(allOf(containsString("\"identifier\":\"ws/proj/RUN-2\""),
                        containsString("\"identifier\":\"ws/proj/RUN-1\""))))
                .andRespond(withSuccess("{\"series\":["
                        + "{\"requestId\":\"0\",\"series\":{\"values\":[{\"step\":2,\"value\":0.2},{\"step\":1,\"value\":0.4}]}},"
                        + "{\"requestId\":\"1\",\"series\":{\"values\":[{\"step\":1,\"value\":0.7}]}}]}",
                        MediaType.APPLICATION_JSON));

        Map<RunAttributeDefinition, List<SeriesPoint>> metrics = new MetricsFetcher(client)
                .fetchMetrics("ws/proj", null, null, Collections.singletonList("loss"), SeriesQuery.all());

        assertEquals(Arrays.asList(loss("RUN-1"), loss("RUN-2")), new ArrayList<>(metrics.keySet()));
        assertEquals(Arrays.asList(new SeriesPoint(1, 0.7)), metrics.get(loss("RUN-1")));
        assertEquals(Arrays.asList(new SeriesPoint(1, 0.4), new SeriesPoint(2, 0.2)), metrics.get(loss("RUN-2")));
        server.verify();
    }

    @Test
    public void testNoRunsMeansNoSeriesRequests() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withSuccess("{\"entries\":[]}", MediaType.APPLICATION_JSON));

        Map<RunAttributeDefinition, List<SeriesPoint>> metrics = new MetricsFetcher(client)
                .fetchMetrics("ws/proj", null, null, Collections.singletonList("loss"), SeriesQuery.all());

        assertTrue(metrics.isEmpty());
        server.verify();
    }

    @Test
    public void testWorkerFailureAbortsTheQuery() {
        server.expect(requestTo(SERIES_URL)).andRespond(withStatus(HttpStatus.FORBIDDEN).body("no access"));

        List<RunIdentifier> runs = Arrays.asList(new RunIdentifier("ws/proj", "RUN-1"));
        MetricsFetcher fetcher = new MetricsFetcher(client);
        AuthorizationException e = assertThrows(AuthorizationException.class, () -> fetcher.fetchMetrics(runs,
                Collections.singletonList("loss"), SeriesQuery.all(), client.newQuery("fetch_metrics")));

        assertEquals(403, e.getStatusCode());
    }

    @Test
    public void testSeriesBatchesFollowRunBatches() {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer batchServer = MockRestServiceServer.bindTo(builder).build();
        RetryingCaller caller = new RetryingCaller(new BackoffPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1)),
                new WarningRegistry(new MutableClock(Instant.EPOCH), Duration.ofSeconds(60)), duration -> { });
        QueryLimits limits = QueryLimits.builder().maxWorkers(1).sysAttrsBatchSize(2).build();

        // flattened, the five series would share one request with a single worker
        batchServer.expect(requestTo(SERIES_URL))
                .andExpect(content().string(allOf(containsString("ws/proj/RUN-0"), containsString("ws/proj/RUN-1"),
                        not(containsString("ws/proj/RUN-2")))))
                .andRespond(withSuccess("{\"series\":[]}", MediaType.APPLICATION_JSON));
        batchServer.expect(requestTo(SERIES_URL))
                .andExpect(content().string(allOf(containsString("ws/proj/RUN-2"), containsString("ws/proj/RUN-3"),
                        not(containsString("ws/proj/RUN-1")), not(containsString("ws/proj/RUN-4")))))
                .andRespond(withSuccess("{\"series\":[]}", MediaType.APPLICATION_JSON));
        batchServer.expect(requestTo(SERIES_URL))
                .andExpect(content().string(allOf(containsString("ws/proj/RUN-4"),
                        not(containsString("ws/proj/RUN-3")))))
                .andRespond(withSuccess("{\"series\":[{\"requestId\":\"0\",\"series\":{\"values\":[{\"step\":1,\"value\":0.1}]}}]}",
                        MediaType.APPLICATION_JSON));

        List<RunIdentifier> runs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            runs.add(new RunIdentifier("ws/proj", "RUN-" + i));
        }
        try (NeptuneApiClient batchClient = new NeptuneApiClient(
                new NeptuneApiBase(BASE_URL, limits, builder, caller), "token", null)) {
            Map<RunAttributeDefinition, List<SeriesPoint>> metrics = new MetricsFetcher(batchClient).fetchMetrics(runs,
                    Collections.singletonList("loss"), SeriesQuery.all(), batchClient.newQuery("fetch_metrics"));

            assertEquals(Collections.singletonList(loss("RUN-4")), new ArrayList<>(metrics.keySet()));
        }
        batchServer.verify();
    }

    @Test
    public void testClientRequiresToken() {
        NeptuneApiBase base = client.base();
        assertThrows(IllegalArgumentException.class, () -> new NeptuneApiClient(base, " ", null));
    }
}
