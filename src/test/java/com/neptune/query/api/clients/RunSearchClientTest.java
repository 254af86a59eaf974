package com.neptune.query.api.clients;

import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neptune.query.api.concurrency.QueryContext;
import com.neptune.query.api.config.QueryLimits;
import com.neptune.query.api.model.RunIdentifier;
import com.neptune.query.api.warnings.MutableClock;
import com.neptune.query.api.warnings.WarningRegistry;

public class RunSearchClientTest {

    private static final String SEARCH_URL = "http://localhost" + RunSearchClient.SEARCH_PATH;

    private MockRestServiceServer server;
    private RunSearchClient client;
    private QueryContext context;

    @BeforeEach
    public void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        RetryingCaller caller = new RetryingCaller(new BackoffPolicy(2, Duration.ofMillis(1), Duration.ofMillis(1)),
                new WarningRegistry(new MutableClock(Instant.EPOCH), Duration.ofSeconds(60)), new RecordingSleeper());
        QueryLimits limits = QueryLimits.builder().sysAttrsBatchSize(2).build();
        client = new RunSearchClient(new NeptuneApiBase("http://localhost", limits, builder, caller));
        context = QueryContext.start("fetch_metrics", "token", null);
    }

    static String entries(String... sysIds) {
        StringBuilder json = new StringBuilder("{\"entries\":[");
        for (int i = 0; i < sysIds.length; i++) {
            if (i > 0) {
                json.append(',');
            }
            json.append("{\"experimentId\":\"internal-").append(i)
                    .append("\",\"organizationName\":\"ws\",\"projectName\":\"proj\",\"attributes\":[")
                    .append("{\"name\":\"sys/name\",\"stringProperties\":{\"value\":\"ignored\"}},")
                    .append("{\"name\":\"sys/id\",\"stringProperties\":{\"value\":\"").append(sysIds[i])
                    .append("\"}}]}");
        }
        return json.append("]}").toString();
    }

    @Test
    public void testPagesThroughAllRuns() {
        server.expect(requestTo(SEARCH_URL))
                .andExpect(content().string(allOf(containsString("\"projectIdentifier\":\"ws/proj\""),
                        containsString("\"pagination\":{\"limit\":2,\"offset\":0}"),
                        containsString("\"query\":{\"query\":\"`sys/tags`:string CONTAINS \\\"x\\\"\"}"))))
                .andRespond(withSuccess(entries("RUN-1", "RUN-2"), MediaType.APPLICATION_JSON));
        server.expect(requestTo(SEARCH_URL))
                .andExpect(content().string(containsString("\"pagination\":{\"limit\":2,\"offset\":2}")))
                .andRespond(withSuccess(entries("RUN-3"), MediaType.APPLICATION_JSON));

        List<RunIdentifier> runs = client.listRuns("ws/proj", "`sys/tags`:string CONTAINS \"x\"", null, context);

        assertEquals(Arrays.asList(new RunIdentifier("ws/proj", "RUN-1"), new RunIdentifier("ws/proj", "RUN-2"),
                new RunIdentifier("ws/proj", "RUN-3")), runs);
        server.verify();
    }

    @Test
    public void testLimitStopsEarly() {
        server.expect(requestTo(SEARCH_URL))
                .andExpect(content().string(allOf(containsString("\"pagination\":{\"limit\":2,\"offset\":0}"),
                        not(containsString("\"query\"")))))
                .andRespond(withSuccess(entries("RUN-1", "RUN-2"), MediaType.APPLICATION_JSON));
        server.expect(requestTo(SEARCH_URL))
                .andExpect(content().string(containsString("\"pagination\":{\"limit\":1,\"offset\":2}")))
                .andRespond(withSuccess(entries("RUN-3"), MediaType.APPLICATION_JSON));

        List<RunIdentifier> runs = client.listRuns("ws/proj", null, 3, context);

        assertEquals(3, runs.size());
        server.verify();
    }

    @Test
    public void testUnauthorizedIsFatal() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("invalid token"));

        AuthorizationException e = assertThrows(AuthorizationException.class,
                () -> client.listRuns("ws/proj", null, null, context));
        assertEquals(401, e.getStatusCode());
        server.verify();
    }

    @Test
    public void testMissingProjectGivesNoRuns() {
        server.expect(requestTo(SEARCH_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertTrue(client.listRuns("ws/missing", null, null, context).isEmpty());
        server.verify();
    }

    @Test
    public void testEntriesWithoutProjectUseRequestedProject() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        List<RunIdentifier> runs = RunSearchClient.toRunIdentifiers(mapper.readTree(
                "{\"entries\":[{\"experimentId\":\"RUN-9\"}]}"), "ws/proj");

        assertEquals(Arrays.asList(new RunIdentifier("ws/proj", "RUN-9")), runs);
    }

    @Test
    public void testEntryWithoutIdIsAnError() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertThrows(NeptuneApiException.class, () -> RunSearchClient.toRunIdentifiers(
                mapper.readTree("{\"entries\":[{\"attributes\":[]}]}"), "ws/proj"));
    }

    @Test
    public void testSearchBodyWithoutQuery() {
        Map<String, Object> body = RunSearchClient.searchBody("ws/proj", "  ", 10, 5);
        assertFalse(body.containsKey("query"));
        assertEquals(Boolean.FALSE, body.get("experimentLeader"));
    }
}
