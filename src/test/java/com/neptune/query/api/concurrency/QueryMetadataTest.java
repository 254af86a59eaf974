package com.neptune.query.api.concurrency;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class QueryMetadataTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void testJsonHasAllFields() throws Exception {
        QueryMetadata metadata = new QueryMetadata("fetch_metrics", "nq-java/1.0", "abcd1234", "{\"team\":\"a\"}");

        JsonNode json = mapper.readTree(metadata.toJson());
        assertEquals("fetch_metrics", json.get("fn").asText());
        assertEquals("nq-java/1.0", json.get("v").asText());
        assertEquals("abcd1234", json.get("qid").asText());
        assertEquals("a", json.get("ud").get("team").asText());
    }

    @Test
    public void testMissingUserDataIsNull() throws Exception {
        QueryMetadata metadata = new QueryMetadata("fetch_metrics", "nq-java/1.0", "abcd1234", null);

        assertNull(metadata.getUserData());
        assertTrue(mapper.readTree(metadata.toJson()).get("ud").isNull());
    }

    @Test
    public void testFieldsAreTruncated() {
        String longName = "fetch_" + "x".repeat(100);
        QueryMetadata metadata = new QueryMetadata(longName, "v".repeat(50), "0123456789abcdef", null);

        assertEquals(QueryMetadata.MAX_API_FUNCTION_LENGTH, metadata.getApiFunction().length());
        assertEquals(QueryMetadata.MAX_CLIENT_VERSION_LENGTH, metadata.getClientVersion().length());
        assertEquals("01234567", metadata.getQueryId());
    }

    @Test
    public void testUserDataParsing() {
        assertTrue(QueryMetadata.processUserData("{\"k\":1}") instanceof Map);
        assertEquals("plain text", QueryMetadata.processUserData("plain text"));
        assertEquals(Integer.valueOf(42), QueryMetadata.processUserData("42"));
        assertNull(QueryMetadata.processUserData(""));
    }

    @Test
    public void testOversizedUserDataIsReplaced() {
        String big = "{\"k\":\"" + "y".repeat(200) + "\"}";
        assertEquals(QueryMetadata.USER_DATA_TOO_LONG, QueryMetadata.processUserData(big));
    }
}
