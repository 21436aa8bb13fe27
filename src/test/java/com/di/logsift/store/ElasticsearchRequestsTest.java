package com.di.logsift.store;

import com.di.logsift.group.GroupMergeScript;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ElasticsearchRequests Tests")
class ElasticsearchRequestsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    // ============================================================================
    // Queries
    // ============================================================================

    @Test
    @DisplayName("Should translate the grouping scan query into a bool filter")
    void testQuery_GroupingScan() throws Exception {
        StoreQuery query = StoreQuery.and(List.of(
                StoreQuery.terms("level", List.of("ERROR")),
                StoreQuery.greaterThan("ingestion_timestamp", "2025-04-18T12:00:00.000Z")));

        JsonNode json = mapper.valueToTree(ElasticsearchRequests.query(query));

        JsonNode filter = json.path("bool").path("filter");
        assertEquals(2, filter.size());
        assertEquals("ERROR", filter.get(0).path("terms").path("level").get(0).asText());
        assertEquals("2025-04-18T12:00:00.000Z", filter.get(1).path("range").path("ingestion_timestamp").path("gt").asText());
    }

    @Test
    @DisplayName("Should translate or, not and exists")
    void testQuery_Combinators() {
        JsonNode json = mapper.valueToTree(ElasticsearchRequests.query(StoreQuery.or(
                StoreQuery.not(StoreQuery.term("diagnosis.status", "PENDING")),
                StoreQuery.exists("comments"))));

        JsonNode should = json.path("bool").path("should");
        assertEquals(1, json.path("bool").path("minimum_should_match").asInt());
        assertEquals("PENDING", should.get(0).path("bool").path("must_not").get(0).path("term").path("diagnosis.status").asText());
        assertEquals("comments", should.get(1).path("exists").path("field").asText());
        assertEquals(Map.of("match_all", Map.of()), ElasticsearchRequests.query(StoreQuery.matchAll()));
    }

    @Test
    @DisplayName("Should build a sliced scan body sorted by _doc")
    void testScanBody() {
        ScanRequest request = ScanRequest.builder()
                .index("raw-logs")
                .sourceField("message")
                .pageSize(250)
                .slice(new Slice(1, 4))
                .build();

        Map<String, Object> body = ElasticsearchRequests.scanBody(request);

        assertEquals(250, body.get("size"));
        assertEquals(List.of("_doc"), body.get("sort"));
        assertEquals(List.of("message"), body.get("_source"));
        assertEquals(Map.of("id", 1, "max", 4), body.get("slice"));
        assertEquals("1800s", ElasticsearchRequests.keepAlive(Duration.ofMinutes(30)));
    }

    // ============================================================================
    // Bulk
    // ============================================================================

    @Test
    @DisplayName("Should write action and source lines, each terminated by a newline")
    void testBulkBody() throws Exception {
        String body = ElasticsearchRequests.bulkBody(List.of(
                BulkOperation.create("members", "r1", Map.of("group_id", "g1")),
                BulkOperation.scriptedUpsert("groups", "g1", GroupMergeScript.INSTANCE, Map.of("inc", 1),
                        Map.of("count", 1), 5)), mapper);

        assertTrue(body.endsWith("\n"));
        String[] lines = body.split("\n");
        assertEquals(4, lines.length);
        assertEquals("r1", mapper.readTree(lines[0]).path("create").path("_id").asText());
        JsonNode update = mapper.readTree(lines[2]).path("update");
        assertEquals(5, update.path("retry_on_conflict").asInt());
        JsonNode script = mapper.readTree(lines[3]);
        assertEquals("painless", script.path("script").path("lang").asText());
        assertEquals(1, script.path("script").path("params").path("inc").asInt());
        assertEquals(1, script.path("upsert").path("count").asInt());
        assertTrue(script.path("script").path("source").asText().contains("params.inc"));
    }

    @Test
    @DisplayName("Should parse per-item bulk results in request order")
    void testParseBulkResponse() throws Exception {
        JsonNode response = mapper.readTree("""
                {"errors": true, "items": [
                  {"create": {"_index": "members", "_id": "r1", "status": 201}},
                  {"create": {"_index": "members", "_id": "r2", "status": 409,
                              "error": {"type": "version_conflict_engine_exception", "reason": "document already exists"}}},
                  {"update": {"_index": "groups", "_id": "g1", "status": 429,
                              "error": {"type": "es_rejected_execution_exception", "reason": "queue full"}}}
                ]}
                """);

        List<BulkItemResult> results = ElasticsearchRequests.parseBulkResponse(response);

        assertEquals(3, results.size());
        assertTrue(results.get(0).isSuccess());
        assertTrue(results.get(1).isConflict());
        assertEquals("version_conflict_engine_exception", results.get(1).errorType());
        assertTrue(results.get(2).isTransientFailure());
        assertEquals("g1", results.get(2).id());
    }

    // ============================================================================
    // Responses
    // ============================================================================

    @Test
    @DisplayName("Should parse a scroll page")
    void testParseScrollPage() throws Exception {
        JsonNode response = mapper.readTree("""
                {"_scroll_id": "abc", "hits": {"hits": [
                  {"_id": "r1", "_source": {"level": "ERROR"}},
                  {"_id": "r2"}
                ]}}
                """);

        ScrollPage page = ElasticsearchRequests.parseScrollPage(response, mapper);

        assertEquals("abc", page.scrollId());
        assertEquals(2, page.hits().size());
        assertEquals(Map.of("level", "ERROR"), page.hits().get(0).source());
        assertTrue(page.hits().get(1).source().isEmpty());
    }

    @Test
    @DisplayName("Should keep only found documents of a multi-get")
    void testParseMultiGet() throws Exception {
        JsonNode response = mapper.readTree("""
                {"docs": [
                  {"_id": "r1", "found": true, "_source": {"app": "claims-portal"}},
                  {"_id": "r2", "found": false}
                ]}
                """);

        assertEquals(Map.of("r1", Map.of("app", "claims-portal")), ElasticsearchRequests.parseMultiGet(response, mapper));
    }

    @Test
    @DisplayName("Should read index tuning and fall back to defaults")
    void testParseTuning() throws Exception {
        JsonNode response = mapper.readTree("""
                {"raw-logs": {"settings": {"index": {"refresh_interval": "-1", "number_of_replicas": "0"}}}}
                """);

        IndexTuning tuning = ElasticsearchRequests.parseTuning(response, "raw-logs");

        assertEquals(new IndexTuning("-1", "0", IndexTuning.DEFAULTS.translogDurability()), tuning);
        assertEquals(IndexTuning.DEFAULTS, ElasticsearchRequests.parseTuning(mapper.readTree("{}"), "raw-logs"));
    }

    @Test
    @DisplayName("Should write tuning under the index settings key")
    void testTuningBody() {
        Map<String, Object> body = ElasticsearchRequests.tuningBody(IndexTuning.BULK_LOAD);

        @SuppressWarnings("unchecked")
        Map<String, Object> index = (Map<String, Object>) body.get("index");
        assertEquals("-1", index.get("refresh_interval"));
        assertEquals("async", index.get("translog.durability"));
    }
}
