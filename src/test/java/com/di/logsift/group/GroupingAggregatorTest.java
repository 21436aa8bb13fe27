package com.di.logsift.group;

import com.di.logsift.LogSiftFixtures;
import com.di.logsift.checkpoint.CheckpointTracker;
import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.frame.GeneratedFrameLocator;
import com.di.logsift.ingest.IngestionResult;
import com.di.logsift.ingest.IngestionService;
import com.di.logsift.store.FaultyDocumentStore;
import com.di.logsift.store.ScanHit;
import com.di.logsift.store.Slice;
import com.di.logsift.store.StoreException;
import com.di.logsift.store.StoreInterruptedException;
import com.di.logsift.store.StoreQuery;
import com.di.logsift.util.ContentHash;
import com.di.logsift.util.MetricsCollector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GroupingAggregator Tests")
class GroupingAggregatorTest {

    @TempDir
    Path tempDir;

    private FaultyDocumentStore store;
    private LogSiftProperties properties;
    private ObjectMapper objectMapper;
    private MetricsCollector metrics;
    private CheckpointTracker checkpointTracker;
    private CustomRuleRepository customRules;
    private IngestionService ingestion;
    private GroupingAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = new FaultyDocumentStore();
        properties = LogSiftFixtures.properties(tempDir);
        objectMapper = new ObjectMapper();
        metrics = LogSiftFixtures.metrics();
        checkpointTracker = new CheckpointTracker(store, properties);
        customRules = new CustomRuleRepository(store, properties, objectMapper);
        ingestion = new IngestionService(store, properties, metrics, objectMapper);
        aggregator = new GroupingAggregator(store, properties, checkpointTracker, customRules, metrics, objectMapper);
    }

    private static List<String> lockContentionLines() {
        return List.of(
                LogSiftFixtures.errorLine("CO-19577", "2025-04-18T14:23:09Z"),
                LogSiftFixtures.errorLine("CO-20011", "2025-04-18T15:02:41Z"),
                LogSiftFixtures.infoLine("Nightly export finished", "2025-04-18T15:10:00Z"));
    }

    private static String lockContentionSignature() {
        return GeneratedFrameLocator.summarize(GeneratedFrameLocator.locate(LogSiftFixtures.stackTrace("CO-19577")));
    }

    private List<Map<String, Object>> groups() {
        return store.search(properties.getIndices().getGroups(), StoreQuery.matchAll(), 10_000).stream()
                .map(ScanHit::source)
                .toList();
    }

    private Map<String, Object> group(String signature) {
        return store.get(properties.getIndices().getGroups(), ContentHash.md5Hex(signature)).orElseThrow();
    }

    private static long count(Map<String, Object> group) {
        return ((Number) group.get("count")).longValue();
    }

    private void putRaw(String id, Map<String, Object> document) {
        store.put(properties.getIndices().getRawLogs(), id, document);
    }

    private static Map<String, Object> rawDocument(String summary, String exceptionSignature, String timestamp) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("level", "ERROR");
        document.put("sequence_summary", summary);
        document.put("normalized_exception_message", exceptionSignature);
        document.put("logger_name", "com.pega.Engine");
        document.put("ingestion_timestamp", timestamp);
        return document;
    }

    // ============================================================================
    // End to end
    // ============================================================================

    @Test
    @DisplayName("Should group two traces that differ only by case id into one rule sequence group")
    void testAggregate_SameTraceDifferentCaseIds() {
        ingestion.ingest("app.log", lockContentionLines().iterator());

        AggregationResult result = aggregator.aggregate(AggregationRequest.defaults());

        assertEquals(2, result.getProcessed());
        assertEquals(2, result.getNewlyCounted());
        assertEquals(0, result.getFailed());
        List<Map<String, Object>> groups = groups();
        assertEquals(1, groups.size());

        Map<String, Object> group = group(lockContentionSignature());
        assertEquals("RuleSequence", group.get("group_type"));
        assertEquals(2L, count(group));
        assertEquals(2, ((List<?>) group.get("raw_log_ids")).size());
        assertEquals(List.of("Lock held on [CASE_ID]"), group.get("exception_signatures"));
        assertEquals("2025-04-18T14:23:09.000Z", group.get("first_seen"));
        assertEquals("2025-04-18T15:02:41.000Z", group.get("last_seen"));
        assertEquals(2, group.get("rule_count"));
        assertEquals(Map.of("status", "PENDING"), group.get("diagnosis"));
        @SuppressWarnings("unchecked")
        Map<String, Object> representative = (Map<String, Object>) group.get("representative_log");
        assertEquals("2025-04-18T15:02:41.000Z", representative.get("timestamp"));
    }

    @Test
    @DisplayName("Should advance the checkpoint and process nothing on the next run")
    void testAggregate_CheckpointAdvances() {
        ingestion.ingest("app.log", lockContentionLines().iterator());

        AggregationResult first = aggregator.aggregate(AggregationRequest.defaults());
        AggregationResult second = aggregator.aggregate(AggregationRequest.defaults());

        assertTrue(first.isCheckpointUpdated());
        assertEquals("2025-04-18T15:02:41.000Z", first.getCheckpointAfter());
        assertEquals("2025-04-18T15:02:41.000Z",
                checkpointTracker.getLastCheckpoint().orElseThrow().lastProcessedTimestamp());
        assertEquals(0, second.getProcessed());
        assertFalse(second.isCheckpointUpdated());
        assertEquals(2L, count(group(lockContentionSignature())));
    }

    @Test
    @DisplayName("Should not double count when the same input is ingested and grouped again")
    void testAggregate_IdempotentRerun() {
        ingestion.ingest("app.log", lockContentionLines().iterator());
        aggregator.aggregate(AggregationRequest.defaults());

        ingestion.ingest("app.log", lockContentionLines().iterator());
        AggregationResult rerun = aggregator.aggregate(AggregationRequest.builder().ignoreCheckpoint(true).build());

        assertEquals(2, rerun.getProcessed());
        assertEquals(0, rerun.getNewlyCounted());
        assertEquals(2L, count(group(lockContentionSignature())));
    }

    @Test
    @DisplayName("Should keep sample ids and signatures bounded for a large group")
    void testAggregate_BoundedGroupFields() {
        String summary = lockContentionSignature();
        for (int i = 0; i < 10_000; i++) {
            putRaw("raw-" + i, rawDocument(summary, "Failure kind " + (i % 25), "2025-04-18T12:00:00.000Z"));
        }

        AggregationResult result = aggregator.aggregate(AggregationRequest.defaults());

        assertEquals(10_000, result.getProcessed());
        Map<String, Object> group = group(summary);
        assertEquals(10_000L, count(group));
        assertEquals(50, ((List<?>) group.get("raw_log_ids")).size());
        assertEquals(10, ((List<?>) group.get("exception_signatures")).size());
        assertEquals(10_000, store.count(properties.getIndices().getGroupMembers()));
    }

    @Test
    @DisplayName("Should flush several batches into the same group")
    void testAggregate_SmallBatches() {
        for (int i = 0; i < 7; i++) {
            Map<String, Object> document = rawDocument("", "", "2025-04-18T12:00:0" + i + ".000Z");
            document.put("message", "Queue " + (1_000_000 + i) + " is full");
            document.put("normalized_message", "Queue [NUM] is full");
            putRaw("raw-" + i, document);
        }

        AggregationResult result = aggregator.aggregate(AggregationRequest.builder().batchSize(2).build());

        assertEquals(7, result.getProcessed());
        assertEquals(7, result.getNewlyCounted());
        Map<String, Object> group = group("Queue [NUM] is full");
        assertEquals("Message", group.get("group_type"));
        assertEquals(7L, count(group));
        assertEquals("2025-04-18T12:00:00.000Z", group.get("first_seen"));
        assertEquals("2025-04-18T12:00:06.000Z", group.get("last_seen"));
    }

    // ============================================================================
    // Request options
    // ============================================================================

    @Test
    @DisplayName("Should stop after the limit and checkpoint only what was seen")
    void testAggregate_Limit() {
        for (int i = 0; i < 5; i++) {
            putRaw("raw-" + i, rawDocument("", "Failure " + i, "2025-04-18T12:00:0" + i + ".000Z"));
        }

        AggregationResult result = aggregator.aggregate(AggregationRequest.builder().limit(3).build());

        assertEquals(3, result.getProcessed());
        assertEquals(3, groups().size());
    }

    @Test
    @DisplayName("Should only group records of the requested session")
    void testAggregate_SessionFilter() {
        IngestionResult first = ingestion.ingest("first.log", List.of(
                LogSiftFixtures.messageLine("Queue 1234567 is full", "2025-04-18T10:00:00Z")).iterator());
        ingestion.ingest("second.log", lockContentionLines().iterator());

        AggregationResult result = aggregator.aggregate(AggregationRequest.builder()
                .sessionId(first.getSessionId()).build());

        assertEquals(1, result.getProcessed());
        assertEquals(1, groups().size());
        assertEquals("Exception", groups().get(0).get("group_type"));
    }

    @Test
    @DisplayName("Should leave the checkpoint alone for a slice and cover everything across slices")
    void testAggregate_SlicedDoesNotCheckpoint() {
        for (int i = 0; i < 20; i++) {
            putRaw("raw-" + i, rawDocument("", "Failure kind " + (i % 4), "2025-04-18T12:00:00.000Z"));
        }

        AggregationResult slice0 = aggregator.aggregate(AggregationRequest.builder().slice(new Slice(0, 2)).build());
        AggregationResult slice1 = aggregator.aggregate(AggregationRequest.builder().slice(new Slice(1, 2)).build());

        assertEquals(20, slice0.getProcessed() + slice1.getProcessed());
        assertFalse(slice0.isCheckpointUpdated());
        assertFalse(slice1.isCheckpointUpdated());
        assertTrue(checkpointTracker.getLastCheckpoint().isEmpty());
        long total = groups().stream().mapToLong(GroupingAggregatorTest::count).sum();
        assertEquals(20, total);
    }

    @Test
    @DisplayName("Should classify with stored custom rules before anything else")
    void testAggregate_CustomRule() {
        customRules.saveRule("lock-contention", "could not be locked", null);
        ingestion.ingest("app.log", lockContentionLines().iterator());

        AggregationResult result = aggregator.aggregate(AggregationRequest.defaults());

        assertEquals(1, result.getCustomRules());
        Map<String, Object> group = group("lock-contention");
        assertEquals("Custom: lock-contention", group.get("group_type"));
        assertEquals(2L, count(group));
    }

    @Test
    @DisplayName("Should count records again in the group a new custom rule moves them to")
    void testAggregate_ReclassifiedIntoCustomGroup() {
        ingestion.ingest("app.log", lockContentionLines().iterator());
        aggregator.aggregate(AggregationRequest.defaults());

        customRules.saveRule("LockRule", "could not be locked", "Custom");
        AggregationResult regrouped = aggregator.aggregate(AggregationRequest.builder().ignoreCheckpoint(true).build());

        assertEquals(2, regrouped.getProcessed());
        assertEquals(2, regrouped.getNewlyCounted());
        assertEquals(2L, count(group("LockRule")));
        assertEquals(2L, count(group(lockContentionSignature())));
        assertEquals(4, store.count(properties.getIndices().getGroupMembers()));
    }

    @Test
    @DisplayName("Should return an empty result when there is no raw-log index")
    void testAggregate_NoRawIndex() {
        AggregationResult result = aggregator.aggregate(AggregationRequest.defaults());

        assertEquals(0, result.getProcessed());
        assertNull(result.getCheckpointAfter());
    }

    @Test
    @DisplayName("Should reject a non-positive batch size")
    void testAggregate_InvalidBatchSize() {
        assertThrows(IllegalArgumentException.class,
                () -> aggregator.aggregate(AggregationRequest.builder().batchSize(0).build()));
    }

    // ============================================================================
    // Failures
    // ============================================================================

    @Test
    @DisplayName("Should capture failed group merges and replay them later")
    void testAggregate_FailedGroupCapturedAndReplayed() throws IOException {
        ingestion.ingest("app.log", lockContentionLines().iterator());
        String groupId = ContentHash.md5Hex(lockContentionSignature());
        store.failItem(groupId, 400, 1);

        AggregationResult result = aggregator.aggregate(AggregationRequest.defaults());

        assertEquals(1, result.getFailed());
        Path failedGroups = Path.of(properties.getGrouping().getFailedGroupsFile());
        assertEquals(1, Files.readAllLines(failedGroups).size());
        assertTrue(store.get(properties.getIndices().getGroups(), groupId).isEmpty());

        FailedGroupReplayService replay = new FailedGroupReplayService(store, properties, metrics, objectMapper);
        FailedGroupReplayService.ReplayResult replayed = replay.replay(failedGroups, true);

        assertEquals(1, replayed.replayed());
        assertEquals(0, replayed.failedAgain());
        assertFalse(Files.exists(failedGroups));
        assertEquals(2L, count(group(lockContentionSignature())));
    }

    @Test
    @DisplayName("Should retry a rate-limited scroll and finish the run")
    void testAggregate_ScrollRateLimited() {
        ingestion.ingest("app.log", lockContentionLines().iterator());
        store.failNextScroll(new StoreException("rejected execution", 429));

        AggregationResult result = aggregator.aggregate(AggregationRequest.defaults());

        assertEquals(2, result.getProcessed());
        assertEquals(2L, count(group(lockContentionSignature())));
    }

    @Test
    @DisplayName("Should retry a transient bulk failure during the flush")
    void testAggregate_TransientBulkFailure() {
        ingestion.ingest("app.log", lockContentionLines().iterator());
        store.failNextBulk(new StoreException("service unavailable", 503));

        AggregationResult result = aggregator.aggregate(AggregationRequest.defaults());

        assertEquals(0, result.getFailed());
        assertEquals(2L, count(group(lockContentionSignature())));
    }

    @Test
    @DisplayName("Should stop on an interrupt between claim and merge and count the claims on the next run")
    void testAggregate_InterruptedFlushRecovers() {
        ingestion.ingest("app.log", lockContentionLines().iterator());
        store.interruptOnBulk(properties.getIndices().getGroups());

        try {
            assertThrows(StoreInterruptedException.class, () -> aggregator.aggregate(AggregationRequest.defaults()));
        } finally {
            assertTrue(Thread.interrupted());
        }
        assertTrue(groups().isEmpty());
        assertTrue(checkpointTracker.getLastCheckpoint().isEmpty());
        assertEquals(List.of(GroupFlusher.PENDING, GroupFlusher.PENDING), membershipStates());

        AggregationResult rerun = aggregator.aggregate(AggregationRequest.defaults());

        assertEquals(2, rerun.getNewlyCounted());
        assertEquals(2L, count(group(lockContentionSignature())));
        assertEquals(List.of(GroupFlusher.COUNTED, GroupFlusher.COUNTED), membershipStates());

        AggregationResult again = aggregator.aggregate(AggregationRequest.builder().ignoreCheckpoint(true).build());

        assertEquals(0, again.getNewlyCounted());
        assertEquals(2L, count(group(lockContentionSignature())));
    }

    private List<Object> membershipStates() {
        return store.search(properties.getIndices().getGroupMembers(), StoreQuery.matchAll(), 100).stream()
                .map(hit -> hit.source().get("state"))
                .toList();
    }

    @Test
    @DisplayName("Should build the scan query from the checkpoint and the session")
    void testBuildQuery() {
        StoreQuery query = aggregator.buildQuery("2025-04-18T12:00:00.000Z", "session-1");

        Map<String, Object> matching = new LinkedHashMap<>();
        matching.put("level", "ERROR");
        matching.put("ingestion_timestamp", "2025-04-18T12:00:01.000Z");
        matching.put("session_id", "session-1");
        assertTrue(query.matches(matching));

        matching.put("ingestion_timestamp", "2025-04-18T12:00:00.000Z");
        assertFalse(query.matches(matching));

        matching.put("ingestion_timestamp", "2025-04-18T12:00:01.000Z");
        matching.put("level", "INFO");
        assertFalse(query.matches(matching));
    }
}
