package com.di.logsift.group;

import com.di.logsift.LogSiftFixtures;
import com.di.logsift.checkpoint.CheckpointTracker;
import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.ingest.IngestionService;
import com.di.logsift.store.InMemoryDocumentStore;
import com.di.logsift.store.Slice;
import com.di.logsift.store.StoreQuery;
import com.di.logsift.util.MetricsCollector;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RegroupService Tests")
class RegroupServiceTest {

    @TempDir
    Path tempDir;

    private InMemoryDocumentStore store;
    private LogSiftProperties properties;
    private IngestionService ingestion;
    private GroupingAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        properties = LogSiftFixtures.properties(tempDir);
        ObjectMapper objectMapper = new ObjectMapper();
        MetricsCollector metrics = LogSiftFixtures.metrics();
        ingestion = new IngestionService(store, properties, metrics, objectMapper);
        aggregator = new GroupingAggregator(store, properties, new CheckpointTracker(store, properties),
                new CustomRuleRepository(store, properties, objectMapper), metrics, objectMapper);

        ingestion.ingest("app.log", List.of(
                LogSiftFixtures.errorLine("CO-19577", "2025-04-18T14:23:09Z"),
                LogSiftFixtures.errorLine("CO-20011", "2025-04-18T15:02:41Z"),
                LogSiftFixtures.messageLine("Queue 1234567 is full", "2025-04-18T15:05:00Z")).iterator());
        aggregator.aggregate(AggregationRequest.defaults());
    }

    private String groupsIndex() {
        return properties.getIndices().getGroups();
    }

    private List<Map<String, Object>> groups() {
        List<Map<String, Object>> groups = new ArrayList<>();
        store.search(groupsIndex(), StoreQuery.matchAll(), 100).forEach(hit -> groups.add(hit.source()));
        return groups;
    }

    private String groupIdOfType(String type) {
        return store.search(groupsIndex(), StoreQuery.term("group_type", type), 1).get(0).id();
    }

    /** Marks a group the way an operator would from the review UI. */
    private void diagnose(String groupId) {
        Map<String, Object> group = store.get(groupsIndex(), groupId).orElseThrow();
        Map<String, Object> diagnosis = new LinkedHashMap<>();
        diagnosis.put("status", DiagnosisStatus.RESOLVED.name());
        diagnosis.put("root_cause", "stale lock after node restart");
        group.put("diagnosis", diagnosis);
        group.put("comments", "fixed by restarting the agent");
        store.put(groupsIndex(), groupId, group);
    }

    @Test
    @DisplayName("Should rebuild groups with their counts and keep diagnosed state")
    void testRegroup_RestoresUserState() {
        String ruleGroup = groupIdOfType("RuleSequence");
        diagnose(ruleGroup);
        RegroupService service = new RegroupService(store, properties, aggregator, new SliceWorkerLauncher());

        RegroupService.RegroupResult result = service.regroup(AggregationRequest.defaults());

        assertEquals(1, result.backedUp());
        assertEquals(1, result.restored());
        assertEquals(3, result.aggregation().getProcessed());
        assertTrue(result.workersSucceeded());
        assertEquals(2, groups().size());

        Map<String, Object> rebuilt = store.get(groupsIndex(), ruleGroup).orElseThrow();
        assertEquals(2L, ((Number) rebuilt.get("count")).longValue());
        assertEquals("fixed by restarting the agent", rebuilt.get("comments"));
        @SuppressWarnings("unchecked")
        Map<String, Object> diagnosis = (Map<String, Object>) rebuilt.get("diagnosis");
        assertEquals("RESOLVED", diagnosis.get("status"));
        assertEquals("stale lock after node restart", diagnosis.get("root_cause"));
    }

    @Test
    @DisplayName("Should leave pending groups pending after a rebuild")
    void testRegroup_PendingGroupsNotBackedUp() {
        RegroupService service = new RegroupService(store, properties, aggregator, new SliceWorkerLauncher());

        RegroupService.RegroupResult result = service.regroup(AggregationRequest.defaults());

        assertEquals(0, result.backedUp());
        assertEquals(0, result.restored());
        for (Map<String, Object> group : groups()) {
            assertEquals(Map.of("status", "PENDING"), group.get("diagnosis"));
        }
    }

    @Test
    @DisplayName("Should reject a sliced in-process rebuild")
    void testRegroup_RejectsSlice() {
        RegroupService service = new RegroupService(store, properties, aggregator, new SliceWorkerLauncher());

        assertThrows(IllegalArgumentException.class,
                () -> service.regroup(AggregationRequest.builder().slice(new Slice(0, 2)).build()));
    }

    @Test
    @DisplayName("Should rebuild through slice workers and restore state afterwards")
    void testRegroupSliced() throws Exception {
        String ruleGroup = groupIdOfType("RuleSequence");
        diagnose(ruleGroup);
        List<AggregationRequest> launched = new ArrayList<>();
        SliceWorkerLauncher inProcess = new SliceWorkerLauncher() {
            @Override
            public List<Integer> launch(int workers, AggregationRequest request) {
                launched.add(request);
                List<Integer> exitCodes = new ArrayList<>();
                for (int slice = 0; slice < workers; slice++) {
                    aggregator.aggregate(request.toBuilder().slice(new Slice(slice, workers)).build());
                    exitCodes.add(0);
                }
                return exitCodes;
            }
        };
        RegroupService service = new RegroupService(store, properties, aggregator, inProcess);

        RegroupService.RegroupResult result = service.regroupSliced(AggregationRequest.defaults(), 3);

        assertEquals(List.of(0, 0, 0), result.workerExitCodes());
        assertNull(result.aggregation());
        assertTrue(result.workersSucceeded());
        assertTrue(launched.get(0).isIgnoreCheckpoint());
        assertFalse(launched.get(0).isSliced());
        assertEquals(1, result.restored());
        Map<String, Object> rebuilt = store.get(groupsIndex(), ruleGroup).orElseThrow();
        assertEquals(2L, ((Number) rebuilt.get("count")).longValue());
        assertEquals("fixed by restarting the agent", rebuilt.get("comments"));
    }

    @Test
    @DisplayName("Should report a failed worker")
    void testRegroupSliced_WorkerFailed() throws Exception {
        SliceWorkerLauncher failing = new SliceWorkerLauncher() {
            @Override
            public List<Integer> launch(int workers, AggregationRequest request) {
                return List.of(0, 1);
            }
        };
        RegroupService service = new RegroupService(store, properties, aggregator, failing);

        RegroupService.RegroupResult result = service.regroupSliced(AggregationRequest.defaults(), 2);

        assertFalse(result.workersSucceeded());
        assertEquals(0, result.restored());
    }
}
