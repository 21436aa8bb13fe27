package com.di.logsift.store;

import com.di.logsift.group.GroupMergeScript;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryDocumentStore Tests")
class InMemoryDocumentStoreTest {

    private static final String INDEX = "docs";

    private final InMemoryDocumentStore store = new InMemoryDocumentStore();

    @Test
    @DisplayName("Should report created, updated and conflicting writes like the remote store")
    void testBulkStatuses() {
        List<BulkItemResult> results = store.bulk(List.of(
                BulkOperation.index(INDEX, "a", Map.of("v", 1)),
                BulkOperation.index(INDEX, "a", Map.of("v", 2)),
                BulkOperation.create(INDEX, "b", Map.of("v", 1)),
                BulkOperation.create(INDEX, "b", Map.of("v", 2)),
                BulkOperation.updateDoc(INDEX, "missing", Map.of("v", 3))));

        assertEquals(List.of(201, 200, 201, 409, 404), results.stream().map(BulkItemResult::status).toList());
        assertTrue(results.get(3).isConflict());
        assertEquals(Map.of("v", 2), store.get(INDEX, "a").orElseThrow());
        assertEquals(Map.of("v", 1), store.get(INDEX, "b").orElseThrow());
    }

    @Test
    @DisplayName("Should insert the upsert document first and run the merge afterwards")
    void testScriptedUpsert() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("inc", 1);
        params.put("new_ids", List.of("r2"));
        params.put("new_exc_sigs", List.of());
        params.put("new_msg_sigs", List.of());
        params.put("max_ids", 50);
        params.put("max_sigs", 10);
        Map<String, Object> upsert = new LinkedHashMap<>();
        upsert.put("count", 1);
        upsert.put("raw_log_ids", new ArrayList<>(List.of("r1")));

        store.bulk(List.of(BulkOperation.scriptedUpsert(INDEX, "g", GroupMergeScript.INSTANCE, params, upsert, 3)));
        store.bulk(List.of(BulkOperation.scriptedUpsert(INDEX, "g", GroupMergeScript.INSTANCE, params, upsert, 3)));

        Map<String, Object> group = store.get(INDEX, "g").orElseThrow();
        assertEquals(2L, group.get("count"));
        assertEquals(List.of("r1", "r2"), group.get("raw_log_ids"));
    }

    @Test
    @DisplayName("Should merge partial updates into nested objects")
    void testUpdateDocMerges() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("diagnosis", new LinkedHashMap<>(Map.of("status", "PENDING", "owner", "ops")));
        store.put(INDEX, "g", document);

        store.bulk(List.of(BulkOperation.updateDoc(INDEX, "g", Map.of("diagnosis", Map.of("status", "RESOLVED")))));

        assertEquals(Map.of("status", "RESOLVED", "owner", "ops"), store.get(INDEX, "g").orElseThrow().get("diagnosis"));
    }

    @Test
    @DisplayName("Should hand out copies so callers cannot change stored documents")
    void testGetReturnsCopy() {
        store.put(INDEX, "a", Map.of("tags", List.of("x")));

        store.get(INDEX, "a").orElseThrow().put("extra", true);

        assertFalse(store.get(INDEX, "a").orElseThrow().containsKey("extra"));
    }

    @Test
    @DisplayName("Should fail to create an existing index and ignore deleting a missing one")
    void testIndexLifecycle() {
        store.createIndex(INDEX, Map.of());

        StoreException e = assertThrows(StoreException.class, () -> store.createIndex(INDEX, Map.of()));
        assertEquals(400, e.getStatus());
        assertTrue(IndexDefinitions.ensureIndex(store, "other", Map.of()));
        assertFalse(IndexDefinitions.ensureIndex(store, INDEX, Map.of()));

        store.deleteIndex(INDEX);
        store.deleteIndex(INDEX);
        assertFalse(store.indexExists(INDEX));
    }

    @Test
    @DisplayName("Should partition a scan into disjoint slices that cover every document")
    void testSlicesPartition() {
        for (int i = 0; i < 30; i++) {
            store.put(INDEX, "doc-" + i, Map.of("n", i));
        }

        List<String> seen = new ArrayList<>();
        for (int slice = 0; slice < 3; slice++) {
            ScanRequest request = ScanRequest.builder().index(INDEX).pageSize(100).slice(new Slice(slice, 3)).build();
            store.openScroll(request).hits().forEach(hit -> seen.add(hit.id()));
        }

        assertEquals(30, seen.size());
        assertEquals(30, seen.stream().distinct().count());
    }

    @Test
    @DisplayName("Should fail a scan of a missing index and an unknown scroll id")
    void testScanErrors() {
        assertEquals(404, assertThrows(StoreException.class,
                () -> store.openScroll(ScanRequest.builder().index("missing").build())).getStatus());
        assertEquals(404, assertThrows(StoreException.class,
                () -> store.continueScroll("nope", null)).getStatus());
    }

    @Test
    @DisplayName("Should project multi-get results to the requested fields")
    void testMultiGet() {
        store.put(INDEX, "a", Map.of("app", "claims-portal", "level", "ERROR"));

        Map<String, Map<String, Object>> found = store.multiGet(INDEX, List.of("a", "b"), List.of("app"));

        assertEquals(Map.of("a", Map.of("app", "claims-portal")), found);
    }
}
