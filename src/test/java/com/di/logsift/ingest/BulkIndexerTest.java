package com.di.logsift.ingest;

import com.di.logsift.LogSiftFixtures;
import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.store.FaultyDocumentStore;
import com.di.logsift.store.StoreException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BulkIndexer Tests")
class BulkIndexerTest {

    private static final String INDEX = "raw-error-logs";

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FaultyDocumentStore store;
    private LogSiftProperties.Ingest settings;
    private Path deadLetterFile;

    @BeforeEach
    void setUp() {
        store = new FaultyDocumentStore();
        settings = LogSiftFixtures.properties(tempDir).getIngest();
        settings.setChunkSize(2);
        settings.setThreadCount(2);
        settings.setQueueSize(1);
        settings.setMaxRetries(2);
        deadLetterFile = tempDir.resolve("dead.jsonl");
    }

    private BulkStats load(int documents) {
        try (BulkIndexer indexer = new BulkIndexer(store, settings, new DeadLetterWriter(deadLetterFile, objectMapper),
                LogSiftFixtures.metrics(), objectMapper)) {
            for (int i = 0; i < documents; i++) {
                indexer.add(document("doc-" + i));
            }
            return indexer.finish();
        }
    }

    private static RawDocument document(String id) {
        return new RawDocument(INDEX, id, Map.of("message", "message of " + id, "level", "ERROR"));
    }

    private List<String> deadLetterLines() throws IOException {
        return Files.exists(deadLetterFile) ? Files.readAllLines(deadLetterFile) : List.of();
    }

    // ============================================================================
    // Chunking
    // ============================================================================

    @Test
    @DisplayName("Should write every document in chunks of the configured size")
    void testFinish_WritesAllChunks() {
        BulkStats stats = load(5);

        assertEquals(new BulkStats(5, 0, 0, 0), stats);
        assertEquals(5, store.count(INDEX));
        assertEquals(3, store.bulkRequests());
    }

    @Test
    @DisplayName("Should cut chunks by serialized size")
    void testAdd_ChunksByBytes() {
        settings.setChunkSize(100);
        settings.setMaxChunkBytes(DataSize.ofBytes(1));

        BulkStats stats = load(3);

        assertEquals(3, stats.indexed());
        assertEquals(3, store.bulkRequests());
    }

    // ============================================================================
    // Item failures
    // ============================================================================

    @Test
    @DisplayName("Should count a 409 as duplicate, not failure")
    void testSend_ConflictIsDuplicate() {
        store.failItem("doc-1", 409, 1);

        BulkStats stats = load(3);

        assertEquals(new BulkStats(2, 1, 0, 0), stats);
    }

    @Test
    @DisplayName("Should retry a transiently failed item until it succeeds")
    void testFinish_RetriesTransientFailure() throws IOException {
        store.failItem("doc-2", 503, 1);

        BulkStats stats = load(4);

        assertEquals(new BulkStats(4, 0, 0, 0), stats);
        assertTrue(store.get(INDEX, "doc-2").isPresent());
        assertTrue(deadLetterLines().isEmpty());
    }

    @Test
    @DisplayName("Should dead-letter items still failing after the retries")
    void testFinish_DeadLettersExhaustedRetries() throws IOException {
        store.failItem("doc-0", 429, 10);

        BulkStats stats = load(2);

        assertEquals(new BulkStats(1, 0, 1, 1), stats);
        assertEquals(4, store.itemAttempts());
        List<String> lines = deadLetterLines();
        assertEquals(1, lines.size());
        JsonNode line = objectMapper.readTree(lines.get(0));
        assertEquals(INDEX, line.get("_index").asText());
        assertEquals("doc-0", line.get("_id").asText());
        assertEquals("message of doc-0", line.get("_source").get("message").asText());
    }

    @Test
    @DisplayName("Should never retry a permanent failure")
    void testSend_PermanentFailureNotRetried() throws IOException {
        store.failItem("doc-0", 400, 1);

        BulkStats stats = load(1);

        assertEquals(new BulkStats(0, 0, 1, 0), stats);
        assertEquals(1, store.itemAttempts());
        assertTrue(deadLetterLines().isEmpty());
    }

    @Test
    @DisplayName("Should spill transient failures beyond the retry queue bound to disk")
    void testEnqueueRetries_OverflowSpillsToDisk() throws IOException {
        settings.setMaxRetryQueue(1);
        settings.setMaxRetries(0);
        store.failItem("doc-0", 503, 10).failItem("doc-1", 503, 10);

        BulkStats stats = load(2);

        assertEquals(2, stats.deadLettered());
        assertEquals(2, stats.failed());
        assertEquals(2, deadLetterLines().size());
    }

    @Test
    @DisplayName("Should retry what fits in the retry queue and dead-letter the overflow")
    void testEnqueueRetries_OverflowWithRetries() throws IOException {
        settings.setMaxRetryQueue(1);
        store.failItem("doc-0", 503, 1).failItem("doc-1", 503, 1);

        BulkStats stats = load(2);

        assertEquals(new BulkStats(1, 0, 1, 1), stats);
        assertTrue(store.get(INDEX, "doc-0").isPresent());
        assertFalse(store.get(INDEX, "doc-1").isPresent());
        List<String> lines = deadLetterLines();
        assertEquals(1, lines.size());
        assertEquals("doc-1", objectMapper.readTree(lines.get(0)).get("_id").asText());
    }

    // ============================================================================
    // Request failures
    // ============================================================================

    @Test
    @DisplayName("Should retry a whole request that failed transiently")
    void testSend_TransientRequestFailure() {
        store.failNextBulk(new StoreException("connection reset", StoreException.NO_RESPONSE));

        BulkStats stats = load(2);

        assertEquals(new BulkStats(2, 0, 0, 0), stats);
        assertEquals(2, store.bulkRequests());
    }

    @Test
    @DisplayName("Should count a rejected request as permanent failures")
    void testSend_RejectedRequest() throws IOException {
        store.failNextBulk(new StoreException("mapper_parsing_exception", 400));

        BulkStats stats = load(2);

        assertEquals(new BulkStats(0, 0, 2, 0), stats);
        assertTrue(deadLetterLines().isEmpty());
    }
}
