package com.di.logsift.checkpoint;

import com.di.logsift.LogSiftFixtures;
import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.store.InMemoryDocumentStore;
import com.di.logsift.store.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CheckpointTracker Tests")
class CheckpointTrackerTest {

    @TempDir
    Path tempDir;

    private InMemoryDocumentStore store;
    private LogSiftProperties properties;
    private CheckpointTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        properties = LogSiftFixtures.properties(tempDir);
        tracker = new CheckpointTracker(store, properties);
    }

    @Test
    @DisplayName("Should report no checkpoint before the first update")
    void testGetLastCheckpoint_Missing() {
        assertTrue(tracker.getLastCheckpoint().isEmpty());
    }

    @Test
    @DisplayName("Should store a single document and let the last writer win")
    void testUpdateCheckpoint() {
        assertTrue(tracker.updateCheckpoint("2025-04-18T14:23:09.000Z"));
        assertTrue(tracker.updateCheckpoint("2025-04-18T15:02:41.000Z"));

        Checkpoint checkpoint = tracker.getLastCheckpoint().orElseThrow();
        assertEquals("2025-04-18T15:02:41.000Z", checkpoint.lastProcessedTimestamp());
        assertNotNull(checkpoint.updatedAt());
        assertEquals(1, store.count(properties.getIndices().getCheckpoint()));
    }

    @Test
    @DisplayName("Should ignore a checkpoint document without a timestamp")
    void testGetLastCheckpoint_Incomplete() {
        store.put(properties.getIndices().getCheckpoint(), CheckpointTracker.CHECKPOINT_ID, Map.of("updated_at", "x"));

        assertTrue(tracker.getLastCheckpoint().isEmpty());
    }

    @Test
    @DisplayName("Should treat store failures as no checkpoint and not updated")
    void testStoreFailures() {
        InMemoryDocumentStore failing = new InMemoryDocumentStore() {
            @Override
            public Optional<Map<String, Object>> get(String index, String id) {
                throw new StoreException("cluster_block_exception", 503);
            }

            @Override
            public void put(String index, String id, Map<String, Object> document) {
                throw new StoreException("cluster_block_exception", 503);
            }
        };
        CheckpointTracker failingTracker = new CheckpointTracker(failing, properties);

        assertTrue(failingTracker.getLastCheckpoint().isEmpty());
        assertFalse(failingTracker.updateCheckpoint("2025-04-18T15:02:41.000Z"));
    }
}
