package com.di.logsift.checkpoint;

import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.Documents;
import com.di.logsift.store.IndexDefinitions;
import com.di.logsift.store.StoreException;
import com.di.logsift.util.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Single-document checkpoint store, last writer wins. Read and write failures are logged and
 * treated as "no checkpoint" / "not updated"; the next run then reprocesses records, which the
 * idempotent group merge tolerates.
 */
@Slf4j
@Component
public class CheckpointTracker {

    static final String CHECKPOINT_ID = "grouper_checkpoint";

    private final DocumentStore store;
    private final String index;

    public CheckpointTracker(DocumentStore store, LogSiftProperties properties) {
        this.store = store;
        this.index = properties.getIndices().getCheckpoint();
    }

    public Optional<Checkpoint> getLastCheckpoint() {
        try {
            return store.get(index, CHECKPOINT_ID)
                    .map(source -> new Checkpoint(Documents.string(source, "last_processed_timestamp"),
                            Documents.string(source, "updated_at")))
                    .filter(checkpoint -> checkpoint.lastProcessedTimestamp() != null);
        } catch (StoreException e) {
            log.warn("[CHECKPOINT] could not read checkpoint from {}: {}", index, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return {@code true} when the checkpoint was written
     */
    public boolean updateCheckpoint(String timestamp) {
        try {
            IndexDefinitions.ensureIndex(store, index, IndexDefinitions.checkpoint());
            Map<String, Object> document = new LinkedHashMap<>();
            document.put("last_processed_timestamp", timestamp);
            document.put("updated_at", Timestamps.now());
            store.put(index, CHECKPOINT_ID, document);
            log.info("[CHECKPOINT] updated to {}", timestamp);
            return true;
        } catch (StoreException e) {
            log.warn("[CHECKPOINT] failed to update checkpoint to {}: {}", timestamp, e.getMessage());
            return false;
        }
    }
}
