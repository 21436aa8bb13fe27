package com.di.logsift.group;

import com.di.logsift.aspect.LogTransaction;
import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.store.BulkOperation;
import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.IndexDefinitions;
import com.di.logsift.store.StoreConnector;
import com.di.logsift.util.MetricsCollector;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Re-sends the group merges captured in a failed-groups file. Merges that fail again are written
 * to {@code <file>.retry}.
 */
@Slf4j
@Service
public class FailedGroupReplayService {

    private final DocumentStore store;
    private final LogSiftProperties properties;
    private final MetricsCollector metrics;
    private final ObjectMapper objectMapper;

    public FailedGroupReplayService(DocumentStore store, LogSiftProperties properties, MetricsCollector metrics,
                                    ObjectMapper objectMapper) {
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    public record ReplayResult(int replayed, int failedAgain, int skippedLines) {
    }

    @LogTransaction(eventType = "FAILED_GROUP_REPLAY", transactionContext = "log_grouping",
            parameterNames = {"file", "deleteAfter"}, includeResult = true)
    public ReplayResult replay(Path file, boolean deleteAfter) throws IOException {
        StoreConnector.waitForConnection(store, properties.getStore().getConnectMaxRetries(),
                properties.getStore().getConnectRetryDelay());
        IndexDefinitions.ensureIndex(store, properties.getIndices().getGroups(), IndexDefinitions.groups());

        FailedGroupLog.ReadResult read = FailedGroupLog.read(file, objectMapper);
        List<BulkOperation> operations = read.actions().stream().map(FailedGroupAction::toOperation).toList();
        log.info("[GROUP] replaying {} failed group update(s) from {}", operations.size(), file);

        FailedGroupLog again = new FailedGroupLog(file.resolveSibling(file.getFileName() + ".retry"), objectMapper);
        GroupFlusher.FlushOutcome outcome = new GroupFlusher(store, properties, again, metrics).send(operations);

        ReplayResult result = new ReplayResult(outcome.upserted(), outcome.failed(), read.skipped());
        log.info("[GROUP] failed-group replay complete: replayed={} failedAgain={} skipped={}",
                result.replayed(), result.failedAgain(), result.skippedLines());
        if (deleteAfter) {
            if (result.failedAgain() == 0 && result.skippedLines() == 0) {
                Files.deleteIfExists(file);
                log.info("[GROUP] deleted {}", file);
            } else {
                log.warn("[GROUP] keeping {}: {} update(s) failed again", file, result.failedAgain());
            }
        }
        return result;
    }
}
