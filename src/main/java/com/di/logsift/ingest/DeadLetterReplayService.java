package com.di.logsift.ingest;

import com.di.logsift.aspect.LogTransaction;
import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.normalize.PatternNormalizer;
import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.IndexDefinitions;
import com.di.logsift.store.StoreConnector;
import com.di.logsift.util.ContentHash;
import com.di.logsift.util.MetricsCollector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Re-sends the documents of a dead-letter file to the raw-log index.
 *
 * <p>Lines may be enveloped ({@code {"_index", "_id", "_source"}}, as the bulk writer spills them)
 * or bare documents. Enveloped documents keep their id; bare documents get the MD5 of their
 * key-sorted JSON. Normalized fields are capped as on the primary path. Documents that fail again
 * are written to {@code <file>.retry}.
 */
@Slf4j
@Service
public class DeadLetterReplayService {

    static final String[] CAPPED_FIELDS = {"normalized_exception_message", "normalized_message"};

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    private final DocumentStore store;
    private final LogSiftProperties properties;
    private final MetricsCollector metrics;
    private final ObjectMapper objectMapper;
    private final ObjectMapper sortedMapper;

    public DeadLetterReplayService(DocumentStore store, LogSiftProperties properties, MetricsCollector metrics,
                                   ObjectMapper objectMapper) {
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.sortedMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public record ReplayResult(long retriedIndexed, long failedAgain, long duplicates, long skippedLines) {
    }

    /**
     * @param deleteAfter delete {@code file} once every document in it was written
     */
    @LogTransaction(eventType = "DEAD_LETTER_REPLAY", transactionContext = "raw_log_ingest",
            parameterNames = {"file", "deleteAfter"}, includeResult = true)
    public ReplayResult replay(Path file, boolean deleteAfter) throws IOException {
        StoreConnector.waitForConnection(store, properties.getStore().getConnectMaxRetries(),
                properties.getStore().getConnectRetryDelay());
        String index = properties.getIndices().getRawLogs();
        IndexDefinitions.ensureIndex(store, index, IndexDefinitions.rawLogs());
        log.info("[DLQ] replaying {} into {}", file, index);

        LogSiftProperties.Ingest settings = properties.getIngest();
        DeadLetterWriter failedAgain = new DeadLetterWriter(file.resolveSibling(file.getFileName() + ".retry"), objectMapper);
        long skipped = 0;
        BulkStats stats;

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             IndexSettingsScope ignoredScope = settings.isOptimizeIndexSettings()
                     ? IndexSettingsScope.open(store, index) : IndexSettingsScope.disabled();
             BulkIndexer indexer = new BulkIndexer(store, settings, failedAgain, metrics, objectMapper)) {
            String line;
            long lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    indexer.add(toDocument(line.strip(), index));
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    skipped++;
                    log.warn("[DLQ] skipping bad line {} of {}: {}", lineNumber, file, e.getMessage());
                }
            }
            stats = indexer.finish();
        }

        ReplayResult result = new ReplayResult(stats.indexed(), stats.failed(), stats.duplicates(), skipped);
        log.info("[DLQ] replay of {} complete: retried={} failedAgain={} duplicates={} skipped={}",
                file, result.retriedIndexed(), result.failedAgain(), result.duplicates(), result.skippedLines());

        if (deleteAfter) {
            if (result.failedAgain() == 0 && result.skippedLines() == 0) {
                Files.deleteIfExists(file);
                log.info("[DLQ] deleted {}", file);
            } else {
                log.warn("[DLQ] keeping {}: {} document(s) failed again, {} line(s) unreadable",
                        file, result.failedAgain(), result.skippedLines());
            }
        }
        return result;
    }

    RawDocument toDocument(String line, String index) throws JsonProcessingException {
        JsonNode node = objectMapper.readTree(line);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("not a JSON object");
        }
        Map<String, Object> source;
        String id = null;
        if (node.has("_source") && node.has("_index")) {
            source = objectMapper.convertValue(node.get("_source"), DOCUMENT);
            JsonNode idNode = node.get("_id");
            if (idNode != null && idNode.isTextual() && !idNode.asText().isEmpty()) {
                id = idNode.asText();
            }
        } else {
            source = objectMapper.convertValue(node, DOCUMENT);
        }

        int maxLength = properties.getIngest().getMaxNormalizedLength();
        for (String field : CAPPED_FIELDS) {
            if (source.get(field) instanceof String value) {
                source.put(field, PatternNormalizer.truncate(value, maxLength));
            }
        }
        if (id == null) {
            id = ContentHash.md5Hex(sortedMapper.writeValueAsString(source));
        }
        return new RawDocument(index, id, source);
    }
}
