package com.di.logsift.ingest;

import com.di.logsift.aspect.LogTransaction;
import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.IndexDefinitions;
import com.di.logsift.store.StoreConnector;
import com.di.logsift.util.MdcPropagation;
import com.di.logsift.util.MetricsCollector;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads raw log lines, keeps the error records and bulk-writes them to the raw-log index.
 *
 * <p>Record ids are content hashes of (source name, line number, line), so ingesting the same
 * input twice rewrites the same documents instead of adding new ones.
 */
@Slf4j
@Service
public class IngestionService {

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    private final DocumentStore store;
    private final LogSiftProperties properties;
    private final MetricsCollector metrics;
    private final ObjectMapper objectMapper;
    private final LogLineParser parser;

    public IngestionService(DocumentStore store, LogSiftProperties properties, MetricsCollector metrics,
                            ObjectMapper objectMapper) {
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        LogSiftProperties.Ingest ingest = properties.getIngest();
        this.parser = new LogLineParser(objectMapper, ingest.getAdmissionTokens(), ingest.getErrorLevels(),
                ingest.getMaxNormalizedLength());
    }

    /**
     * Ingests one stream of lines under a new session id.
     */
    @LogTransaction(eventType = "LOG_INGEST", transactionContext = "raw_log_ingest", parameterNames = {"sourceName"})
    public IngestionResult ingest(String sourceName, Iterator<String> lines) {
        prepareStore();
        return withSession(UUID.randomUUID().toString(), sessionId -> ingestLines(sourceName, lines, sessionId));
    }

    /**
     * Ingests a plain log file, or every entry of a {@code .zip} archive under one session id.
     * Undecodable bytes are replaced rather than failing the file.
     */
    @LogTransaction(eventType = "FILE_INGEST", transactionContext = "raw_log_ingest", parameterNames = {"path"})
    public IngestionResult ingestFile(Path path) throws IOException {
        prepareStore();
        String sessionId = UUID.randomUUID().toString();
        String fileName = path.getFileName().toString();
        if (fileName.toLowerCase(Locale.ROOT).endsWith(".zip")) {
            return withSession(sessionId, id -> ingestArchive(path, id));
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), lenientUtf8()))) {
            return withSession(sessionId, id -> ingestLines(fileName, reader.lines().iterator(), id));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private IngestionResult ingestArchive(Path path, String sessionId) {
        log.info("[INGEST] reading archive {}", path);
        IngestionResult total = IngestionResult.builder().sessionId(sessionId).sourceName(path.getFileName().toString()).build();
        try (ZipFile zip = new ZipFile(path.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory()) {
                    continue;
                }
                log.info("[INGEST] processing archive entry {}", entry.getName());
                String content = readEntry(zip, entry);
                IngestionResult entryResult = ingestLines(entry.getName(),
                        ArchiveEntryReader.lines(content, objectMapper).iterator(), sessionId);
                total = total.plus(entryResult.toBuilder().fileProcessed(entry.getName()).build());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read archive " + path, e);
        }
        log.info("[INGEST] archive {} complete: {}", path.getFileName(), total.summary());
        return total;
    }

    private IngestionResult ingestLines(String sourceName, Iterator<String> lines, String sessionId) {
        LogSiftProperties.Ingest settings = properties.getIngest();
        String index = properties.getIndices().getRawLogs();
        log.info("[INGEST] starting ingestion of {} into {} (session {})", sourceName, index, sessionId);

        long startMs = System.currentTimeMillis();
        long lineNumber = 0;
        long ignored = 0;
        long skippedSafe = 0;
        BulkStats stats;

        DeadLetterWriter deadLetters = new DeadLetterWriter(Path.of(settings.getDeadLetterFile()), objectMapper);
        try (IndexSettingsScope ignoredScope = settings.isOptimizeIndexSettings()
                ? IndexSettingsScope.open(store, index) : IndexSettingsScope.disabled();
             BulkIndexer indexer = new BulkIndexer(store, settings, deadLetters, metrics, objectMapper)) {

            while (lines.hasNext()) {
                String raw = lines.next();
                lineNumber++;
                metrics.recordLineScanned();
                if (settings.getProgressInterval() > 0 && lineNumber % settings.getProgressInterval() == 0) {
                    log.info("[SCAN] scanned {} lines ({}s) | skipped safe: {}", lineNumber,
                            (System.currentTimeMillis() - startMs) / 1000, skippedSafe);
                }

                LineOutcome outcome = parser.parse(sourceName, lineNumber, raw, sessionId);
                switch (outcome.status()) {
                    case BLANK -> {
                    }
                    case SKIPPED_SAFE -> {
                        skippedSafe++;
                        metrics.recordLineSkipped();
                    }
                    case MALFORMED -> {
                        ignored++;
                        metrics.recordLineMalformed();
                        log.debug("[INGEST] {} line {} ignored: {}", sourceName, lineNumber, outcome.reason());
                    }
                    case ACCEPTED -> indexer.add(new RawDocument(index, outcome.id(),
                            objectMapper.convertValue(outcome.record(), DOCUMENT)));
                }
            }
            stats = indexer.finish();
        }

        IngestionResult result = IngestionResult.builder()
                .sessionId(sessionId)
                .sourceName(sourceName)
                .linesScanned(lineNumber)
                .indexed(stats.indexed())
                .duplicates(stats.duplicates())
                .failed(stats.failed())
                .deadLettered(stats.deadLettered())
                .ignored(ignored)
                .skippedSafe(skippedSafe)
                .build();
        log.info("[INGEST] ingestion of {} complete in {}ms: {}", sourceName, System.currentTimeMillis() - startMs, result.summary());
        return result;
    }

    private void prepareStore() {
        StoreConnector.waitForConnection(store, properties.getStore().getConnectMaxRetries(),
                properties.getStore().getConnectRetryDelay());
        IndexDefinitions.ensureIndex(store, properties.getIndices().getRawLogs(), IndexDefinitions.rawLogs());
    }

    private static IngestionResult withSession(String sessionId, Function<String, IngestionResult> run) {
        String previous = MDC.get(MdcPropagation.RUN_ID);
        MDC.put(MdcPropagation.RUN_ID, sessionId);
        try {
            return run.apply(sessionId);
        } finally {
            if (previous != null) {
                MDC.put(MdcPropagation.RUN_ID, previous);
            } else {
                MDC.remove(MdcPropagation.RUN_ID);
            }
        }
    }

    private static String readEntry(ZipFile zip, ZipEntry entry) throws IOException {
        try (InputStream in = zip.getInputStream(entry);
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, lenientUtf8()))) {
            StringBuilder content = new StringBuilder();
            char[] buffer = new char[8192];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                content.append(buffer, 0, read);
            }
            return content.toString();
        }
    }

    private static CharsetDecoder lenientUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }
}
