package com.di.logsift.group;

import com.di.logsift.aspect.LogTransaction;
import com.di.logsift.checkpoint.Checkpoint;
import com.di.logsift.checkpoint.CheckpointTracker;
import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.frame.StackFrameParser;
import com.di.logsift.signature.CompiledRules;
import com.di.logsift.signature.GroupClassification;
import com.di.logsift.signature.LogEvidence;
import com.di.logsift.signature.SignatureBuilder;
import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.Documents;
import com.di.logsift.store.IndexDefinitions;
import com.di.logsift.store.ResilientScroll;
import com.di.logsift.store.RetryPolicy;
import com.di.logsift.store.ScanHit;
import com.di.logsift.store.ScanRequest;
import com.di.logsift.store.StoreConnector;
import com.di.logsift.store.StoreQuery;
import com.di.logsift.util.MdcPropagation;
import com.di.logsift.util.MetricsCollector;
import com.di.logsift.util.Timestamps;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Scans error records from the raw-log index, classifies each one and merges it into its group.
 *
 * <p>Run: connect, ensure indices, load checkpoint, load custom rules, scan (error levels,
 * {@code ingestion_timestamp > checkpoint} unless ignored, optional session and slice), classify
 * and accumulate, flush every {@code batchSize} records, final flush, then advance the checkpoint
 * to the newest timestamp seen. Only unsliced runs advance the checkpoint: a slice never sees the
 * global maximum.
 *
 * <p>A run can be stopped at any point; re-running recovers because group merges are idempotent
 * per raw record.
 */
@Slf4j
@Service
public class GroupingAggregator {

    static final List<String> SOURCE_FIELDS = List.of(
            "sequence_summary",
            "exception_message",
            "normalized_exception_message",
            "message",
            "logger_name",
            "normalized_message",
            "ingestion_timestamp");

    private final DocumentStore store;
    private final LogSiftProperties properties;
    private final CheckpointTracker checkpointTracker;
    private final CustomRuleRepository customRuleRepository;
    private final MetricsCollector metrics;
    private final ObjectMapper objectMapper;

    public GroupingAggregator(DocumentStore store, LogSiftProperties properties, CheckpointTracker checkpointTracker,
                              CustomRuleRepository customRuleRepository, MetricsCollector metrics,
                              ObjectMapper objectMapper) {
        this.store = store;
        this.properties = properties;
        this.checkpointTracker = checkpointTracker;
        this.customRuleRepository = customRuleRepository;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @LogTransaction(eventType = "LOG_GROUPING", transactionContext = "log_grouping",
            parameterNames = {"request"}, includeResult = true)
    public AggregationResult aggregate(AggregationRequest request) {
        String runId = UUID.randomUUID().toString();
        MDC.put(MdcPropagation.RUN_ID, runId);
        if (request.isSliced()) {
            MDC.put(MdcPropagation.SLICE_ID, request.getSlice().toString());
        }
        try {
            return run(runId, request);
        } finally {
            MDC.remove(MdcPropagation.RUN_ID);
            MDC.remove(MdcPropagation.SLICE_ID);
        }
    }

    private AggregationResult run(String runId, AggregationRequest request) {
        LogSiftProperties.Grouping settings = properties.getGrouping();
        LogSiftProperties.Indices indices = properties.getIndices();
        int batchSize = request.getBatchSize() != null ? request.getBatchSize() : settings.getBatchSize();
        if (batchSize < 1) {
            throw new IllegalArgumentException("batch size must be positive, got " + batchSize);
        }

        StoreConnector.waitForConnection(store, properties.getStore().getConnectMaxRetries(),
                properties.getStore().getConnectRetryDelay());
        IndexDefinitions.ensureIndex(store, indices.getGroups(), IndexDefinitions.groups());
        IndexDefinitions.ensureIndex(store, indices.getGroupMembers(), IndexDefinitions.groupMembers());

        String checkpoint = checkpointTracker.getLastCheckpoint().map(Checkpoint::lastProcessedTimestamp).orElse(null);
        boolean useCheckpoint = checkpoint != null && !request.isIgnoreCheckpoint() && request.getSessionId() == null;
        if (useCheckpoint) {
            log.info("[CHECKPOINT] processing records ingested after {}", checkpoint);
        } else if (!request.isSliced()) {
            log.info("[CHECKPOINT] {}, processing all records",
                    request.isIgnoreCheckpoint() ? "ignoring checkpoint" : checkpoint == null ? "no checkpoint" : "session filter");
        }

        CompiledRules rules = CompiledRules.compile(customRuleRepository.loadRules());
        if (rules.size() > 0) {
            log.info("[GROUP] loaded {} custom grouping rule(s)", rules.size());
        }

        if (!store.indexExists(indices.getRawLogs())) {
            log.warn("[SCAN] raw-log index {} does not exist, nothing to group", indices.getRawLogs());
            return AggregationResult.builder().runId(runId).customRules(rules.size())
                    .checkpointBefore(checkpoint).checkpointAfter(checkpoint).build();
        }

        ScanRequest scan = ScanRequest.builder()
                .index(indices.getRawLogs())
                .query(buildQuery(useCheckpoint ? checkpoint : null, request.getSessionId()))
                .sourceFields(SOURCE_FIELDS)
                .pageSize(settings.getScanPageSize())
                .keepAlive(settings.getScrollKeepAlive())
                .slice(request.getSlice())
                .build();
        RetryPolicy scanRetry = RetryPolicy.of(settings.getScanMaxRetries(), settings.getScanInitialBackoff(),
                settings.getScanMaxBackoff());
        GroupFlusher flusher = new GroupFlusher(store, properties,
                new FailedGroupLog(Path.of(settings.getFailedGroupsFile()), objectMapper), metrics);

        log.info("[SCAN] starting scan{}", request.isSliced() ? " of slice " + request.getSlice() : "");
        long startMs = System.currentTimeMillis();
        long processed = 0;
        String latestSeen = checkpoint;
        GroupBatch batch = new GroupBatch(settings.getMaxSignatures());
        GroupFlusher.FlushOutcome outcome = GroupFlusher.FlushOutcome.EMPTY;

        try (ResilientScroll scroll = new ResilientScroll(store, scan, scanRetry)) {
            while (scroll.hasNext()) {
                if (request.getLimit() != null && processed >= request.getLimit()) {
                    break;
                }
                ScanHit hit = scroll.next();
                processed++;
                if (settings.getProgressInterval() > 0 && processed % settings.getProgressInterval() == 0) {
                    log.info("[SCAN] scanned {} records ({}s)", processed, (System.currentTimeMillis() - startMs) / 1000);
                }

                String timestamp = Documents.string(hit.source(), "ingestion_timestamp");
                latestSeen = Timestamps.max(latestSeen, timestamp);
                accumulate(batch, hit, timestamp, rules);

                if (batch.records() >= batchSize) {
                    outcome = outcome.plus(flusher.flush(batch.entries()));
                    batch.clear();
                }
            }
            if (!batch.isEmpty()) {
                outcome = outcome.plus(flusher.flush(batch.entries()));
                batch.clear();
            }
            metrics.recordScanRateLimited(scroll.getRateLimitRetries());
        }

        boolean advanced = false;
        if (!request.isSliced() && latestSeen != null && !latestSeen.equals(checkpoint)) {
            advanced = checkpointTracker.updateCheckpoint(latestSeen);
        }

        AggregationResult result = AggregationResult.builder()
                .runId(runId)
                .processed(processed)
                .upserted(outcome.upserted())
                .failed(outcome.failed())
                .newlyCounted(outcome.newlyCounted())
                .customRules(rules.size())
                .checkpointBefore(checkpoint)
                .checkpointAfter(advanced ? latestSeen : checkpoint)
                .checkpointUpdated(advanced)
                .build();
        log.info("[GROUP] grouping complete in {}ms: {}", System.currentTimeMillis() - startMs, result.summary());
        return result;
    }

    StoreQuery buildQuery(String after, String sessionId) {
        List<StoreQuery> filters = new ArrayList<>();
        filters.add(StoreQuery.terms("level", properties.getGrouping().getErrorLevels()));
        if (after != null) {
            filters.add(StoreQuery.greaterThan("ingestion_timestamp", after));
        }
        if (sessionId != null) {
            filters.add(StoreQuery.term("session_id", sessionId));
        }
        return StoreQuery.and(filters);
    }

    private void accumulate(GroupBatch batch, ScanHit hit, String timestamp, CompiledRules rules) {
        Map<String, Object> source = hit.source();
        LogEvidence evidence = LogEvidence.builder()
                .message(Documents.string(source, "message"))
                .exceptionMessage(Documents.string(source, "exception_message"))
                .normalizedMessage(Documents.string(source, "normalized_message"))
                .normalizedExceptionMessage(Documents.string(source, "normalized_exception_message"))
                .loggerName(Documents.string(source, "logger_name"))
                .sequenceSummary(Documents.string(source, "sequence_summary"))
                .build();
        GroupClassification classification = SignatureBuilder.classify(evidence, rules);
        metrics.recordGroupedRecord();

        String exceptionSignature = SignatureBuilder.normalizedExceptionMessage(evidence);
        String messageSignature = SignatureBuilder.normalizedMessage(evidence);
        String recordTime = timestamp != null ? timestamp : Timestamps.now();
        RepresentativeLog representative = new RepresentativeLog(messageSignature, exceptionSignature,
                evidence.getLoggerName() == null ? "" : evidence.getLoggerName(), hit.id(), recordTime);

        GroupBatchEntry entry = batch.entryFor(classification);
        entry.add(hit.id(), recordTime, exceptionSignature, messageSignature, representative);
        if (entry.needsRules()) {
            entry.setRules(StackFrameParser.extractFrames(classification.signature()));
        }
    }
}
