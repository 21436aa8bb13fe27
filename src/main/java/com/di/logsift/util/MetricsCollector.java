package com.di.logsift.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for ingestion and grouping runs.
 */
@Slf4j
@Component
public class MetricsCollector {

    // Ingestion
    private final Counter linesScannedCounter;
    private final Counter linesSkippedCounter;
    private final Counter linesMalformedCounter;
    private final Counter documentsIndexedCounter;
    private final Counter documentsDuplicateCounter;
    private final Counter documentsFailedCounter;
    private final Counter deadLetterCounter;
    private final Counter retryAttemptCounter;
    private final Timer bulkRequestTimer;
    private final DistributionSummary bulkChunkSizeDistribution;

    // Grouping
    private final Counter recordsGroupedCounter;
    private final Counter groupUpsertCounter;
    private final Counter groupFailureCounter;
    private final Counter newMembersCounter;
    private final Counter scanRateLimitCounter;
    private final Timer groupFlushTimer;

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.linesScannedCounter = Counter.builder("logsift.ingest.lines")
                .description("Raw lines read")
                .tag("outcome", "scanned")
                .register(meterRegistry);

        this.linesSkippedCounter = Counter.builder("logsift.ingest.lines")
                .description("Lines skipped by the admission filters")
                .tag("outcome", "skipped")
                .register(meterRegistry);

        this.linesMalformedCounter = Counter.builder("logsift.ingest.lines")
                .description("Lines that were not valid JSON objects")
                .tag("outcome", "malformed")
                .register(meterRegistry);

        this.documentsIndexedCounter = Counter.builder("logsift.ingest.documents")
                .description("Raw log documents written")
                .tag("status", "indexed")
                .register(meterRegistry);

        this.documentsDuplicateCounter = Counter.builder("logsift.ingest.documents")
                .description("Raw log documents already present")
                .tag("status", "duplicate")
                .register(meterRegistry);

        this.documentsFailedCounter = Counter.builder("logsift.ingest.documents")
                .description("Raw log documents that could not be written")
                .tag("status", "failed")
                .register(meterRegistry);

        this.deadLetterCounter = Counter.builder("logsift.ingest.dead.letter")
                .description("Documents spilled to the dead-letter file")
                .register(meterRegistry);

        this.retryAttemptCounter = Counter.builder("logsift.ingest.retry.attempts")
                .description("Bulk retry rounds over the in-memory retry queue")
                .register(meterRegistry);

        this.bulkRequestTimer = Timer.builder("logsift.store.bulk.duration")
                .description("Time taken by one bulk request")
                .register(meterRegistry);

        this.bulkChunkSizeDistribution = DistributionSummary.builder("logsift.store.bulk.size")
                .description("Operations per bulk request")
                .baseUnit("operations")
                .register(meterRegistry);

        this.recordsGroupedCounter = Counter.builder("logsift.group.records")
                .description("Raw records classified into groups")
                .register(meterRegistry);

        this.groupUpsertCounter = Counter.builder("logsift.group.upserts")
                .description("Group merge operations applied")
                .tag("status", "success")
                .register(meterRegistry);

        this.groupFailureCounter = Counter.builder("logsift.group.upserts")
                .description("Group merge operations that failed")
                .tag("status", "error")
                .register(meterRegistry);

        this.newMembersCounter = Counter.builder("logsift.group.members.new")
                .description("Raw records counted into a group for the first time")
                .register(meterRegistry);

        this.scanRateLimitCounter = Counter.builder("logsift.group.scan.rate.limited")
                .description("Scan requests retried after a 429")
                .register(meterRegistry);

        this.groupFlushTimer = Timer.builder("logsift.group.flush.duration")
                .description("Time taken to flush one batch of group updates")
                .register(meterRegistry);
    }

    // ============================================================================
    // Ingestion
    // ============================================================================

    public void recordLineScanned() {
        linesScannedCounter.increment();
    }

    public void recordLineSkipped() {
        linesSkippedCounter.increment();
    }

    public void recordLineMalformed() {
        linesMalformedCounter.increment();
    }

    /**
     * Records the outcome counts of one bulk request.
     */
    public void recordBulkOutcome(int indexed, int duplicates, int failed) {
        documentsIndexedCounter.increment(indexed);
        documentsDuplicateCounter.increment(duplicates);
        documentsFailedCounter.increment(failed);
    }

    public void recordDeadLetter(int documents) {
        deadLetterCounter.increment(documents);
        log.debug("Recorded dead-letter spill: documents={}", documents);
    }

    public void recordRetryAttempt() {
        retryAttemptCounter.increment();
    }

    /**
     * @param operations operations in the request
     * @param durationMs wall-clock time of the request
     */
    public void recordBulkRequest(int operations, long durationMs) {
        bulkChunkSizeDistribution.record(operations);
        bulkRequestTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    // ============================================================================
    // Grouping
    // ============================================================================

    public void recordGroupedRecord() {
        recordsGroupedCounter.increment();
    }

    public void recordGroupFlush(int upserted, int failed, int newMembers, long durationMs) {
        groupUpsertCounter.increment(upserted);
        groupFailureCounter.increment(failed);
        newMembersCounter.increment(newMembers);
        groupFlushTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded group flush: upserted={}, failed={}, newMembers={}, durationMs={}",
                upserted, failed, newMembers, durationMs);
    }

    public void recordScanRateLimited(int retries) {
        scanRateLimitCounter.increment(retries);
    }
}
