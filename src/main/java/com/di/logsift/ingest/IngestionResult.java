package com.di.logsift.ingest;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Summary of one ingestion run. For archives the counts are summed over all entries and
 * {@link #filesProcessed} lists the entries read.
 */
@Value
@Builder(toBuilder = true)
public class IngestionResult {
    String sessionId;
    String sourceName;
    long linesScanned;
    long indexed;
    long duplicates;
    /** Permanent failures, dead-lettered documents included. */
    long failed;
    long deadLettered;
    /** Lines that were not JSON objects. */
    long ignored;
    /** Lines rejected by the admission filters. */
    long skippedSafe;
    @Singular("fileProcessed")
    List<String> filesProcessed;

    public IngestionResult plus(IngestionResult other) {
        List<String> files = new ArrayList<>(filesProcessed);
        files.addAll(other.filesProcessed);
        return toBuilder()
                .linesScanned(linesScanned + other.linesScanned)
                .indexed(indexed + other.indexed)
                .duplicates(duplicates + other.duplicates)
                .failed(failed + other.failed)
                .deadLettered(deadLettered + other.deadLettered)
                .ignored(ignored + other.ignored)
                .skippedSafe(skippedSafe + other.skippedSafe)
                .clearFilesProcessed()
                .filesProcessed(files)
                .build();
    }

    public String summary() {
        return String.format("indexed=%d duplicates=%d failed=%d (dead-lettered %d) ignored=%d skippedSafe=%d lines=%d",
                indexed, duplicates, failed, deadLettered, ignored, skippedSafe, linesScanned);
    }
}
