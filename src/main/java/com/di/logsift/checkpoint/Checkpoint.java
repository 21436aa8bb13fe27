package com.di.logsift.checkpoint;

/**
 * The newest {@code ingestion_timestamp} a sequential grouping run has fully processed.
 */
public record Checkpoint(String lastProcessedTimestamp, String updatedAt) {
}
