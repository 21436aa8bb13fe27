package com.di.logsift.ingest;

/**
 * Final counts of one bulk load.
 *
 * @param failed       permanent failures plus {@code deadLettered}
 * @param deadLettered transient failures that ran out of retries or retry-queue space
 */
public record BulkStats(long indexed, long duplicates, long failed, long deadLettered) {

    public static final BulkStats EMPTY = new BulkStats(0, 0, 0, 0);

    public BulkStats plus(BulkStats other) {
        return new BulkStats(indexed + other.indexed, duplicates + other.duplicates,
                failed + other.failed, deadLettered + other.deadLettered);
    }
}
