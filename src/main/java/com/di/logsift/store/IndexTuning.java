package com.di.logsift.store;

/**
 * The index settings relaxed during bulk loading.
 */
public record IndexTuning(String refreshInterval, String numberOfReplicas, String translogDurability) {

    public static final IndexTuning BULK_LOAD = new IndexTuning("-1", "0", "async");
    public static final IndexTuning DEFAULTS = new IndexTuning("1s", "1", "request");
}
