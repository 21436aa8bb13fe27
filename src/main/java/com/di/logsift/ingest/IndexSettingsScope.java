package com.di.logsift.ingest;

import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.IndexTuning;
import com.di.logsift.store.StoreException;
import lombok.extern.slf4j.Slf4j;

/**
 * Relaxes refresh, replica and translog settings of an index for the duration of a bulk load
 * and restores the previous values on close, whatever happened in between.
 *
 * <pre>
 * try (IndexSettingsScope ignored = IndexSettingsScope.open(store, index)) {
 *     ... bulk writes ...
 * }
 * </pre>
 */
@Slf4j
public final class IndexSettingsScope implements AutoCloseable {

    private static final IndexSettingsScope NOOP = new IndexSettingsScope(null, null, null);

    private final DocumentStore store;
    private final String index;
    private final IndexTuning original;

    private IndexSettingsScope(DocumentStore store, String index, IndexTuning original) {
        this.store = store;
        this.index = index;
        this.original = original;
    }

    /** A scope that changes nothing, for runs with tuning disabled. */
    public static IndexSettingsScope disabled() {
        return NOOP;
    }

    /**
     * Applies {@link IndexTuning#BULK_LOAD}. A failure here is logged and the load proceeds with
     * the current settings.
     */
    public static IndexSettingsScope open(DocumentStore store, String index) {
        IndexTuning original;
        try {
            original = store.readTuning(index);
        } catch (StoreException e) {
            log.warn("[SETTINGS] could not read settings of {} ({}), will restore defaults", index, e.getMessage());
            original = IndexTuning.DEFAULTS;
        }
        try {
            store.applyTuning(index, IndexTuning.BULK_LOAD);
            log.info("[SETTINGS] optimized {} for bulk load (previous {})", index, original);
        } catch (StoreException e) {
            log.warn("[SETTINGS] failed to optimize settings of {}: {}", index, e.getMessage());
        }
        return new IndexSettingsScope(store, index, original);
    }

    @Override
    public void close() {
        if (store == null) {
            return;
        }
        try {
            store.applyTuning(index, original);
            store.refresh(index);
            log.info("[SETTINGS] restored settings of {}", index);
        } catch (StoreException e) {
            log.warn("[SETTINGS] failed to restore settings of {}: {}", index, e.getMessage());
        }
    }
}
