package com.di.logsift.store;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The document store the pipeline reads from and writes to.
 *
 * <p>Every method is a blocking network call in the remote implementation and throws
 * {@link StoreException} for request-level failures. Per-item failures of a bulk request are
 * returned as {@link BulkItemResult} values, never thrown.
 */
public interface DocumentStore {

    boolean ping();

    boolean indexExists(String index);

    /**
     * Creates an index from a settings/mappings body. Throws {@link StoreException} with
     * status 400 when it already exists.
     */
    void createIndex(String index, Map<String, Object> body);

    /** Deletes an index; missing indices are ignored. */
    void deleteIndex(String index);

    void refresh(String index);

    Optional<Map<String, Object>> get(String index, String id);

    /** Found documents by id; missing ids are absent from the result. */
    Map<String, Map<String, Object>> multiGet(String index, List<String> ids, List<String> sourceFields);

    /** Create or replace one document. */
    void put(String index, String id, Map<String, Object> document);

    List<BulkItemResult> bulk(List<BulkOperation> operations);

    /** One-shot search, at most {@code size} hits. */
    List<ScanHit> search(String index, StoreQuery query, int size);

    ScrollPage openScroll(ScanRequest request);

    ScrollPage continueScroll(String scrollId, Duration keepAlive);

    void clearScroll(String scrollId);

    IndexTuning readTuning(String index);

    void applyTuning(String index, IndexTuning tuning);
}
