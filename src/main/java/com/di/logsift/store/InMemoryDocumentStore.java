package com.di.logsift.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory implementation of {@link DocumentStore}. Suitable for tests and local dry runs.
 * When {@code logsift.store.type=elasticsearch} (the default), {@link ElasticsearchDocumentStore}
 * is used instead.
 *
 * <p>Reproduces the status codes the pipeline depends on (201 created, 200 updated, 409 on
 * create of an existing id, 404 on partial update of a missing id). Scripted upserts run the
 * Java side of the {@link MergeScript}. Slices partition documents by id hash.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "logsift.store.type", havingValue = "in-memory")
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, StoredIndex> indices = new HashMap<>();
    private final Map<String, OpenScroll> scrolls = new HashMap<>();

    @Override
    public boolean ping() {
        return true;
    }

    @Override
    public synchronized boolean indexExists(String index) {
        return indices.containsKey(index);
    }

    @Override
    public synchronized void createIndex(String index, Map<String, Object> body) {
        if (indices.containsKey(index)) {
            throw new StoreException("index [" + index + "] already exists", 400);
        }
        indices.put(index, new StoredIndex());
        log.debug("[MEMORY] created index {}", index);
    }

    @Override
    public synchronized void deleteIndex(String index) {
        indices.remove(index);
    }

    @Override
    public void refresh(String index) {
        // writes are visible immediately
    }

    @Override
    public synchronized Optional<Map<String, Object>> get(String index, String id) {
        StoredIndex stored = indices.get(index);
        if (stored == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(Documents.deepCopy(stored.documents.get(id)));
    }

    @Override
    public synchronized Map<String, Map<String, Object>> multiGet(String index, List<String> ids, List<String> sourceFields) {
        Map<String, Map<String, Object>> found = new LinkedHashMap<>();
        StoredIndex stored = indices.get(index);
        if (stored == null) {
            return found;
        }
        for (String id : ids) {
            Map<String, Object> document = stored.documents.get(id);
            if (document != null) {
                found.put(id, Documents.project(document, sourceFields));
            }
        }
        return found;
    }

    @Override
    public synchronized void put(String index, String id, Map<String, Object> document) {
        indexFor(index).documents.put(id, Documents.deepCopy(document));
    }

    @Override
    public synchronized List<BulkItemResult> bulk(List<BulkOperation> operations) {
        List<BulkItemResult> results = new ArrayList<>(operations.size());
        for (BulkOperation operation : operations) {
            results.add(apply(operation));
        }
        return results;
    }

    /**
     * Executes one bulk action. Overridable so tests can inject item-level failures.
     */
    protected BulkItemResult apply(BulkOperation operation) {
        StoredIndex stored = indexFor(operation.getIndex());
        String id = operation.getId();
        Map<String, Object> existing = stored.documents.get(id);
        switch (operation.getType()) {
            case INDEX -> {
                stored.documents.put(id, Documents.deepCopy(operation.getDocument()));
                return BulkItemResult.ok(operation.getIndex(), id, existing == null ? 201 : 200);
            }
            case CREATE -> {
                if (existing != null) {
                    return BulkItemResult.failed(operation.getIndex(), id, 409, "version_conflict_engine_exception",
                            "[" + id + "]: version conflict, document already exists");
                }
                stored.documents.put(id, Documents.deepCopy(operation.getDocument()));
                return BulkItemResult.ok(operation.getIndex(), id, 201);
            }
            case UPDATE_DOC -> {
                if (existing == null) {
                    return BulkItemResult.failed(operation.getIndex(), id, 404, "document_missing_exception",
                            "[" + id + "]: document missing");
                }
                Documents.merge(existing, operation.getDocument());
                return BulkItemResult.ok(operation.getIndex(), id, 200);
            }
            case SCRIPTED_UPSERT -> {
                if (existing == null) {
                    stored.documents.put(id, Documents.deepCopy(operation.getUpsert()));
                    return BulkItemResult.ok(operation.getIndex(), id, 201);
                }
                operation.getScript().apply(existing, Documents.deepCopy(operation.getParams()));
                return BulkItemResult.ok(operation.getIndex(), id, 200);
            }
            default -> throw new IllegalArgumentException("Unsupported bulk operation " + operation.getType());
        }
    }

    @Override
    public synchronized List<ScanHit> search(String index, StoreQuery query, int size) {
        return matching(index, query, null, List.of()).stream().limit(size).toList();
    }

    @Override
    public synchronized ScrollPage openScroll(ScanRequest request) {
        List<ScanHit> hits = matching(request.getIndex(), request.getQuery(), request.getSlice(), request.getSourceFields());
        String scrollId = UUID.randomUUID().toString();
        OpenScroll scroll = new OpenScroll(hits, request.getPageSize());
        scrolls.put(scrollId, scroll);
        return new ScrollPage(scrollId, scroll.nextPage());
    }

    @Override
    public synchronized ScrollPage continueScroll(String scrollId, Duration keepAlive) {
        OpenScroll scroll = scrolls.get(scrollId);
        if (scroll == null) {
            throw new StoreException("No search context found for id [" + scrollId + "]", 404);
        }
        return new ScrollPage(scrollId, scroll.nextPage());
    }

    @Override
    public synchronized void clearScroll(String scrollId) {
        scrolls.remove(scrollId);
    }

    @Override
    public synchronized IndexTuning readTuning(String index) {
        return indexFor(index).tuning;
    }

    @Override
    public synchronized void applyTuning(String index, IndexTuning tuning) {
        indexFor(index).tuning = tuning;
    }

    /** Number of documents in an index, 0 when missing. */
    public synchronized int count(String index) {
        StoredIndex stored = indices.get(index);
        return stored == null ? 0 : stored.documents.size();
    }

    /** Number of scroll contexts not yet cleared. */
    public synchronized int openScrollCount() {
        return scrolls.size();
    }

    private StoredIndex indexFor(String index) {
        return indices.computeIfAbsent(index, k -> new StoredIndex());
    }

    private List<ScanHit> matching(String index, StoreQuery query, Slice slice, List<String> sourceFields) {
        StoredIndex stored = indices.get(index);
        if (stored == null) {
            throw new StoreException("no such index [" + index + "]", 404);
        }
        List<ScanHit> hits = new ArrayList<>();
        stored.documents.forEach((id, document) -> {
            if (slice != null && Math.floorMod(id.hashCode(), slice.max()) != slice.id()) {
                return;
            }
            if (query.matches(document)) {
                hits.add(new ScanHit(id, Documents.project(document, sourceFields)));
            }
        });
        return hits;
    }

    private static final class StoredIndex {
        private final Map<String, Map<String, Object>> documents = new LinkedHashMap<>();
        private IndexTuning tuning = IndexTuning.DEFAULTS;
    }

    private static final class OpenScroll {
        private final List<ScanHit> hits;
        private final int pageSize;
        private int position;

        private OpenScroll(List<ScanHit> hits, int pageSize) {
            this.hits = hits;
            this.pageSize = pageSize;
        }

        private List<ScanHit> nextPage() {
            int end = Math.min(position + pageSize, hits.size());
            List<ScanHit> page = new ArrayList<>(hits.subList(position, end));
            position = end;
            return page;
        }
    }
}
