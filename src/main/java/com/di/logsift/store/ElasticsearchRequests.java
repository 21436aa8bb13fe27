package com.di.logsift.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request bodies and response parsing for the Elasticsearch/OpenSearch REST API.
 * Kept free of I/O so the wire format can be tested without a cluster.
 */
public final class ElasticsearchRequests {

    static final String PAINLESS = "painless";

    private ElasticsearchRequests() {
    }

    // ------------------------------------------------------------------ //
    // Queries                                                            //
    // ------------------------------------------------------------------ //

    public static Map<String, Object> query(StoreQuery query) {
        if (query instanceof StoreQuery.MatchAll) {
            return Map.of("match_all", Map.of());
        }
        if (query instanceof StoreQuery.Term term) {
            return Map.of("term", Map.of(term.field(), term.value()));
        }
        if (query instanceof StoreQuery.Terms terms) {
            return Map.of("terms", Map.of(terms.field(), terms.values()));
        }
        if (query instanceof StoreQuery.GreaterThan range) {
            return Map.of("range", Map.of(range.field(), Map.of("gt", range.value())));
        }
        if (query instanceof StoreQuery.Exists exists) {
            return Map.of("exists", Map.of("field", exists.field()));
        }
        if (query instanceof StoreQuery.Not not) {
            return Map.of("bool", Map.of("must_not", List.of(query(not.query()))));
        }
        if (query instanceof StoreQuery.And and) {
            return Map.of("bool", Map.of("filter", and.queries().stream().map(ElasticsearchRequests::query).toList()));
        }
        if (query instanceof StoreQuery.Or or) {
            return Map.of("bool", Map.of(
                    "should", or.queries().stream().map(ElasticsearchRequests::query).toList(),
                    "minimum_should_match", 1));
        }
        throw new IllegalArgumentException("Unsupported query " + query);
    }

    public static Map<String, Object> searchBody(StoreQuery query, int size) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", size);
        body.put("query", query(query));
        return body;
    }

    public static Map<String, Object> scanBody(ScanRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("size", request.getPageSize());
        body.put("query", query(request.getQuery()));
        body.put("sort", List.of("_doc"));
        if (!request.getSourceFields().isEmpty()) {
            body.put("_source", request.getSourceFields());
        }
        if (request.getSlice() != null) {
            body.put("slice", Map.of("id", request.getSlice().id(), "max", request.getSlice().max()));
        }
        return body;
    }

    public static Map<String, Object> scrollBody(String scrollId, Duration keepAlive) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scroll", keepAlive(keepAlive));
        body.put("scroll_id", scrollId);
        return body;
    }

    public static String keepAlive(Duration keepAlive) {
        return keepAlive.toSeconds() + "s";
    }

    public static Map<String, Object> tuningBody(IndexTuning tuning) {
        Map<String, Object> index = new LinkedHashMap<>();
        index.put("refresh_interval", tuning.refreshInterval());
        index.put("number_of_replicas", tuning.numberOfReplicas());
        index.put("translog.durability", tuning.translogDurability());
        return Map.of("index", index);
    }

    // ------------------------------------------------------------------ //
    // Bulk                                                               //
    // ------------------------------------------------------------------ //

    /**
     * Newline-delimited bulk body; every line, including the last, ends with {@code \n}.
     */
    public static String bulkBody(List<BulkOperation> operations, ObjectMapper mapper) {
        StringBuilder sb = new StringBuilder();
        try {
            for (BulkOperation operation : operations) {
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put("_index", operation.getIndex());
                meta.put("_id", operation.getId());
                switch (operation.getType()) {
                    case INDEX -> appendLines(sb, mapper, Map.of("index", meta), operation.getDocument());
                    case CREATE -> appendLines(sb, mapper, Map.of("create", meta), operation.getDocument());
                    case UPDATE_DOC -> appendLines(sb, mapper, Map.of("update", meta), Map.of("doc", operation.getDocument()));
                    case SCRIPTED_UPSERT -> {
                        if (operation.getRetryOnConflict() > 0) {
                            meta.put("retry_on_conflict", operation.getRetryOnConflict());
                        }
                        appendLines(sb, mapper, Map.of("update", meta), scriptedUpsertBody(operation));
                    }
                    default -> throw new IllegalArgumentException("Unsupported bulk operation " + operation.getType());
                }
            }
        } catch (JsonProcessingException e) {
            throw new StoreException("Could not serialize bulk request: " + e.getOriginalMessage(), 400, e);
        }
        return sb.toString();
    }

    static Map<String, Object> scriptedUpsertBody(BulkOperation operation) {
        Map<String, Object> script = new LinkedHashMap<>();
        script.put("source", operation.getScript().painlessSource());
        script.put("lang", PAINLESS);
        script.put("params", operation.getParams());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("script", script);
        body.put("upsert", operation.getUpsert());
        return body;
    }

    private static void appendLines(StringBuilder sb, ObjectMapper mapper, Object action, Object source)
            throws JsonProcessingException {
        sb.append(mapper.writeValueAsString(action)).append('\n');
        sb.append(mapper.writeValueAsString(source)).append('\n');
    }

    /**
     * Per-item results in request order. Each item is keyed by its action name.
     */
    public static List<BulkItemResult> parseBulkResponse(JsonNode response) {
        List<BulkItemResult> results = new ArrayList<>();
        for (JsonNode item : response.path("items")) {
            Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
            if (!fields.hasNext()) {
                continue;
            }
            JsonNode result = fields.next().getValue();
            String index = result.path("_index").asText(null);
            String id = result.path("_id").asText(null);
            int status = result.path("status").asInt(StoreException.NO_RESPONSE);
            JsonNode error = result.get("error");
            if (error == null || error.isNull()) {
                results.add(BulkItemResult.ok(index, id, status));
            } else {
                results.add(BulkItemResult.failed(index, id, status,
                        error.path("type").asText(null), error.path("reason").asText(error.toString())));
            }
        }
        return results;
    }

    // ------------------------------------------------------------------ //
    // Search / settings responses                                        //
    // ------------------------------------------------------------------ //

    public static ScrollPage parseScrollPage(JsonNode response, ObjectMapper mapper) {
        return new ScrollPage(response.path("_scroll_id").asText(null), parseHits(response, mapper));
    }

    @SuppressWarnings("unchecked")
    public static List<ScanHit> parseHits(JsonNode response, ObjectMapper mapper) {
        List<ScanHit> hits = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            Map<String, Object> source = hit.has("_source")
                    ? mapper.convertValue(hit.get("_source"), Map.class)
                    : new LinkedHashMap<>();
            hits.add(new ScanHit(hit.path("_id").asText(), source));
        }
        return hits;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Map<String, Object>> parseMultiGet(JsonNode response, ObjectMapper mapper) {
        Map<String, Map<String, Object>> found = new LinkedHashMap<>();
        for (JsonNode doc : response.path("docs")) {
            if (doc.path("found").asBoolean(false)) {
                found.put(doc.path("_id").asText(), mapper.convertValue(doc.path("_source"), Map.class));
            }
        }
        return found;
    }

    /**
     * Reads the relaxed settings out of a {@code GET /<index>/_settings} response, falling back
     * to the store defaults for settings that were never set explicitly.
     */
    public static IndexTuning parseTuning(JsonNode response, String index) {
        JsonNode settings = response.path(index).path("settings").path("index");
        return new IndexTuning(
                settings.path("refresh_interval").asText(IndexTuning.DEFAULTS.refreshInterval()),
                settings.path("number_of_replicas").asText(IndexTuning.DEFAULTS.numberOfReplicas()),
                settings.path("translog").path("durability").asText(IndexTuning.DEFAULTS.translogDurability()));
    }
}
