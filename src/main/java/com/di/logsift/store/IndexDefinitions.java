package com.di.logsift.store;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Settings and mappings for the indices the pipeline creates on first use.
 */
@Slf4j
public final class IndexDefinitions {

    private IndexDefinitions() {
    }

    /**
     * Creates {@code index} unless it exists. Losing a creation race to another worker
     * (400 already exists) counts as success.
     *
     * @return {@code true} when this call created the index
     */
    public static boolean ensureIndex(DocumentStore store, String index, Map<String, Object> body) {
        if (store.indexExists(index)) {
            return false;
        }
        try {
            store.createIndex(index, body);
            return true;
        } catch (StoreException e) {
            if (e.getStatus() == 400 && store.indexExists(index)) {
                log.debug("[STORE] index {} created concurrently by another worker", index);
                return false;
            }
            throw e;
        }
    }

    public static Map<String, Object> rawLogs() {
        return Map.of(
                "settings", Map.of("number_of_shards", 3, "number_of_replicas", 0, "refresh_interval", "1s"),
                "mappings", Map.of("properties", Map.ofEntries(
                        Map.entry("timestamp", keyword()),
                        Map.entry("level", keyword()),
                        Map.entry("logger_name", keyword()),
                        Map.entry("thread_name", keyword()),
                        Map.entry("app", keyword()),
                        Map.entry("message", Map.of("type", "text")),
                        Map.entry("exception_class", keyword()),
                        Map.entry("exception_message", Map.of("type", "text")),
                        Map.entry("normalized_exception_message", keyword()),
                        Map.entry("normalized_message", keyword()),
                        Map.entry("generated_rule_lines_found", Map.of("type", "integer")),
                        Map.entry("total_lines_in_stack", Map.of("type", "integer")),
                        Map.entry("input_length", Map.of("type", "integer")),
                        Map.entry("sequence_summary", Map.of("type", "text", "index", false)),
                        Map.entry("session_id", keyword()),
                        Map.entry("ingestion_timestamp", date()),
                        Map.entry("file_name", keyword()))));
    }

    public static Map<String, Object> groups() {
        return Map.of("mappings", Map.of("properties", Map.of(
                "group_signature", Map.of("type", "text"),
                "group_type", keyword(),
                "first_seen", date(),
                "last_seen", date(),
                "count", Map.of("type", "long"),
                "raw_log_ids", keyword(),
                "exception_signatures", keyword(),
                "message_signatures", keyword(),
                "diagnosis", Map.of("properties", Map.of("status", keyword())))));
    }

    public static Map<String, Object> groupMembers() {
        return Map.of("mappings", Map.of("properties", Map.of(
                "group_id", keyword(),
                "raw_log_id", keyword(),
                "state", keyword(),
                "counted_at", date())));
    }

    public static Map<String, Object> checkpoint() {
        return Map.of("mappings", Map.of("properties", Map.of(
                "last_processed_timestamp", date(),
                "updated_at", date())));
    }

    public static Map<String, Object> customPatterns() {
        return Map.of("mappings", Map.of("properties", Map.of(
                "name", keyword(),
                "pattern", keyword(),
                "group_type", keyword(),
                "created_at", date())));
    }

    private static Map<String, Object> keyword() {
        return Map.of("type", "keyword");
    }

    private static Map<String, Object> date() {
        return Map.of("type", "date");
    }
}
