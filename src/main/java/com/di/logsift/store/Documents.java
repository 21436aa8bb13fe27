package com.di.logsift.store;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for documents held as nested {@code Map}/{@code List} trees.
 */
public final class Documents {

    private Documents() {
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepCopy(Map<String, Object> source) {
        if (source == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, copyValue(value)));
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return deepCopy((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return copy;
        }
        return value;
    }

    /** Recursive merge of {@code partial} into {@code target}, as a partial document update does. */
    @SuppressWarnings("unchecked")
    public static void merge(Map<String, Object> target, Map<String, Object> partial) {
        partial.forEach((key, value) -> {
            Object existing = target.get(key);
            if (existing instanceof Map<?, ?> existingMap && value instanceof Map<?, ?> valueMap) {
                merge((Map<String, Object>) existingMap, (Map<String, Object>) valueMap);
            } else {
                target.put(key, copyValue(value));
            }
        });
    }

    /** Keeps only the listed dotted paths; an empty list keeps everything. */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> project(Map<String, Object> source, List<String> fields) {
        if (fields == null || fields.isEmpty()) {
            return deepCopy(source);
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String field : fields) {
            Object value = StoreQuery.fieldValue(source, field);
            if (value == null) {
                continue;
            }
            String[] parts = field.split("\\.");
            Map<String, Object> cursor = projected;
            for (int i = 0; i < parts.length - 1; i++) {
                cursor = (Map<String, Object>) cursor.computeIfAbsent(parts[i], k -> new LinkedHashMap<String, Object>());
            }
            cursor.put(parts[parts.length - 1], copyValue(value));
        }
        return projected;
    }

    public static String string(Map<String, Object> source, String field) {
        Object value = StoreQuery.fieldValue(source, field);
        return value == null ? null : value.toString();
    }

    public static long longValue(Map<String, Object> source, String field) {
        Object value = StoreQuery.fieldValue(source, field);
        return value instanceof Number n ? n.longValue() : 0L;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> list(Map<String, Object> source, String field) {
        Object value = StoreQuery.fieldValue(source, field);
        return value instanceof List<?> list ? (List<Object>) list : List.of();
    }
}
