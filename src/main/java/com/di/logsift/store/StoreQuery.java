package com.di.logsift.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The small boolean query language the pipeline needs: term, terms, exclusive lower range,
 * exists, and boolean combinators. Field names use dotted paths into the stored document.
 */
public sealed interface StoreQuery {

    boolean matches(Map<String, Object> source);

    static StoreQuery matchAll() {
        return new MatchAll();
    }

    static StoreQuery term(String field, Object value) {
        return new Term(field, value);
    }

    static StoreQuery terms(String field, Collection<?> values) {
        return new Terms(field, List.copyOf(values));
    }

    static StoreQuery greaterThan(String field, String value) {
        return new GreaterThan(field, value);
    }

    static StoreQuery exists(String field) {
        return new Exists(field);
    }

    static StoreQuery not(StoreQuery query) {
        return new Not(query);
    }

    static StoreQuery and(StoreQuery... queries) {
        return new And(List.of(queries));
    }

    static StoreQuery and(List<StoreQuery> queries) {
        return new And(List.copyOf(queries));
    }

    static StoreQuery or(StoreQuery... queries) {
        return new Or(List.of(queries));
    }

    record MatchAll() implements StoreQuery {
        @Override
        public boolean matches(Map<String, Object> source) {
            return true;
        }
    }

    record Term(String field, Object value) implements StoreQuery {
        @Override
        public boolean matches(Map<String, Object> source) {
            Object actual = fieldValue(source, field);
            if (actual instanceof Collection<?> values) {
                return values.stream().anyMatch(v -> sameValue(v, value));
            }
            return sameValue(actual, value);
        }
    }

    record Terms(String field, List<?> values) implements StoreQuery {
        @Override
        public boolean matches(Map<String, Object> source) {
            return values.stream().anyMatch(v -> new Term(field, v).matches(source));
        }
    }

    /** Exclusive lower bound on a string-ordered field (stored timestamps). */
    record GreaterThan(String field, String value) implements StoreQuery {
        @Override
        public boolean matches(Map<String, Object> source) {
            Object actual = fieldValue(source, field);
            return actual != null && actual.toString().compareTo(value) > 0;
        }
    }

    record Exists(String field) implements StoreQuery {
        @Override
        public boolean matches(Map<String, Object> source) {
            Object actual = fieldValue(source, field);
            if (actual instanceof Collection<?> values) {
                return !values.isEmpty();
            }
            return actual != null;
        }
    }

    record Not(StoreQuery query) implements StoreQuery {
        @Override
        public boolean matches(Map<String, Object> source) {
            return !query.matches(source);
        }
    }

    record And(List<StoreQuery> queries) implements StoreQuery {
        @Override
        public boolean matches(Map<String, Object> source) {
            return queries.stream().allMatch(q -> q.matches(source));
        }
    }

    record Or(List<StoreQuery> queries) implements StoreQuery {
        @Override
        public boolean matches(Map<String, Object> source) {
            return queries.stream().anyMatch(q -> q.matches(source));
        }
    }

    /** Resolves {@code a.b.c} through nested maps; {@code null} when any step is missing. */
    static Object fieldValue(Map<String, Object> source, String path) {
        Object current = source;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(part);
        }
        return current;
    }

    private static boolean sameValue(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        return Objects.equals(actual, expected) || actual.toString().equals(expected.toString());
    }
}
