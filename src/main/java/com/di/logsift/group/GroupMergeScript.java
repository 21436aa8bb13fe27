package com.di.logsift.group;

import com.di.logsift.store.MergeScript;
import com.di.logsift.util.Timestamps;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The single merge every group update goes through.
 *
 * <ul>
 *   <li>{@code count += params.inc}</li>
 *   <li>{@code last_seen = max}, {@code first_seen = min}</li>
 *   <li>{@code raw_log_ids}, {@code exception_signatures}, {@code message_signatures}: dedup-append
 *       up to {@code params.max_ids} / {@code params.max_sigs}</li>
 *   <li>{@code rules} and {@code rule_count}: set once</li>
 *   <li>{@code representative_log}: replaced when {@code params.last_seen} is not older than the
 *       stored {@code last_seen}</li>
 * </ul>
 * {@code diagnosis}, {@code comments} and {@code audit_history} are never touched. Applying two
 * merges in either order yields the same count, timestamps and set contents.
 *
 * <p>Timestamps compare as strings; they are stored in a fixed-width UTC form.
 */
public final class GroupMergeScript implements MergeScript {

    public static final GroupMergeScript INSTANCE = new GroupMergeScript();

    static final String SOURCE = """
            def src = ctx._source;
            if (src.count == null) { src.count = 0; }
            if (src.raw_log_ids == null) { src.raw_log_ids = []; }
            if (src.exception_signatures == null) { src.exception_signatures = []; }
            if (src.message_signatures == null) { src.message_signatures = []; }

            src.count += params.inc;

            if (params.last_seen != null) {
              if (src.last_seen == null || params.last_seen.compareTo(src.last_seen) >= 0) {
                src.representative_log = params.rep_log;
              }
              if (src.last_seen == null || params.last_seen.compareTo(src.last_seen) > 0) {
                src.last_seen = params.last_seen;
              }
            }
            if (params.first_seen != null) {
              if (src.first_seen == null || params.first_seen.compareTo(src.first_seen) < 0) {
                src.first_seen = params.first_seen;
              }
            }

            for (def item : params.new_ids) {
              if (src.raw_log_ids.size() < params.max_ids && !src.raw_log_ids.contains(item)) { src.raw_log_ids.add(item); }
            }
            for (def item : params.new_exc_sigs) {
              if (src.exception_signatures.size() < params.max_sigs && !src.exception_signatures.contains(item)) { src.exception_signatures.add(item); }
            }
            for (def item : params.new_msg_sigs) {
              if (src.message_signatures.size() < params.max_sigs && !src.message_signatures.contains(item)) { src.message_signatures.add(item); }
            }

            if (params.new_rules != null && params.new_rules.size() > 0 && (src.rules == null || src.rules.size() == 0)) {
              src.rules = params.new_rules;
              src.rule_count = params.new_rule_count;
            }
            """;

    private GroupMergeScript() {
    }

    @Override
    public String painlessSource() {
        return SOURCE;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void apply(Map<String, Object> source, Map<String, Object> params) {
        source.put("count", asLong(source.get("count")) + asLong(params.get("inc")));

        String lastSeen = (String) params.get("last_seen");
        if (lastSeen != null) {
            String stored = (String) source.get("last_seen");
            if (stored == null || lastSeen.compareTo(stored) >= 0) {
                source.put("representative_log", params.get("rep_log"));
            }
            source.put("last_seen", Timestamps.max(stored, lastSeen));
        }
        String firstSeen = (String) params.get("first_seen");
        if (firstSeen != null) {
            source.put("first_seen", Timestamps.min((String) source.get("first_seen"), firstSeen));
        }

        int maxIds = (int) asLong(params.get("max_ids"));
        int maxSigs = (int) asLong(params.get("max_sigs"));
        appendCapped(source, "raw_log_ids", (List<Object>) params.get("new_ids"), maxIds);
        appendCapped(source, "exception_signatures", (List<Object>) params.get("new_exc_sigs"), maxSigs);
        appendCapped(source, "message_signatures", (List<Object>) params.get("new_msg_sigs"), maxSigs);

        List<Object> newRules = (List<Object>) params.get("new_rules");
        Object storedRules = source.get("rules");
        boolean rulesEmpty = !(storedRules instanceof List<?> list) || list.isEmpty();
        if (newRules != null && !newRules.isEmpty() && rulesEmpty) {
            source.put("rules", new ArrayList<>(newRules));
            source.put("rule_count", params.get("new_rule_count"));
        }
    }

    @SuppressWarnings("unchecked")
    private static void appendCapped(Map<String, Object> source, String field, List<Object> items, int cap) {
        Object stored = source.get(field);
        List<Object> values = stored instanceof List<?> list ? (List<Object>) list : new ArrayList<>();
        if (!(values instanceof ArrayList<?>)) {
            values = new ArrayList<>(values);
        }
        if (items != null) {
            for (Object item : items) {
                if (values.size() < cap && !values.contains(item)) {
                    values.add(item);
                }
            }
        }
        source.put(field, values);
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
