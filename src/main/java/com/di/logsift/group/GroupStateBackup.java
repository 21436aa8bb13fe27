package com.di.logsift.group;

import com.di.logsift.store.BulkItemResult;
import com.di.logsift.store.BulkOperation;
import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.Documents;
import com.di.logsift.store.ResilientScroll;
import com.di.logsift.store.RetryPolicy;
import com.di.logsift.store.ScanHit;
import com.di.logsift.store.ScanRequest;
import com.di.logsift.store.StoreQuery;
import com.di.logsift.util.ContentHash;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Saves the user-owned part of groups ({@code diagnosis}, {@code comments},
 * {@code audit_history}) before the group index is rebuilt, keyed by group signature, and writes
 * it back onto the rebuilt groups.
 */
@Slf4j
public final class GroupStateBackup {

    static final List<String> OWNED_FIELDS = List.of("diagnosis", "comments", "audit_history");

    private final Map<String, Map<String, Object>> stateBySignature;

    private GroupStateBackup(Map<String, Map<String, Object>> stateBySignature) {
        this.stateBySignature = stateBySignature;
    }

    /**
     * Captures groups whose diagnosis moved past {@code PENDING} or that carry comments or audit
     * history. A missing index yields an empty backup.
     */
    public static GroupStateBackup capture(DocumentStore store, String groupsIndex, RetryPolicy scanRetry) {
        Map<String, Map<String, Object>> state = new LinkedHashMap<>();
        if (!store.indexExists(groupsIndex)) {
            return new GroupStateBackup(state);
        }
        ScanRequest scan = ScanRequest.builder()
                .index(groupsIndex)
                .query(StoreQuery.or(
                        StoreQuery.and(StoreQuery.exists("diagnosis.status"),
                                StoreQuery.not(StoreQuery.term("diagnosis.status", DiagnosisStatus.PENDING.name()))),
                        StoreQuery.exists("comments"),
                        StoreQuery.exists("audit_history")))
                .sourceField("group_signature")
                .sourceFields(OWNED_FIELDS)
                .build();
        try (ResilientScroll scroll = new ResilientScroll(store, scan, scanRetry)) {
            while (scroll.hasNext()) {
                ScanHit hit = scroll.next();
                String signature = Documents.string(hit.source(), "group_signature");
                if (signature != null && hasUserState(hit.source())) {
                    Map<String, Object> saved = new LinkedHashMap<>();
                    for (String field : OWNED_FIELDS) {
                        Object value = hit.source().get(field);
                        if (value != null) {
                            saved.put(field, value);
                        }
                    }
                    state.put(signature, saved);
                }
            }
        }
        log.info("[REGROUP] backed up state of {} group(s)", state.size());
        return new GroupStateBackup(state);
    }

    static boolean hasUserState(Map<String, Object> source) {
        String status = Documents.string(source, "diagnosis.status");
        if (status != null && !DiagnosisStatus.PENDING.name().equals(status)) {
            return true;
        }
        Object comments = source.get("comments");
        if (comments != null && !comments.toString().isBlank()) {
            return true;
        }
        return !Documents.list(source, "audit_history").isEmpty();
    }

    public int size() {
        return stateBySignature.size();
    }

    public Map<String, Map<String, Object>> asMap() {
        return Map.copyOf(stateBySignature);
    }

    /**
     * Writes the saved state onto groups whose signature reappeared.
     *
     * @return number of groups restored
     */
    public int restore(DocumentStore store, String groupsIndex) {
        if (stateBySignature.isEmpty()) {
            return 0;
        }
        List<BulkOperation> updates = new ArrayList<>(stateBySignature.size());
        stateBySignature.forEach((signature, saved) ->
                updates.add(BulkOperation.updateDoc(groupsIndex, ContentHash.md5Hex(signature), saved)));

        int restored = 0;
        int gone = 0;
        for (BulkItemResult result : store.bulk(updates)) {
            if (result.isSuccess()) {
                restored++;
            } else if (result.status() == 404) {
                gone++;
            } else {
                log.warn("[REGROUP] could not restore group {}: {}", result.id(), result.describeError());
            }
        }
        log.info("[REGROUP] restored {} group(s), {} signature(s) no longer present", restored, gone);
        return restored;
    }
}
