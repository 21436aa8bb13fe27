package com.di.logsift.group;

import com.di.logsift.signature.GroupClassification;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records accumulated between two flushes, keyed by group id.
 */
final class GroupBatch {

    private final int maxSignatures;
    private final Map<String, GroupBatchEntry> entries = new LinkedHashMap<>();
    private int records;

    GroupBatch(int maxSignatures) {
        this.maxSignatures = maxSignatures;
    }

    GroupBatchEntry entryFor(GroupClassification classification) {
        records++;
        return entries.computeIfAbsent(classification.groupId(), id -> new GroupBatchEntry(classification, maxSignatures));
    }

    int records() {
        return records;
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    Collection<GroupBatchEntry> entries() {
        return entries.values();
    }

    void clear() {
        entries.clear();
        records = 0;
    }
}
