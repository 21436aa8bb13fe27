package com.di.logsift.signature;

import com.di.logsift.util.ContentHash;

/**
 * Outcome of classifying one record.
 *
 * @param type      family that matched
 * @param typeLabel stored {@code group_type} value ({@code "Custom: <rule>"} for custom rules)
 * @param signature grouping key
 */
public record GroupClassification(GroupType type, String typeLabel, String signature) {

    public static GroupClassification of(GroupType type, String signature) {
        return new GroupClassification(type, type.label(), signature);
    }

    /** Lowercase hex MD5 of the UTF-8 signature. */
    public String groupId() {
        return ContentHash.md5Hex(signature);
    }
}
