package com.di.logsift.group;

import com.di.logsift.frame.RuleFrame;
import com.di.logsift.signature.GroupClassification;
import com.di.logsift.signature.GroupType;
import com.di.logsift.util.Timestamps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory accumulation for one group within one batch.
 *
 * <p>Every member id is kept (they feed the membership ledger); the signature sets are capped as
 * they are in the stored group.
 */
final class GroupBatchEntry {

    private final String groupId;
    private final GroupClassification classification;
    private final int maxSignatures;

    private final Set<String> memberIds = new LinkedHashSet<>();
    private final Set<String> exceptionSignatures = new LinkedHashSet<>();
    private final Set<String> messageSignatures = new LinkedHashSet<>();
    private String firstSeen;
    private String lastSeen;
    private RepresentativeLog representativeLog;
    private List<RuleFrame> rules = List.of();

    GroupBatchEntry(GroupClassification classification, int maxSignatures) {
        this.groupId = classification.groupId();
        this.classification = classification;
        this.maxSignatures = maxSignatures;
    }

    void add(String rawLogId, String timestamp, String exceptionSignature, String messageSignature,
             RepresentativeLog candidate) {
        memberIds.add(rawLogId);
        if (representativeLog == null || (timestamp != null && (lastSeen == null || timestamp.compareTo(lastSeen) > 0))) {
            representativeLog = candidate;
        }
        lastSeen = Timestamps.max(lastSeen, timestamp);
        firstSeen = Timestamps.min(firstSeen, timestamp);
        addCapped(exceptionSignatures, exceptionSignature);
        addCapped(messageSignatures, messageSignature);
    }

    boolean needsRules() {
        return classification.type() == GroupType.RULE_SEQUENCE && rules.isEmpty();
    }

    void setRules(List<RuleFrame> extracted) {
        this.rules = List.copyOf(extracted);
    }

    private void addCapped(Set<String> target, String value) {
        if (value != null && !value.isEmpty() && target.size() < maxSignatures) {
            target.add(value);
        }
    }

    String groupId() {
        return groupId;
    }

    GroupClassification classification() {
        return classification;
    }

    Set<String> memberIds() {
        return Collections.unmodifiableSet(memberIds);
    }

    String firstSeen() {
        return firstSeen;
    }

    String lastSeen() {
        return lastSeen;
    }

    List<Map<String, Object>> ruleDocuments() {
        List<Map<String, Object>> documents = new ArrayList<>(rules.size());
        for (RuleFrame rule : rules) {
            Map<String, Object> document = new LinkedHashMap<>();
            document.put("type", rule.type());
            document.put("class", rule.className());
            document.put("name", rule.name());
            documents.add(document);
        }
        return documents;
    }

    /**
     * Parameters of the merge script.
     *
     * @param increment memberships this flush counted for the first time
     */
    Map<String, Object> mergeParams(long increment, int maxRawLogIds) {
        List<String> sampleIds = memberIds.stream().limit(maxRawLogIds).toList();
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("inc", increment);
        params.put("first_seen", firstSeen);
        params.put("last_seen", lastSeen);
        params.put("new_ids", new ArrayList<>(sampleIds));
        params.put("new_exc_sigs", new ArrayList<>(exceptionSignatures));
        params.put("new_msg_sigs", new ArrayList<>(messageSignatures));
        params.put("rep_log", representativeLog.toDocument());
        params.put("new_rules", ruleDocuments());
        params.put("new_rule_count", rules.size());
        params.put("max_ids", maxRawLogIds);
        params.put("max_sigs", maxSignatures);
        return params;
    }

    /** Full document stored when the group does not exist yet. */
    Map<String, Object> upsertDocument(long increment, int maxRawLogIds) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("group_signature", classification.signature());
        document.put("group_type", classification.typeLabel());
        document.put("first_seen", firstSeen);
        document.put("last_seen", lastSeen);
        document.put("count", increment);
        document.put("raw_log_ids", new ArrayList<>(memberIds.stream().limit(maxRawLogIds).toList()));
        document.put("exception_signatures", new ArrayList<>(exceptionSignatures));
        document.put("message_signatures", new ArrayList<>(messageSignatures));
        document.put("representative_log", representativeLog.toDocument());
        document.put("rules", ruleDocuments());
        document.put("rule_count", rules.size());
        Map<String, Object> diagnosis = new LinkedHashMap<>();
        diagnosis.put("status", DiagnosisStatus.PENDING.name());
        document.put("diagnosis", diagnosis);
        return document;
    }
}
