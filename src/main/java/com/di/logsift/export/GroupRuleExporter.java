package com.di.logsift.export;

import com.di.logsift.aspect.LogTransaction;
import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.signature.GroupType;
import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.Documents;
import com.di.logsift.store.ResilientScroll;
import com.di.logsift.store.RetryPolicy;
import com.di.logsift.store.ScanHit;
import com.di.logsift.store.ScanRequest;
import com.di.logsift.store.StoreConnector;
import com.di.logsift.store.StoreQuery;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Exports {@code RuleSequence} groups as a JSON array without their volatile fields, each
 * enriched with the {@code app} of its representative raw record.
 */
@Slf4j
@Service
public class GroupRuleExporter {

    static final List<String> VOLATILE_FIELDS = List.of(
            "first_seen", "last_seen", "message_signatures", "count", "diagnosis", "raw_log_ids", "exception_signatures");
    static final int ENRICH_BATCH_SIZE = 100;

    private final DocumentStore store;
    private final LogSiftProperties properties;
    private final ObjectMapper objectMapper;

    public GroupRuleExporter(DocumentStore store, LogSiftProperties properties, ObjectMapper objectMapper) {
        this.store = store;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * @param limit maximum groups to export; {@code null} for all
     * @return number of groups written
     */
    @LogTransaction(eventType = "RULE_EXPORT", transactionContext = "rule_export",
            parameterNames = {"output", "limit"}, includeResult = true)
    public int export(Path output, Integer limit) throws IOException {
        StoreConnector.waitForConnection(store, properties.getStore().getConnectMaxRetries(),
                properties.getStore().getConnectRetryDelay());
        String groupsIndex = properties.getIndices().getGroups();
        List<Map<String, Object>> exported = new ArrayList<>();

        if (store.indexExists(groupsIndex)) {
            LogSiftProperties.Grouping settings = properties.getGrouping();
            ScanRequest scan = ScanRequest.builder()
                    .index(groupsIndex)
                    .query(StoreQuery.term("group_type", GroupType.RULE_SEQUENCE.label()))
                    .pageSize(settings.getScanPageSize())
                    .build();
            RetryPolicy retry = RetryPolicy.of(settings.getScanMaxRetries(), settings.getScanInitialBackoff(),
                    settings.getScanMaxBackoff());

            List<PendingGroup> pending = new ArrayList<>();
            try (ResilientScroll scroll = new ResilientScroll(store, scan, retry)) {
                while (scroll.hasNext() && (limit == null || exported.size() + pending.size() < limit)) {
                    ScanHit hit = scroll.next();
                    Map<String, Object> group = hit.source();
                    String sampleId = representativeId(group);
                    VOLATILE_FIELDS.forEach(group::remove);
                    if (sampleId == null) {
                        exported.add(group);
                        continue;
                    }
                    pending.add(new PendingGroup(group, sampleId));
                    if (pending.size() >= ENRICH_BATCH_SIZE) {
                        enrich(pending, exported);
                        pending.clear();
                        log.info("[EXPORT] processed {} group(s)", exported.size());
                    }
                }
            }
            enrich(pending, exported);
        } else {
            log.warn("[EXPORT] group index {} does not exist", groupsIndex);
        }

        objectMapper.writerWithDefaultPrettyPrinter().writeValue(output.toFile(), exported);
        log.info("[EXPORT] saved {} group(s) to {}", exported.size(), output);
        return exported.size();
    }

    private record PendingGroup(Map<String, Object> group, String sampleId) {
    }

    static String representativeId(Map<String, Object> group) {
        String sampleId = Documents.string(group, "representative_log.sample_log_id");
        if (sampleId != null) {
            return sampleId;
        }
        List<Object> ids = Documents.list(group, "raw_log_ids");
        return ids.isEmpty() ? null : String.valueOf(ids.get(0));
    }

    private void enrich(List<PendingGroup> pending, List<Map<String, Object>> exported) {
        if (pending.isEmpty()) {
            return;
        }
        List<String> ids = pending.stream().map(PendingGroup::sampleId).toList();
        Map<String, Map<String, Object>> records = store.multiGet(properties.getIndices().getRawLogs(), ids, List.of("app"));
        for (PendingGroup item : pending) {
            Map<String, Object> record = records.get(item.sampleId());
            String app = record == null ? null : Documents.string(record, "app");
            if (app != null) {
                item.group().put("app", app);
            }
            exported.add(item.group());
        }
    }
}
