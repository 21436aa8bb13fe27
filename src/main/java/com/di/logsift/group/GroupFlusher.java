package com.di.logsift.group;

import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.store.BulkItemResult;
import com.di.logsift.store.BulkOperation;
import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.Documents;
import com.di.logsift.store.RetryPolicy;
import com.di.logsift.store.StoreException;
import com.di.logsift.store.StoreInterruptedException;
import com.di.logsift.util.ContentHash;
import com.di.logsift.util.MetricsCollector;
import com.di.logsift.util.Timestamps;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes one batch of group accumulations to the store.
 *
 * <ol>
 *   <li>Claims every (group, member) pair in the membership ledger with create-if-absent, in
 *       state {@code pending}. A 409 means an earlier flush claimed the pair; it counts again
 *       only if that claim is still {@code pending}, i.e. its group merge never went out. The
 *       rest are this flush's increment.</li>
 *   <li>Sends one scripted upsert per group through {@link GroupMergeScript}, chunk by chunk.</li>
 *   <li>Marks the claims of every sent chunk {@code counted}. A merge that failed is written to the
 *       {@link FailedGroupLog} with its increment first, so replaying it applies the count.</li>
 * </ol>
 * Failed merges never stop the next batch. An interrupt does: it surfaces as
 * {@link StoreInterruptedException} and leaves the unsent claims {@code pending} for the next run.
 */
@Slf4j
public class GroupFlusher {

    static final String PENDING = "pending";
    static final String COUNTED = "counted";

    private final DocumentStore store;
    private final LogSiftProperties.Grouping settings;
    private final String groupsIndex;
    private final String membersIndex;
    private final FailedGroupLog failedGroupLog;
    private final MetricsCollector metrics;
    private final Retry bulkRetry;

    public GroupFlusher(DocumentStore store, LogSiftProperties properties, FailedGroupLog failedGroupLog,
                        MetricsCollector metrics) {
        this.store = store;
        this.settings = properties.getGrouping();
        this.groupsIndex = properties.getIndices().getGroups();
        this.membersIndex = properties.getIndices().getGroupMembers();
        this.failedGroupLog = failedGroupLog;
        this.metrics = metrics;
        int attempts = Math.max(1, settings.getBulkRetries());
        this.bulkRetry = RetryPolicy.of(attempts - 1, settings.getBulkBackoff(), settings.getBulkBackoff().multipliedBy(attempts))
                .newRetry("group-bulk", e -> e instanceof StoreException storeException && storeException.isTransient());
        this.bulkRetry.getEventPublisher().onRetry(event -> log.warn("[GROUP] bulk attempt {}/{} failed ({}), retrying in {}ms",
                event.getNumberOfRetryAttempts(), attempts,
                event.getLastThrowable() == null ? "no error" : event.getLastThrowable().getMessage(),
                event.getWaitInterval().toMillis()));
    }

    public record FlushOutcome(int upserted, int failed, long newlyCounted) {

        public static final FlushOutcome EMPTY = new FlushOutcome(0, 0, 0);

        public FlushOutcome plus(FlushOutcome other) {
            return new FlushOutcome(upserted + other.upserted, failed + other.failed, newlyCounted + other.newlyCounted);
        }
    }

    /** Ledger document id of one (group, raw log) membership. */
    static String membershipId(String groupId, String rawLogId) {
        return ContentHash.md5Hex(groupId + ":" + rawLogId);
    }

    FlushOutcome flush(Collection<GroupBatchEntry> entries) {
        if (entries.isEmpty()) {
            return FlushOutcome.EMPTY;
        }
        long start = System.currentTimeMillis();
        Claims claims = claimMemberships(entries);

        List<BulkOperation> operations = new ArrayList<>(entries.size());
        long newlyCounted = 0;
        for (GroupBatchEntry entry : entries) {
            long increment = claims.increment(entry.groupId());
            newlyCounted += increment;
            operations.add(BulkOperation.scriptedUpsert(groupsIndex, entry.groupId(), GroupMergeScript.INSTANCE,
                    entry.mergeParams(increment, settings.getMaxRawLogIds()),
                    entry.upsertDocument(increment, settings.getMaxRawLogIds()),
                    settings.getRetryOnConflict()));
        }

        FlushOutcome sent = send(operations, claims);
        FlushOutcome outcome = new FlushOutcome(sent.upserted(), sent.failed(), newlyCounted);
        long durationMs = System.currentTimeMillis() - start;
        metrics.recordGroupFlush(outcome.upserted(), outcome.failed(), (int) newlyCounted, durationMs);
        log.info("[GROUP] flushed {} group(s): upserted={} failed={} newlyCounted={} ({}ms)",
                entries.size(), outcome.upserted(), outcome.failed(), newlyCounted, durationMs);
        return outcome;
    }

    /**
     * Sends scripted upserts in chunks; failures are written to the failed-groups log.
     * {@link FlushOutcome#newlyCounted()} is always 0 here.
     */
    public FlushOutcome send(List<BulkOperation> operations) {
        return send(operations, Claims.NONE);
    }

    private FlushOutcome send(List<BulkOperation> operations, Claims claims) {
        int upserted = 0;
        int failed = 0;
        for (List<BulkOperation> chunk : chunks(operations)) {
            List<FailedGroupAction> failures = new ArrayList<>();
            try {
                List<BulkItemResult> results = bulkWithRetry(chunk);
                for (int i = 0; i < results.size(); i++) {
                    BulkItemResult result = results.get(i);
                    if (result.isSuccess()) {
                        upserted++;
                    } else {
                        failures.add(FailedGroupAction.of(chunk.get(i), result.describeError()));
                    }
                }
            } catch (StoreException e) {
                log.error("[GROUP] bulk request of {} group update(s) failed: {}", chunk.size(), e.getMessage());
                chunk.forEach(op -> failures.add(FailedGroupAction.of(op, "status=" + e.getStatus() + " " + e.getMessage())));
            }
            if (!failures.isEmpty()) {
                log.warn("[GROUP] {} group update(s) failed, first: {} {}", failures.size(),
                        failures.get(0).id(), failures.get(0).error());
                failedGroupLog.append(failures);
                failed += failures.size();
            }
            confirm(chunk, claims);
        }
        return new FlushOutcome(upserted, failed, 0);
    }

    private Claims claimMemberships(Collection<GroupBatchEntry> entries) {
        String countedAt = Timestamps.now();
        List<BulkOperation> requests = new ArrayList<>();
        Map<String, String> groupOf = new HashMap<>();
        for (GroupBatchEntry entry : entries) {
            for (String memberId : entry.memberIds()) {
                String ledgerId = membershipId(entry.groupId(), memberId);
                Map<String, Object> membership = new LinkedHashMap<>();
                membership.put("group_id", entry.groupId());
                membership.put("raw_log_id", memberId);
                membership.put("state", PENDING);
                membership.put("counted_at", countedAt);
                requests.add(BulkOperation.create(membersIndex, ledgerId, membership));
                groupOf.put(ledgerId, entry.groupId());
            }
        }

        Claims claims = new Claims();
        List<String> conflicts = new ArrayList<>();
        int unconfirmed = 0;
        for (List<BulkOperation> chunk : chunks(requests)) {
            List<BulkItemResult> results;
            try {
                results = bulkWithRetry(chunk);
            } catch (StoreException e) {
                log.warn("[GROUP] membership claim request of {} id(s) failed: {}", chunk.size(), e.getMessage());
                unconfirmed += chunk.size();
                chunk.forEach(op -> claims.count(groupOf.get(op.getId()), null));
                continue;
            }
            for (int i = 0; i < results.size(); i++) {
                BulkItemResult result = results.get(i);
                String ledgerId = chunk.get(i).getId();
                if (result.isConflict()) {
                    conflicts.add(ledgerId);
                } else if (result.isSuccess()) {
                    claims.count(groupOf.get(ledgerId), ledgerId);
                } else {
                    unconfirmed++;
                    claims.count(groupOf.get(ledgerId), null);
                }
            }
        }
        if (unconfirmed > 0) {
            log.warn("[GROUP] {} membership claim(s) could not be confirmed and were counted as new", unconfirmed);
        }
        if (!conflicts.isEmpty()) {
            reclaimPending(conflicts, groupOf, claims);
        }
        return claims;
    }

    /**
     * Counts again the conflicting claims an earlier flush left {@code pending}: their group merge
     * was never sent.
     */
    private void reclaimPending(List<String> conflicts, Map<String, String> groupOf, Claims claims) {
        int reclaimed = 0;
        for (int from = 0; from < conflicts.size(); from += settings.getBulkChunkSize()) {
            List<String> ids = conflicts.subList(from, Math.min(from + settings.getBulkChunkSize(), conflicts.size()));
            Map<String, Map<String, Object>> existing;
            try {
                existing = RetryPolicy.execute(bulkRetry, () -> store.multiGet(membersIndex, ids, List.of("state")));
            } catch (StoreException e) {
                log.warn("[GROUP] could not read {} existing membership(s), treating them as counted: {}", ids.size(), e.getMessage());
                continue;
            }
            for (String ledgerId : ids) {
                Map<String, Object> membership = existing.get(ledgerId);
                if (membership != null && PENDING.equals(Documents.string(membership, "state"))) {
                    claims.count(groupOf.get(ledgerId), ledgerId);
                    reclaimed++;
                }
            }
        }
        if (reclaimed > 0) {
            log.info("[GROUP] {} membership(s) left pending by an earlier run counted again", reclaimed);
        }
    }

    private void confirm(List<BulkOperation> chunk, Claims claims) {
        List<BulkOperation> updates = new ArrayList<>();
        for (BulkOperation operation : chunk) {
            for (String ledgerId : claims.pending(operation.getId())) {
                updates.add(BulkOperation.updateDoc(membersIndex, ledgerId, Map.of("state", COUNTED)));
            }
        }
        int unconfirmed = 0;
        for (List<BulkOperation> part : chunks(updates)) {
            try {
                unconfirmed += (int) bulkWithRetry(part).stream().filter(result -> !result.isSuccess()).count();
            } catch (StoreException e) {
                unconfirmed += part.size();
            }
        }
        if (unconfirmed > 0) {
            log.warn("[GROUP] {} membership(s) stay pending and will be counted again by the next run", unconfirmed);
        }
    }

    /**
     * One bulk request, retried as a whole on transient failures.
     */
    List<BulkItemResult> bulkWithRetry(List<BulkOperation> operations) {
        return RetryPolicy.execute(bulkRetry, () -> store.bulk(operations));
    }

    private List<List<BulkOperation>> chunks(List<BulkOperation> operations) {
        List<List<BulkOperation>> chunks = new ArrayList<>();
        for (int from = 0; from < operations.size(); from += settings.getBulkChunkSize()) {
            chunks.add(operations.subList(from, Math.min(from + settings.getBulkChunkSize(), operations.size())));
        }
        return chunks;
    }

    /** Per group: how many memberships this flush counts, and which ledger claims await confirmation. */
    private static final class Claims {

        static final Claims NONE = new Claims();

        private final Map<String, Long> increments = new HashMap<>();
        private final Map<String, List<String>> pending = new HashMap<>();

        void count(String groupId, String ledgerId) {
            increments.merge(groupId, 1L, Long::sum);
            if (ledgerId != null) {
                pending.computeIfAbsent(groupId, k -> new ArrayList<>()).add(ledgerId);
            }
        }

        long increment(String groupId) {
            return increments.getOrDefault(groupId, 0L);
        }

        List<String> pending(String groupId) {
            return pending.getOrDefault(groupId, List.of());
        }
    }
}
