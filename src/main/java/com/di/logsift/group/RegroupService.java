package com.di.logsift.group;

import com.di.logsift.aspect.LogTransaction;
import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.RetryPolicy;
import com.di.logsift.store.StoreConnector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Rebuilds all groups from scratch: back up user-owned group state, drop the group index and the
 * membership ledger, regroup every raw record ignoring the checkpoint, restore the state.
 */
@Slf4j
@Service
public class RegroupService {

    private final DocumentStore store;
    private final LogSiftProperties properties;
    private final GroupingAggregator aggregator;
    private final SliceWorkerLauncher launcher;

    public RegroupService(DocumentStore store, LogSiftProperties properties, GroupingAggregator aggregator,
                          SliceWorkerLauncher launcher) {
        this.store = store;
        this.properties = properties;
        this.aggregator = aggregator;
        this.launcher = launcher;
    }

    /**
     * @param aggregation     result of an in-process rebuild, {@code null} for a sliced one
     * @param workerExitCodes exit code per slice worker, empty for an in-process rebuild
     */
    public record RegroupResult(int backedUp, int restored, AggregationResult aggregation, List<Integer> workerExitCodes) {

        public boolean workersSucceeded() {
            return workerExitCodes.stream().allMatch(code -> code == 0);
        }
    }

    @LogTransaction(eventType = "LOG_REGROUP", transactionContext = "log_grouping", includeResult = true)
    public RegroupResult regroup(AggregationRequest request) {
        if (request.isSliced()) {
            throw new IllegalArgumentException("Clearing the group index cannot be combined with a slice");
        }
        GroupStateBackup backup = clear();
        AggregationResult aggregation = aggregator.aggregate(request.toBuilder().ignoreCheckpoint(true).build());
        return new RegroupResult(backup.size(), restore(backup), aggregation, List.of());
    }

    /**
     * Same as {@link #regroup} with the rebuild done by {@code workers} slice processes.
     */
    @LogTransaction(eventType = "LOG_REGROUP", transactionContext = "log_grouping", includeResult = true)
    public RegroupResult regroupSliced(AggregationRequest request, int workers) throws IOException, InterruptedException {
        GroupStateBackup backup = clear();
        List<Integer> exitCodes = launcher.launch(workers, request.toBuilder().ignoreCheckpoint(true).slice(null).build());
        return new RegroupResult(backup.size(), restore(backup), null, exitCodes);
    }

    private GroupStateBackup clear() {
        LogSiftProperties.Indices indices = properties.getIndices();
        LogSiftProperties.Grouping settings = properties.getGrouping();
        StoreConnector.waitForConnection(store, properties.getStore().getConnectMaxRetries(),
                properties.getStore().getConnectRetryDelay());

        GroupStateBackup backup = GroupStateBackup.capture(store, indices.getGroups(),
                RetryPolicy.of(settings.getScanMaxRetries(), settings.getScanInitialBackoff(), settings.getScanMaxBackoff()));

        log.info("[REGROUP] deleting {} and {}", indices.getGroups(), indices.getGroupMembers());
        store.deleteIndex(indices.getGroups());
        store.deleteIndex(indices.getGroupMembers());
        return backup;
    }

    private int restore(GroupStateBackup backup) {
        String groups = properties.getIndices().getGroups();
        if (!store.indexExists(groups)) {
            log.warn("[REGROUP] {} was not recreated, {} backed-up group state(s) not restored", groups, backup.size());
            return 0;
        }
        store.refresh(groups);
        return backup.restore(store, groups);
    }
}
