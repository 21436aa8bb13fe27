package com.di.logsift.group;

import com.di.logsift.store.Slice;
import lombok.Builder;
import lombok.Value;

/**
 * Parameters of one grouping run.
 */
@Value
@Builder(toBuilder = true)
public class AggregationRequest {
    /** Maximum records to process; {@code null} for no limit. */
    Integer limit;
    /** Records per flush; {@code null} uses {@code logsift.grouping.batch-size}. */
    Integer batchSize;
    boolean ignoreCheckpoint;
    /** Only records of this ingestion session; disables the checkpoint filter. */
    String sessionId;
    /** {@code null} scans everything; a slice never advances the checkpoint. */
    Slice slice;

    public static AggregationRequest defaults() {
        return AggregationRequest.builder().build();
    }

    public boolean isSliced() {
        return slice != null;
    }
}
