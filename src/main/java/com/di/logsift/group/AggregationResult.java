package com.di.logsift.group;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AggregationResult {
    String runId;
    long processed;
    long upserted;
    long failed;
    /** Records counted into a group for the first time. */
    long newlyCounted;
    int customRules;
    String checkpointBefore;
    String checkpointAfter;
    boolean checkpointUpdated;

    public String summary() {
        return String.format("processed=%d upserted=%d failed=%d newlyCounted=%d checkpoint=%s%s",
                processed, upserted, failed, newlyCounted, checkpointAfter,
                checkpointUpdated ? " (advanced)" : "");
    }
}
