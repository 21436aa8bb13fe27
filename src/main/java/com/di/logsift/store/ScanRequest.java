package com.di.logsift.store;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class ScanRequest {
    String index;
    @Builder.Default
    StoreQuery query = StoreQuery.matchAll();
    /** Source fields to return; empty returns the whole document. */
    @Singular
    List<String> sourceFields;
    @Builder.Default
    int pageSize = 500;
    @Builder.Default
    Duration keepAlive = Duration.ofMinutes(30);
    /** {@code null} scans the whole index. */
    Slice slice;
}
