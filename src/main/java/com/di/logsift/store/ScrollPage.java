package com.di.logsift.store;

import java.util.List;

/**
 * One page of a scroll. An empty {@link #hits()} list marks the end of the scan.
 */
public record ScrollPage(String scrollId, List<ScanHit> hits) {

    public boolean isEmpty() {
        return hits.isEmpty();
    }
}
