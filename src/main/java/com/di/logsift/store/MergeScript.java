package com.di.logsift.store;

import java.util.Map;

/**
 * A partial update executed next to the stored document.
 *
 * <p>The remote store runs {@link #painlessSource()}; the in-memory store runs {@link #apply}.
 * Both must produce the same document for the same (source, params).
 */
public interface MergeScript {

    String painlessSource();

    /** Mutates {@code source} in place. */
    void apply(Map<String, Object> source, Map<String, Object> params);
}
