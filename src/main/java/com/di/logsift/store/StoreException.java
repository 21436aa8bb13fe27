package com.di.logsift.store;

import java.util.Set;

/**
 * Failure of a request against the document store.
 * {@link #getStatus()} is the HTTP status, or {@code 0} when no response was received.
 */
public class StoreException extends RuntimeException {

    public static final int NO_RESPONSE = 0;
    public static final int CONFLICT = 409;
    public static final int RATE_LIMITED = 429;
    static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final int status;

    public StoreException(String message, int status) {
        super(message);
        this.status = status;
    }

    public StoreException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    public boolean isRateLimited() {
        return status == RATE_LIMITED;
    }

    public boolean isConflict() {
        return status == CONFLICT;
    }

    /** Connection-level failures and 429/500/502/503/504. */
    public boolean isTransient() {
        return status == NO_RESPONSE || isTransientStatus(status);
    }

    public static boolean isTransientStatus(int status) {
        return TRANSIENT_STATUSES.contains(status);
    }
}
