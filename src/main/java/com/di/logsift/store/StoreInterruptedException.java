package com.di.logsift.store;

/**
 * The calling thread was interrupted while waiting on the store or backing off between
 * attempts. Never retried and never counted as a per-chunk failure: the run stops.
 */
public class StoreInterruptedException extends RuntimeException {

    public StoreInterruptedException(String operation) {
        super("Interrupted during " + operation);
    }

    public StoreInterruptedException(String operation, Throwable cause) {
        super("Interrupted during " + operation, cause);
    }
}
