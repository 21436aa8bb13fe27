package com.di.logsift.store;

/**
 * The store could not be reached within the start-up connection policy. Aborts the run.
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message) {
        super(message, NO_RESPONSE);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, NO_RESPONSE, cause);
    }
}
