package com.di.logsift.store;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Start-up connection check: up to {@code maxAttempts} pings with a fixed delay in between.
 */
@Slf4j
public final class StoreConnector {

    private StoreConnector() {
    }

    /**
     * @throws StoreUnavailableException when no ping succeeds within {@code maxAttempts} attempts
     */
    public static void waitForConnection(DocumentStore store, int maxAttempts, Duration delay) {
        int attempts = Math.max(1, maxAttempts);
        Retry retry = RetryPolicy.fixed(attempts - 1, delay).newRetry("store-connect", StoreException.class::isInstance);
        retry.getEventPublisher().onRetry(event -> log.warn("[CONNECT] store not reachable (attempt {}/{}), retrying in {}ms",
                event.getNumberOfRetryAttempts(), attempts, event.getWaitInterval().toMillis()));
        try {
            RetryPolicy.execute(retry, () -> {
                if (!store.ping()) {
                    throw new StoreException("store did not answer the ping", StoreException.NO_RESPONSE);
                }
                return Boolean.TRUE;
            });
        } catch (StoreException e) {
            throw new StoreUnavailableException("Document store not reachable after " + attempts + " attempts", e);
        }
        long retries = retry.getMetrics().getNumberOfSuccessfulCallsWithRetryAttempt();
        if (retries > 0) {
            log.info("[CONNECT] store reachable after retrying");
        }
    }
}
