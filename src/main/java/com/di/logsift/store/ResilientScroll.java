package com.di.logsift.store;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Iterates every hit of a scan, retrying the initial search and each continuation
 * independently when the store rate-limits (429). Any other failure, or a rate limit that
 * outlasts the retry policy, propagates as {@link StoreException}. Both steps share one
 * {@link Retry}, so each call gets the policy's full set of retries.
 *
 * <p>Closing clears the server-side scroll context.
 */
@Slf4j
public class ResilientScroll implements Iterator<ScanHit>, AutoCloseable {

    private final DocumentStore store;
    private final ScanRequest request;
    private final Retry retry;

    private String scrollId;
    private Iterator<ScanHit> page = List.<ScanHit>of().iterator();
    private boolean started;
    private boolean exhausted;
    private int rateLimitRetries;

    public ResilientScroll(DocumentStore store, ScanRequest request, RetryPolicy retryPolicy) {
        this.store = store;
        this.request = request;
        this.retry = retryPolicy.newRetry("scan-" + request.getIndex(),
                e -> e instanceof StoreException storeException && storeException.isRateLimited());
        this.retry.getEventPublisher().onRetry(event -> {
            rateLimitRetries++;
            log.warn("[SCAN] {} rate limited (429), retry {}/{} in {}ms", request.getIndex(),
                    event.getNumberOfRetryAttempts(), retryPolicy.getMaxRetries(), event.getWaitInterval().toMillis());
        });
    }

    @Override
    public boolean hasNext() {
        while (!page.hasNext() && !exhausted) {
            fetchNextPage();
        }
        return page.hasNext();
    }

    @Override
    public ScanHit next() {
        if (!hasNext()) {
            throw new NoSuchElementException("scan exhausted");
        }
        return page.next();
    }

    /** Total rate-limit retries across all pages of this scan. */
    public int getRateLimitRetries() {
        return rateLimitRetries;
    }

    private void fetchNextPage() {
        ScrollPage next;
        if (!started) {
            next = withRateLimitRetry(() -> store.openScroll(request));
            started = true;
        } else if (scrollId == null) {
            exhausted = true;
            return;
        } else {
            String current = scrollId;
            next = withRateLimitRetry(() -> store.continueScroll(current, request.getKeepAlive()));
        }
        if (next.scrollId() != null) {
            scrollId = next.scrollId();
        }
        if (next.isEmpty()) {
            exhausted = true;
        }
        page = next.hits().iterator();
    }

    private ScrollPage withRateLimitRetry(Supplier<ScrollPage> call) {
        return RetryPolicy.execute(retry, call);
    }

    @Override
    public void close() {
        if (scrollId == null) {
            return;
        }
        try {
            store.clearScroll(scrollId);
        } catch (StoreException e) {
            log.warn("[SCAN] could not clear scroll context: {}", e.getMessage());
        } finally {
            scrollId = null;
            exhausted = true;
        }
    }
}
