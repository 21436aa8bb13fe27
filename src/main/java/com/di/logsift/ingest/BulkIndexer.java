package com.di.logsift.ingest;

import com.di.logsift.config.LogSiftProperties;
import com.di.logsift.store.BulkItemResult;
import com.di.logsift.store.BulkOperation;
import com.di.logsift.store.DocumentStore;
import com.di.logsift.store.RetryPolicy;
import com.di.logsift.store.StoreException;
import com.di.logsift.util.MdcPropagation;
import com.di.logsift.util.MetricsCollector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Parallel bulk writer for one load.
 *
 * <h3>Chunking</h3>
 * Documents are grouped into chunks of at most {@code chunkSize} documents and
 * {@code maxChunkBytes} serialized bytes; each full chunk is one bulk request.
 *
 * <h3>Concurrency</h3>
 * A {@code FixedThreadPool(threadCount)} sends the chunks. A {@code Semaphore} of
 * {@code threadCount + queueSize} permits blocks {@link #add} while that many chunks are in
 * flight, so the reader never runs far ahead of the store.
 *
 * <h3>Failures</h3>
 * 409 counts as a duplicate. 429/5xx and connection failures go to an in-memory retry queue of at
 * most {@code maxRetryQueue} documents; documents beyond that go straight to the dead-letter
 * file. Other statuses are permanent failures and are never retried. {@link #finish()} resends the
 * queue in up to {@code maxRetries} rounds, with capped exponential backoff between rounds, and
 * dead-letters whatever is left.
 *
 * <p>Not reusable: create one per load and close it.
 */
@Slf4j
public class BulkIndexer implements AutoCloseable {

    private static final int LOGGED_PERMANENT_FAILURES = 5;
    private static final ThreadFactory THREAD_FACTORY = new ThreadFactory() {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "bulk-worker-" + sequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    };

    private final DocumentStore store;
    private final LogSiftProperties.Ingest settings;
    private final DeadLetterWriter deadLetterWriter;
    private final MetricsCollector metrics;
    private final ObjectMapper objectMapper;
    private final Retry retryDrain;

    private final ExecutorService executor;
    private final Semaphore inFlight;
    private final List<CompletableFuture<Void>> futures = new ArrayList<>();

    private final AtomicLong indexed = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong deadLettered = new AtomicLong();
    private final List<RawDocument> retryQueue = new ArrayList<>();

    private List<RawDocument> chunk = new ArrayList<>();
    private long chunkBytes;

    public BulkIndexer(DocumentStore store, LogSiftProperties.Ingest settings, DeadLetterWriter deadLetterWriter,
                       MetricsCollector metrics, ObjectMapper objectMapper) {
        this.store = store;
        this.settings = settings;
        this.deadLetterWriter = deadLetterWriter;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.retryDrain = RetryPolicy.of(Math.max(0, settings.getMaxRetries() - 1), settings.getInitialBackoff(), settings.getMaxBackoff())
                .newRetry("bulk-retry-drain", PendingDocumentsException.class::isInstance);
        this.retryDrain.getEventPublisher().onRetry(event -> log.info("[RETRY] {} document(s) still pending, next round in {}ms",
                event.getLastThrowable() instanceof PendingDocumentsException pending ? pending.remaining : 0,
                event.getWaitInterval().toMillis()));
        this.executor = Executors.newFixedThreadPool(settings.getThreadCount(), THREAD_FACTORY);
        this.inFlight = new Semaphore(settings.getThreadCount() + settings.getQueueSize());
    }

    public void add(RawDocument document) {
        long size = serializedSize(document);
        if (!chunk.isEmpty() && chunkBytes + size > settings.getMaxChunkBytes().toBytes()) {
            submitChunk();
        }
        chunk.add(document);
        chunkBytes += size;
        if (chunk.size() >= settings.getChunkSize()) {
            submitChunk();
        }
    }

    /**
     * Sends the last partial chunk, waits for every request, runs the retry rounds and
     * returns the final counts.
     */
    public BulkStats finish() {
        if (!chunk.isEmpty()) {
            submitChunk();
        }
        awaitInFlight();

        List<RawDocument> pending;
        synchronized (retryQueue) {
            pending = new ArrayList<>(retryQueue);
            retryQueue.clear();
        }
        if (!pending.isEmpty()) {
            pending = retry(pending);
            if (!pending.isEmpty()) {
                log.warn("[RETRY] {} document(s) failed permanently after {} retries", pending.size(), settings.getMaxRetries());
                deadLetter(pending);
            } else {
                log.info("[RETRY] all retried documents written");
            }
        }
        return new BulkStats(indexed.get(), duplicates.get(), failed.get(), deadLettered.get());
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private void submitChunk() {
        List<RawDocument> toSend = chunk;
        chunk = new ArrayList<>();
        chunkBytes = 0;
        try {
            inFlight.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a bulk worker", e);
        }
        CompletableFuture<Void> future = CompletableFuture
                .runAsync(MdcPropagation.wrapRunnable(() -> enqueueRetries(send(toSend))), executor)
                // keep allOf() waiting for every chunk, not just up to the first failure
                .exceptionally(ex -> {
                    log.error("[BULK] chunk of {} document(s) failed: {}", toSend.size(), ex.getMessage(), ex);
                    failed.addAndGet(toSend.size());
                    metrics.recordBulkOutcome(0, 0, toSend.size());
                    return null;
                })
                .whenComplete((ignored, ex) -> inFlight.release());
        futures.add(future);
    }

    private void awaitInFlight() {
        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Bulk execution error", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for bulk requests", e);
        } finally {
            futures.clear();
        }
    }

    /**
     * Sends one chunk and records its outcome.
     *
     * @return the documents that failed transiently
     */
    List<RawDocument> send(List<RawDocument> documents) {
        List<BulkOperation> operations = new ArrayList<>(documents.size());
        for (RawDocument document : documents) {
            operations.add(BulkOperation.index(document.index(), document.id(), document.source()));
        }

        List<BulkItemResult> results;
        long start = System.currentTimeMillis();
        try {
            results = store.bulk(operations);
        } catch (StoreException e) {
            if (e.isTransient()) {
                log.warn("[BULK] request of {} document(s) failed transiently (status {}): {}",
                        documents.size(), e.getStatus(), e.getMessage());
                return documents;
            }
            log.error("[BULK] request of {} document(s) rejected (status {}): {}", documents.size(), e.getStatus(), e.getMessage());
            failed.addAndGet(documents.size());
            metrics.recordBulkOutcome(0, 0, documents.size());
            return List.of();
        } finally {
            metrics.recordBulkRequest(documents.size(), System.currentTimeMillis() - start);
        }

        int ok = 0;
        int dup = 0;
        int permanent = 0;
        List<RawDocument> transientFailures = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            BulkItemResult result = results.get(i);
            if (result.isSuccess()) {
                ok++;
            } else if (result.isConflict()) {
                dup++;
            } else if (result.isTransientFailure()) {
                transientFailures.add(documents.get(i));
            } else {
                long total = failed.incrementAndGet();
                permanent++;
                if (total <= LOGGED_PERMANENT_FAILURES) {
                    log.error("[BULK] failed document {}: {}", result.id(), result.describeError());
                }
            }
        }
        indexed.addAndGet(ok);
        duplicates.addAndGet(dup);
        metrics.recordBulkOutcome(ok, dup, permanent);
        return transientFailures;
    }

    private void enqueueRetries(List<RawDocument> transientFailures) {
        if (transientFailures.isEmpty()) {
            return;
        }
        List<RawDocument> overflow = new ArrayList<>();
        synchronized (retryQueue) {
            for (RawDocument document : transientFailures) {
                if (retryQueue.size() < settings.getMaxRetryQueue()) {
                    retryQueue.add(document);
                } else {
                    overflow.add(document);
                }
            }
        }
        if (!overflow.isEmpty()) {
            log.warn("[RETRY] retry queue full ({}), spilling {} document(s) to disk", settings.getMaxRetryQueue(), overflow.size());
            deadLetter(overflow);
        }
    }

    private List<RawDocument> retry(List<RawDocument> documents) {
        if (settings.getMaxRetries() <= 0) {
            return documents;
        }
        AtomicInteger round = new AtomicInteger();
        AtomicReference<List<RawDocument>> remaining = new AtomicReference<>(documents);
        try {
            RetryPolicy.execute(retryDrain, () -> {
                List<RawDocument> current = remaining.get();
                metrics.recordRetryAttempt();
                log.info("[RETRY] attempt {}/{} for {} document(s)", round.incrementAndGet(), settings.getMaxRetries(), current.size());
                List<RawDocument> next = new ArrayList<>();
                for (int from = 0; from < current.size(); from += settings.getRetryChunkSize()) {
                    int to = Math.min(from + settings.getRetryChunkSize(), current.size());
                    next.addAll(send(current.subList(from, to)));
                }
                remaining.set(next);
                if (!next.isEmpty()) {
                    throw new PendingDocumentsException(next.size());
                }
                return Boolean.TRUE;
            });
        } catch (PendingDocumentsException e) {
            log.debug("[RETRY] retry rounds exhausted with {} document(s) pending", e.remaining);
        }
        return remaining.get();
    }

    /** A retry round ended with documents still failing transiently. */
    private static final class PendingDocumentsException extends RuntimeException {

        private final int remaining;

        PendingDocumentsException(int remaining) {
            super(remaining + " document(s) still pending", null, false, false);
            this.remaining = remaining;
        }
    }

    private void deadLetter(List<RawDocument> documents) {
        deadLetterWriter.append(documents);
        failed.addAndGet(documents.size());
        deadLettered.addAndGet(documents.size());
        metrics.recordDeadLetter(documents.size());
        metrics.recordBulkOutcome(0, 0, documents.size());
    }

    private long serializedSize(RawDocument document) {
        try {
            return objectMapper.writeValueAsBytes(document.source()).length;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document " + document.id() + " is not serializable", e);
        }
    }
}
