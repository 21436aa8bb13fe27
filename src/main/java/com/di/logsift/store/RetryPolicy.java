package com.di.logsift.store;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retry settings for one kind of store call: up to {@code maxRetries} retries after the first
 * attempt, waiting {@code initialDelay * 2^n} in between, never more than {@code maxDelay}.
 * {@link #newRetry} turns the settings into a Resilience4j {@link Retry}.
 */
@Value
public class RetryPolicy {

    int maxRetries;
    Duration initialDelay;
    Duration maxDelay;

    public static RetryPolicy of(int maxRetries, Duration initialDelay, Duration maxDelay) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay);
    }

    /** Same delay before every retry. */
    public static RetryPolicy fixed(int maxRetries, Duration delay) {
        return new RetryPolicy(maxRetries, delay, delay);
    }

    public static RetryPolicy noDelay(int maxRetries) {
        return new RetryPolicy(maxRetries, Duration.ZERO, Duration.ZERO);
    }

    /**
     * A {@link Retry} named {@code name} that retries failures matching {@code retryOn} and
     * rethrows the last one once the retries are used up.
     */
    public Retry newRetry(String name, Predicate<Throwable> retryOn) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxRetries + 1)
                .intervalFunction(intervalFunction())
                .retryOnException(retryOn)
                .build();
        return Retry.of(name, config);
    }

    /** Wait before retry number {@code n}, 1-based. */
    IntervalFunction intervalFunction() {
        long initial = initialDelay.toMillis();
        long max = Math.max(initial, maxDelay.toMillis());
        if (initial <= 0) {
            return attempt -> 0L;
        }
        if (initial == max) {
            return IntervalFunction.of(initial);
        }
        return IntervalFunction.ofExponentialBackoff(initial, 2.0, max);
    }

    /**
     * Runs {@code call} through {@code retry}. An interrupt before an attempt or during a
     * backoff ends the call with {@link StoreInterruptedException}, whatever the last store
     * failure was; the interrupt flag stays set.
     */
    public static <T> T execute(Retry retry, Supplier<T> call) {
        Supplier<T> guarded = () -> {
            if (Thread.currentThread().isInterrupted()) {
                throw new StoreInterruptedException(retry.getName());
            }
            return call.get();
        };
        try {
            return retry.executeSupplier(guarded);
        } catch (StoreInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new StoreInterruptedException(retry.getName(), e);
            }
            throw e;
        }
    }
}
