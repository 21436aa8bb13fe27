package com.di.logsift.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method for operation event logging by {@link TransactionEventAspect}:
 * {@code <eventType>_STARTED} before, {@code _COMPLETED} after, {@code _FAILED} with a
 * categorized error when it throws.
 *
 * <pre>
 * {@code
 * @LogTransaction(eventType = "LOG_INGEST", transactionContext = "raw_log_ingest",
 *                 parameterNames = {"sourceName"})
 * public IngestionResult ingest(String sourceName, Iterator<String> lines) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogTransaction {

    /** Event prefix, e.g. {@code "LOG_INGEST"}. */
    String eventType();

    String transactionContext() default "";

    /**
     * Names for the leading method arguments to include in the event. Empty includes every
     * argument of a simple type under its reflected name.
     */
    String[] parameterNames() default {};

    /** Adds the result's {@code toString()} to the completed event. */
    boolean includeResult() default false;

    /** MDC key holding the transaction id. */
    String transactionIdKey() default "runId";
}
