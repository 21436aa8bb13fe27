package com.di.logsift.signature;

import lombok.Builder;
import lombok.Value;

/**
 * The fields of one log record the classifier looks at.
 */
@Value
@Builder
public class LogEvidence {
    String message;
    String exceptionMessage;
    String normalizedMessage;
    String normalizedExceptionMessage;
    String loggerName;
    /** Stored {@code sequence_summary}; preferred over {@link #stacktrace} when present. */
    String sequenceSummary;
    /** Raw stack trace, only available before the record is stored. */
    String stacktrace;
}
