package com.di.logsift.ingest;

import com.di.logsift.signature.LogEvidence;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One admitted log line as stored in the raw-log index (snake_case field names).
 *
 * <p>The raw stack trace is never stored; only the values extracted from it
 * ({@link #sequenceSummary}, frame and line counts) are kept.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RawLogRecord {

    /** Event timestamp exactly as it appeared in the input. */
    private String timestamp;
    /** Upper-cased. */
    private String level;
    private String loggerName;
    private String threadName;
    private String app;
    private String message;
    private String exceptionClass;
    private String exceptionMessage;
    private String normalizedMessage;
    private String normalizedExceptionMessage;
    private String sequenceSummary;
    private int generatedRuleLinesFound;
    private int totalLinesInStack;
    private int inputLength;
    private String sessionId;
    /** Event timestamp in stored form, or the ingestion wall clock when it is missing or unreadable. */
    private String ingestionTimestamp;
    private String fileName;

    public LogEvidence toEvidence() {
        return LogEvidence.builder()
                .message(message)
                .exceptionMessage(exceptionMessage)
                .normalizedMessage(normalizedMessage)
                .normalizedExceptionMessage(normalizedExceptionMessage)
                .loggerName(loggerName)
                .sequenceSummary(sequenceSummary)
                .build();
    }
}
