package com.di.logsift.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Writes operation events as one JSON object per log line, prefixed {@code [TX] EVENT:}.
 *
 * <p>Each event carries the application instance id, the transaction id from MDC, the emitting
 * thread and an ISO-8601 timestamp.
 */
@Slf4j
@Component
public class TransactionEventLogger {

    private static final int STACK_SUMMARY_LINES = 5;

    private final String applicationId;
    private final ObjectMapper objectMapper;

    public TransactionEventLogger(@Value("${spring.application.name:logsift}") String applicationName,
                                  ObjectMapper objectMapper) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
        this.objectMapper = objectMapper;
        log.info("[TX] TransactionEventLogger initialized with applicationId: {}", applicationId);
    }

    public void logEvent(String eventType, Map<String, Object> context, String transactionId, String transactionContext) {
        logEvent(eventType, context, transactionId, transactionContext, null);
    }

    public void logEvent(String eventType, Map<String, Object> context, String transactionId,
                         String transactionContext, Throwable exception) {
        log.info("[TX] EVENT: {}", formatEvent(eventType, context, transactionId, transactionContext, exception));
    }

    String formatEvent(String eventType, Map<String, Object> context, String transactionId,
                       String transactionContext, Throwable exception) {
        Thread thread = Thread.currentThread();
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("applicationId", applicationId);
        event.put("transactionId", transactionId != null ? transactionId : "unknown");
        event.put("threadId", thread.getId());
        event.put("threadName", thread.getName());

        Map<String, Object> eventContext = context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>();
        if (transactionContext != null && !transactionContext.isEmpty()) {
            eventContext.put("transactionContext", transactionContext);
        }
        if (exception != null) {
            eventContext.put("stackTraceSummary", stackTraceSummary(exception));
        }
        if (!eventContext.isEmpty()) {
            event.put("context", eventContext);
        }

        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            return event.toString();
        }
    }

    /** First lines of the stack trace joined with {@code " | "}. */
    static String stackTraceSummary(Throwable exception) {
        StringWriter sw = new StringWriter();
        exception.printStackTrace(new PrintWriter(sw));
        String[] lines = sw.toString().split("\\R");
        StringBuilder summary = new StringBuilder();
        for (int i = 0; i < Math.min(STACK_SUMMARY_LINES, lines.length); i++) {
            if (i > 0) summary.append(" | ");
            summary.append(lines[i].trim());
        }
        if (lines.length > STACK_SUMMARY_LINES) {
            summary.append(" | ... (").append(lines.length - STACK_SUMMARY_LINES).append(" more lines)");
        }
        return summary.toString();
    }
}
