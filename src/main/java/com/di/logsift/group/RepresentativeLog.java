package com.di.logsift.group;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Display snapshot of the most recent record seen for a group.
 */
public record RepresentativeLog(String message, String exceptionMessage, String loggerName,
                                String sampleLogId, String timestamp) {

    public Map<String, Object> toDocument() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("message", message);
        document.put("exception_message", exceptionMessage);
        document.put("logger_name", loggerName);
        document.put("sample_log_id", sampleLogId);
        document.put("timestamp", timestamp);
        return document;
    }
}
