package com.di.logsift.ingest;

import com.di.logsift.frame.GeneratedFrame;
import com.di.logsift.frame.GeneratedFrameLocator;
import com.di.logsift.normalize.PatternNormalizer;
import com.di.logsift.util.ContentHash;
import com.di.logsift.util.Timestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Locale;

/**
 * Turns one raw input line into a {@link RawLogRecord}, or says why it was dropped.
 *
 * <p>Input lines are JSON objects. Fields are read from the top level first and then from the
 * nested {@code log} object: {@code @timestamp} / {@code log.timestamp}, {@code level} /
 * {@code log.level}, {@code log.message}, {@code log.logger_name}, {@code log.thread_name},
 * {@code log.app}, {@code log.exception.{exception_class, exception_message, stacktrace}} and
 * {@code log.stack}.
 */
public class LogLineParser {

    private final ObjectMapper objectMapper;
    private final List<String> admissionTokens;
    private final List<String> errorLevels;
    private final int maxNormalizedLength;

    public LogLineParser(ObjectMapper objectMapper, List<String> admissionTokens, List<String> errorLevels,
                         int maxNormalizedLength) {
        this.objectMapper = objectMapper;
        this.admissionTokens = List.copyOf(admissionTokens);
        this.errorLevels = errorLevels.stream().map(l -> l.toUpperCase(Locale.ROOT)).toList();
        this.maxNormalizedLength = maxNormalizedLength;
    }

    /**
     * @param fileName   source name that goes into the record id
     * @param lineNumber 1-based position of the line in its source, blank lines included
     */
    public LineOutcome parse(String fileName, long lineNumber, String rawLine, String sessionId) {
        String line = rawLine == null ? "" : rawLine.strip();
        if (line.isEmpty()) {
            return LineOutcome.blank();
        }
        if (!admitted(line)) {
            return LineOutcome.skipped();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            return LineOutcome.malformed("invalid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return LineOutcome.malformed("not a JSON object");
        }

        try {
            return extract(root, fileName, lineNumber, line, sessionId);
        } catch (RuntimeException e) {
            return LineOutcome.malformed("extraction failed: " + e);
        }
    }

    private boolean admitted(String line) {
        for (String token : admissionTokens) {
            if (line.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private LineOutcome extract(JsonNode root, String fileName, long lineNumber, String line, String sessionId) {
        JsonNode log = root.path("log");
        JsonNode exception = log.path("exception");

        String stackTrace = firstText(exception.path("stacktrace"), log.path("stack"));
        String level = firstText(root.path("level"), log.path("level"));
        level = level == null ? "" : level.toUpperCase(Locale.ROOT);

        boolean isError = errorLevels.stream().anyMatch(level::contains);
        boolean hasException = stackTrace != null || log.has("exception");
        if (!isError && !hasException) {
            return LineOutcome.skipped();
        }

        String message = stripped(firstText(log.path("message"), root.path("message")));
        String exceptionClass = stripped(text(exception.path("exception_class")));
        String exceptionMessage = stripped(text(exception.path("exception_message")));
        if (exceptionMessage.isEmpty()) {
            exceptionMessage = message;
        }

        String eventTimestamp = firstText(root.path("@timestamp"), log.path("timestamp"));
        String ingestionTimestamp = Timestamps.normalize(eventTimestamp).orElseGet(Timestamps::now);

        RawLogRecord.RawLogRecordBuilder record = RawLogRecord.builder()
                .timestamp(eventTimestamp)
                .level(level)
                .loggerName(firstText(log.path("logger_name"), root.path("logger_name")))
                .threadName(firstText(log.path("thread_name"), root.path("thread_name")))
                .app(firstText(log.path("app"), root.path("app")))
                .message(message)
                .exceptionClass(exceptionClass)
                .exceptionMessage(exceptionMessage)
                .normalizedMessage(PatternNormalizer.normalizeCapped(message, maxNormalizedLength))
                .normalizedExceptionMessage(PatternNormalizer.normalizeCapped(exceptionMessage, maxNormalizedLength))
                .sequenceSummary("")
                .sessionId(sessionId)
                .ingestionTimestamp(ingestionTimestamp)
                .fileName(fileName);

        if (stackTrace != null) {
            List<GeneratedFrame> frames = GeneratedFrameLocator.locate(stackTrace);
            record.sequenceSummary(GeneratedFrameLocator.summarize(frames))
                    .generatedRuleLinesFound(frames.size())
                    .totalLinesInStack((int) stackTrace.lines().count())
                    .inputLength(stackTrace.length());
        }

        return LineOutcome.accepted(ContentHash.rawLogId(fileName, lineNumber, line), record.build());
    }

    private static String firstText(JsonNode... candidates) {
        for (JsonNode node : candidates) {
            String value = text(node);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static String stripped(String value) {
        return value == null ? "" : value.strip();
    }
}
