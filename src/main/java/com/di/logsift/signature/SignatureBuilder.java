package com.di.logsift.signature;

import com.di.logsift.frame.GeneratedFrameLocator;
import com.di.logsift.normalize.PatternNormalizer;

import java.util.Optional;

/**
 * Assigns every log record exactly one (group type, signature) pair.
 *
 * <p>Priority, first match wins:
 * <ol>
 *   <li>custom rule found in the raw message (case-insensitive)</li>
 *   <li>CSP violation report</li>
 *   <li>generated-rule sequence</li>
 *   <li>normalized exception message</li>
 *   <li>normalized message</li>
 *   <li>logger name, or {@code "Unknown"}</li>
 * </ol>
 * Pure function of (record, rules).
 */
public final class SignatureBuilder {

    static final String UNKNOWN_LOGGER = "Unknown";

    private SignatureBuilder() {
    }

    public static GroupClassification classify(LogEvidence evidence, CompiledRules rules) {
        String message = nullToEmpty(evidence.getMessage());

        Optional<CompiledRules.CompiledRule> custom = rules.firstMatch(message);
        if (custom.isPresent()) {
            CompiledRules.CompiledRule rule = custom.get();
            return new GroupClassification(GroupType.CUSTOM_RULE, rule.groupTypeLabel(), rule.name());
        }

        Optional<String> csp = CspSignatureExtractor.extract(message);
        if (csp.isPresent()) {
            return GroupClassification.of(GroupType.CSP_VIOLATION, csp.get());
        }

        String sequence = sequenceSignature(evidence);
        if (!sequence.isEmpty()) {
            return GroupClassification.of(GroupType.RULE_SEQUENCE, sequence);
        }

        String exception = normalizedExceptionMessage(evidence);
        if (!exception.isEmpty()) {
            return GroupClassification.of(GroupType.EXCEPTION, exception);
        }

        String normalized = normalizedMessage(evidence);
        if (!normalized.isEmpty()) {
            return GroupClassification.of(GroupType.MESSAGE, normalized);
        }

        String logger = nullToEmpty(evidence.getLoggerName());
        return GroupClassification.of(GroupType.LOGGER, logger.isEmpty() ? UNKNOWN_LOGGER : logger);
    }

    static String sequenceSignature(LogEvidence evidence) {
        String summary = nullToEmpty(evidence.getSequenceSummary());
        if (!summary.isEmpty()) {
            return summary;
        }
        String stacktrace = evidence.getStacktrace();
        if (stacktrace == null || stacktrace.isEmpty()) {
            return "";
        }
        return GeneratedFrameLocator.summarize(GeneratedFrameLocator.locate(stacktrace));
    }

    public static String normalizedExceptionMessage(LogEvidence evidence) {
        String stored = nullToEmpty(evidence.getNormalizedExceptionMessage());
        return stored.isEmpty() ? nullToEmpty(PatternNormalizer.normalize(evidence.getExceptionMessage())) : stored;
    }

    public static String normalizedMessage(LogEvidence evidence) {
        String stored = nullToEmpty(evidence.getNormalizedMessage());
        return stored.isEmpty() ? nullToEmpty(PatternNormalizer.normalize(evidence.getMessage())) : stored;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
