package com.di.logsift.signature;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a stable signature for browser Content Security Policy violation reports.
 */
public final class CspSignatureExtractor {

    static final String MARKER = "A browser has reported a violation of your application's Content Security Policy";
    static final String UNKNOWN = "Unknown";

    private static final Pattern BLOCKED = Pattern.compile("Blocked Content Source:\\s*(.+)");
    private static final Pattern VIOLATED = Pattern.compile("Violated Directive:\\s*(.+)");
    private static final Pattern EFFECTIVE = Pattern.compile("Effective Directive:\\s*(.+)");

    private CspSignatureExtractor() {
    }

    public static boolean isCspViolation(String message) {
        return message != null && message.contains(MARKER);
    }

    /**
     * {@code CSP Violation | Blocked: <origin> | Violated: <directive> | Effective: <directive>},
     * or empty when the message is not a CSP report.
     */
    public static Optional<String> extract(String message) {
        if (!isCspViolation(message)) {
            return Optional.empty();
        }
        String blocked = truncateToOrigin(capture(BLOCKED, message));
        String violated = capture(VIOLATED, message);
        String effective = capture(EFFECTIVE, message);
        return Optional.of("CSP Violation | Blocked: " + blocked + " | Violated: " + violated + " | Effective: " + effective);
    }

    /** {@code https://fonts.example.com/s/a.woff} becomes {@code https://fonts.example.com}. */
    static String truncateToOrigin(String source) {
        if (!source.contains("://")) {
            return source;
        }
        String[] parts = source.split("/", -1);
        if (parts.length < 3) {
            return source;
        }
        return parts[0] + "/" + parts[1] + "/" + parts[2];
    }

    private static String capture(Pattern pattern, String message) {
        Matcher m = pattern.matcher(message);
        return m.find() ? m.group(1).strip() : UNKNOWN;
    }
}
