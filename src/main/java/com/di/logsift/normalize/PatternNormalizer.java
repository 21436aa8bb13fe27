package com.di.logsift.normalize;

import java.util.List;

/**
 * Turns a raw log message into a canonical pattern string by replacing variable substrings
 * (indices, dates, identifiers, paths, URL parameters, object references, hex literals)
 * with fixed placeholders.
 *
 * <p>The rule list is applied strictly in order. Specific shapes (RFC dates, UUIDs, JSON ids,
 * case ids) come before the generic catch-alls (6+ digit numbers, file paths, query values),
 * and no rule matches a placeholder produced by an earlier one, so
 * {@code normalize(normalize(x)).equals(normalize(x))}.
 *
 * <p>Output length is not capped; see {@link #normalizeCapped(String, int)}.
 */
public final class PatternNormalizer {

    public static final String DATE = "[DATE]";
    public static final String UUID = "[UUID]";
    public static final String CASE_ID = "[CASE_ID]";
    public static final String ID = "[ID]";
    public static final String FILE_PATH = "[FILE_PATH]";

    private static final List<NormalizationRule> RULES = List.of(
            // (1) numeric indices
            NormalizationRule.of("paren-index", "\\((\\d+)\\)", "(*)"),
            NormalizationRule.of("bracket-index", "\\[(\\d+)\\]", "[*]"),

            // (2) timestamps
            NormalizationRule.of("http-date",
                    "(?:Mon|Tue|Wed|Thu|Fri|Sat|Sun),\\s+\\d{1,2}\\s+"
                            + "(?:Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)\\s+\\d{4}\\s+"
                            + "\\d{2}:\\d{2}:\\d{2}\\s+(?:GMT|UTC|EST|EDT|PST|PDT|[A-Z]{2,4})\\b",
                    DATE),
            NormalizationRule.of("iso-timestamp",
                    "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:\\d{2})?", DATE),
            NormalizationRule.of("iso-date", "\\d{4}-\\d{2}-\\d{2}", DATE),
            NormalizationRule.of("us-date", "\\d{2}/\\d{2}/\\d{4}", DATE),

            // (3)
            NormalizationRule.of("uuid",
                    "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}", UUID),

            // (4)
            NormalizationRule.of("json-id", "\"id\"\\s*:\\s*\"[A-Za-z0-9]{10,}\"", "\"id\":\"[JSON_ID]\""),

            // (5) CO-19577, PEGA-12
            NormalizationRule.of("case-id", "[A-Z]+-\\d+", CASE_ID),

            // (6)
            NormalizationRule.of("long-number", "\\b\\d{6,}\\b", ID),

            // (7) and (8)
            NormalizationRule.of("email", "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,}\\b", "[EMAIL]"),
            NormalizationRule.of("ipv4", "\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b", "[IP]"),

            // (9)
            NormalizationRule.of("windows-path", "[A-Za-z]:\\\\[^\\s<>\"|?*]+", FILE_PATH),
            NormalizationRule.of("unix-path", "/[^\\s<>\"|?*]{2,}", FILE_PATH),

            // (10) URL query strings, fixed sub-order
            NormalizationRule.of("session-segment", "/[A-Za-z0-9_-]{15,}\\*/", "/[SESSION_ID]*/"),
            NormalizationRule.of("hex-param", "([?&])([a-zA-Z_]+)=[A-Fa-f0-9]{20,}", "$1$2=[HEX_ID]"),
            NormalizationRule.of("long-param", "([?&])([a-zA-Z_]+)=[A-Za-z0-9]{15,}", "$1$2=[LONG_ID]"),
            NormalizationRule.of("numeric-param", "([?&])([a-zA-Z_]+)=\\d{5,}", "$1$2=[NUM_PARAM]"),
            NormalizationRule.of("encoded-param", "([?&])([a-zA-Z_]+)=%[0-9A-Fa-f]{2,}[^\\s&]*", "$1$2=[ENCODED_PARAM]"),
            NormalizationRule.of("query-value",
                    "([?&])([a-zA-Z_]+)=(?!(?:true|false|1|0|yes|no)(?=[&\\s]|$))([A-Za-z0-9_-]+)(?=[&\\s]|$)",
                    "$1$2=[QUERY_VALUE]"),
            NormalizationRule.of("query-string", "(https?://[^\\s?]+)\\?\\S+", "$1?[QUERY_PARAMS]"),

            // (11) Identifier@hex, at least 4 hex digits so e-mail local parts are not taken
            NormalizationRule.of("object-ref", "[A-Za-z0-9_$\\[\\];.]+@[0-9a-fA-F]{4,}\\b", "[OBJECT_REF]"),

            // (12)
            NormalizationRule.of("hex-literal", "\\b0x[0-9a-fA-F]+\\b", "[HEX]")
    );

    private PatternNormalizer() {
    }

    /**
     * Normalizes {@code text}. Null and empty input are returned unchanged.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (NormalizationRule rule : RULES) {
            result = rule.apply(result);
        }
        return result;
    }

    /**
     * Normalizes and truncates to {@code maxLength} characters.
     */
    public static String normalizeCapped(String text, int maxLength) {
        return truncate(normalize(text), maxLength);
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }

    /** Rule names in application order. */
    public static List<String> ruleNames() {
        return RULES.stream().map(NormalizationRule::name).toList();
    }
}
