package com.di.logsift.normalize;

import java.util.regex.Pattern;

/**
 * One ordered substitution applied by {@link PatternNormalizer}.
 *
 * @param name        short label used in diagnostics
 * @param pattern     compiled pattern
 * @param replacement {@link java.util.regex.Matcher#replaceAll(String)} replacement, group references allowed
 */
public record NormalizationRule(String name, Pattern pattern, String replacement) {

    static NormalizationRule of(String name, String regex, String replacement) {
        return new NormalizationRule(name, Pattern.compile(regex), replacement);
    }

    String apply(String text) {
        return pattern.matcher(text).replaceAll(replacement);
    }
}
