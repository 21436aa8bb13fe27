package com.di.logsift.signature;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Custom rules compiled once per run. Immutable; safe to share between threads.
 */
@Slf4j
public final class CompiledRules {

    private static final CompiledRules EMPTY = new CompiledRules(List.of());

    private final List<CompiledRule> rules;

    private CompiledRules(List<CompiledRule> rules) {
        this.rules = Collections.unmodifiableList(rules);
    }

    public static CompiledRules empty() {
        return EMPTY;
    }

    /**
     * Compiles rules case-insensitively in the given order. Rules whose pattern does not compile
     * are skipped with a warning.
     */
    public static CompiledRules compile(List<CustomPatternRule> definitions) {
        List<CompiledRule> compiled = new ArrayList<>(definitions.size());
        for (CustomPatternRule definition : definitions) {
            if (definition.name() == null || definition.pattern() == null) {
                log.warn("[RULES] skipping incomplete custom rule {}", definition);
                continue;
            }
            try {
                compiled.add(new CompiledRule(definition.name(), definition.effectiveGroupType(),
                        Pattern.compile(definition.pattern(), Pattern.CASE_INSENSITIVE)));
            } catch (PatternSyntaxException e) {
                log.warn("[RULES] skipping custom rule '{}': invalid pattern: {}", definition.name(), e.getDescription());
            }
        }
        return new CompiledRules(compiled);
    }

    /** First rule whose pattern is found anywhere in {@code message}. */
    public Optional<CompiledRule> firstMatch(String message) {
        if (message == null) {
            return Optional.empty();
        }
        for (CompiledRule rule : rules) {
            if (rule.pattern().matcher(message).find()) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return rules.size();
    }

    public record CompiledRule(String name, String declaredType, Pattern pattern) {

        /** {@code "Custom: <name>"} for plain custom rules, otherwise the declared type verbatim. */
        public String groupTypeLabel() {
            return GroupType.CUSTOM_RULE.label().equals(declaredType)
                    ? GroupType.CUSTOM_RULE.label() + ": " + name
                    : declaredType;
        }
    }
}
