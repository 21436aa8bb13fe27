package com.di.logsift.frame;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Heuristics that turn a generated rule identifier such as
 * {@code pds_fw_denovo_checklist_settasktime} into a (class, rule name) pair.
 *
 * <p>Each step is a separate static method so every branch can be tested on its own.
 */
public final class RuleNameSplitter {

    static final List<String> ACTION_SUFFIXES = List.of(
            "update", "create", "delete", "save", "process", "validate", "check",
            "load", "fetch", "retrieve", "send", "calc", "calculate", "notify",
            "execute", "perform", "run", "open", "close", "add", "remove", "get", "set");

    static final Set<String> NON_CLASS_PREFIXES = Set.of(
            "get", "set", "py", "px", "pz", "step", "my", "test", "ra",
            "action", "stream", "model", "do", "call", "invoke", "create",
            "update", "delete", "save", "validate", "check", "na");

    private static final Pattern HASH_SUFFIX = Pattern.compile("_[a-f0-9]{32,}.*$");
    private static final Pattern NUMERIC_SUFFIX = Pattern.compile("_\\d{10,}$");
    private static final Pattern INNER_CLASS_SUFFIX = Pattern.compile("\\$\\d+.*$");

    private static final int SHORT_NAME_LENGTH = 4;

    private RuleNameSplitter() {
    }

    /**
     * Removes a 32+ hex hash suffix (and anything after it), a {@code $N} inner-class suffix
     * and a trailing run of 10+ digits.
     */
    public static String cleanRuleName(String ruleName) {
        String cleaned = HASH_SUFFIX.matcher(ruleName).replaceAll("");
        cleaned = INNER_CLASS_SUFFIX.matcher(cleaned).replaceAll("");
        return NUMERIC_SUFFIX.matcher(cleaned).replaceAll("");
    }

    /**
     * Splits a cleaned identifier into class and rule name.
     *
     * @return two-element array {@code [class, name]}; class is {@link RuleFrame#ABSENT} when none applies
     */
    public static String[] splitClassAndName(String identifier) {
        int split = identifier.lastIndexOf('_');
        if (split < 0) {
            return new String[]{RuleFrame.ABSENT, identifier};
        }
        String classCandidate = identifier.substring(0, split);
        String nameCandidate = identifier.substring(split + 1);

        if (nameCandidate.length() <= SHORT_NAME_LENGTH && classCandidate.indexOf('_') >= 0) {
            int verbSplit = classCandidate.lastIndexOf('_');
            String verbToken = classCandidate.substring(verbSplit + 1);
            if (endsWithActionVerb(verbToken)) {
                classCandidate = classCandidate.substring(0, verbSplit);
                nameCandidate = verbToken + "_" + nameCandidate;
            }
        }

        if (isNonClassPrefix(classCandidate)) {
            return new String[]{RuleFrame.ABSENT, identifier};
        }
        return new String[]{classCandidate, nameCandidate};
    }

    static boolean endsWithActionVerb(String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        for (String suffix : ACTION_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    static boolean isNonClassPrefix(String classCandidate) {
        return NON_CLASS_PREFIXES.contains(classCandidate.toLowerCase(Locale.ROOT));
    }
}
