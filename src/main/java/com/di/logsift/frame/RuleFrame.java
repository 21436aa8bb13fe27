package com.di.logsift.frame;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One structural execution step extracted from a stack trace.
 *
 * @param type      rule type segment of the generated class path ({@code "NA"} for type-less frames)
 * @param className owning class, or {@code "NA"} when no class could be split off
 * @param name      rule name with hash and numeric suffixes removed
 */
public record RuleFrame(@JsonProperty("type") String type,
                        @JsonProperty("class") String className,
                        @JsonProperty("name") String name) {

    public static final String ABSENT = "NA";

    String dedupKey() {
        return type + "_" + className + "_" + name;
    }

    public boolean hasClass() {
        return !ABSENT.equals(className);
    }
}
