package com.di.logsift.signature;

/**
 * Classification outcome families, in the order the classifier tries them.
 * {@link #label()} is the value stored in {@code group_type}.
 */
public enum GroupType {
    CUSTOM_RULE("Custom"),
    CSP_VIOLATION("CSP Violation"),
    RULE_SEQUENCE("RuleSequence"),
    EXCEPTION("Exception"),
    MESSAGE("Message"),
    LOGGER("Logger"),
    UNANALYZED("Unanalyzed");

    private final String label;

    GroupType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static GroupType fromLabel(String label) {
        if (label == null) {
            return UNANALYZED;
        }
        for (GroupType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        return label.startsWith(CUSTOM_RULE.label) ? CUSTOM_RULE : UNANALYZED;
    }
}
