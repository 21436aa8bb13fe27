package com.di.logsift.frame;

import lombok.Builder;
import lombok.Value;

/**
 * A generated-rule frame as located in a raw stack trace at ingestion time.
 */
@Value
@Builder
public class GeneratedFrame {
    int sequenceOrder;
    int lineNumber;
    /** Package portion of the generated class, e.g. {@code com.pegarules.generated.activity}. */
    String typeOfRule;
    /** Simple class name with the 32-hex hash removed. */
    String ruleGenerated;
    String functionInvoked;
    /** Fully qualified generated class with the 32-hex hash removed. */
    String classGenerated;
    String classNameInParens;

    /** {@code <order>:<type>-><rule>-><function>-><class>} */
    public String summaryEntry() {
        return sequenceOrder + ":" + typeOfRule + "->" + ruleGenerated + "->" + functionInvoked + "->" + classGenerated;
    }
}
