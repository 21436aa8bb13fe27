package com.di.logsift.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;

/**
 * Propagates SLF4J MDC ({@code runId}, {@code sliceId}) to bulk worker threads so their log
 * lines carry the same run correlation as the submitting thread.
 * <p>
 * Usage: {@code CompletableFuture.runAsync(MdcPropagation.wrapRunnable(() -> send(chunk)), pool);}
 */
public final class MdcPropagation {

    public static final String RUN_ID = "runId";
    public static final String SLICE_ID = "sliceId";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration of
     * the task and removes it in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Copy of the current thread's MDC; never null.
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
