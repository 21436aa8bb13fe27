package com.di.logsift.frame;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Locates generated-rule frames in a raw stack trace and renders the flattened
 * {@code sequence_summary} stored on every raw log record.
 *
 * <p>Occurrences with a {@code (File.java:N)} suffix are found first; bare occurrences are
 * added only when they start at least 50 characters away from an already found one. When
 * neither pass finds anything parsable the trace is parsed line by line.
 */
public final class GeneratedFrameLocator {

    public static final String SUMMARY_DELIMITER = " | ";

    private static final String NS = Pattern.quote(StackFrameParser.GENERATED_NAMESPACE);
    private static final Pattern WITH_SOURCE = Pattern.compile(NS + "[^\\s(]+\\.\\w+\\s*\\([^)]*\\)");
    private static final Pattern BARE = Pattern.compile(NS + "\\S+\\.\\w+");
    private static final Pattern HASH_SUFFIX = Pattern.compile("_[0-9a-fA-F]{32}$");
    private static final int NEAR_DUPLICATE_DISTANCE = 50;

    private GeneratedFrameLocator() {
    }

    public static List<GeneratedFrame> locate(String stackTrace) {
        if (stackTrace == null || stackTrace.isEmpty()) {
            return List.of();
        }
        List<Occurrence> found = new ArrayList<>();
        Matcher m = WITH_SOURCE.matcher(stackTrace);
        while (m.find()) {
            found.add(new Occurrence(lineNumberAt(stackTrace, m.start()), m.start(), m.group()));
        }
        m = BARE.matcher(stackTrace);
        while (m.find()) {
            int start = m.start();
            boolean nearExisting = found.stream().anyMatch(o -> Math.abs(start - o.position) < NEAR_DUPLICATE_DISTANCE);
            if (!nearExisting) {
                found.add(new Occurrence(lineNumberAt(stackTrace, start), start, m.group()));
            }
        }
        found.sort(Comparator.comparingInt(o -> o.position));

        List<GeneratedFrame> frames = new ArrayList<>();
        for (Occurrence occurrence : found) {
            addParsed(frames, occurrence.text, occurrence.lineNumber);
        }
        if (frames.isEmpty()) {
            String[] lines = stackTrace.split("\\R");
            for (int i = 0; i < lines.length; i++) {
                if (!lines[i].isBlank()) {
                    addParsed(frames, lines[i], i + 1);
                }
            }
        }
        return frames;
    }

    public static String summarize(List<GeneratedFrame> frames) {
        return frames.stream().map(GeneratedFrame::summaryEntry).collect(Collectors.joining(SUMMARY_DELIMITER));
    }

    private static void addParsed(List<GeneratedFrame> frames, String text, int lineNumber) {
        String line = text.strip();
        if (line.startsWith("at ")) {
            line = line.substring(3).strip();
        }
        GeneratedFrame.GeneratedFrameBuilder parsed = parseLine(line);
        if (parsed != null) {
            frames.add(parsed.sequenceOrder(frames.size() + 1).lineNumber(lineNumber).build());
        }
    }

    /**
     * Splits one line into generated class, invoked function, rule type and rule.
     * Returns {@code null} when the line does not reference a generated class.
     */
    static GeneratedFrame.GeneratedFrameBuilder parseLine(String rawLine) {
        String line = rawLine.strip();
        int start = line.indexOf(StackFrameParser.GENERATED_NAMESPACE);
        if (start < 0) {
            return null;
        }
        String relevant = line.substring(start);
        int paren = relevant.indexOf('(');

        String classGenerated;
        String functionInvoked;
        if (paren < 0) {
            int lastDot = relevant.lastIndexOf('.');
            if (lastDot < 0) {
                return null;
            }
            String methodPart = relevant.substring(lastDot + 1).strip();
            functionInvoked = methodPart.isEmpty() ? "" : methodPart.split("\\s+")[0];
            classGenerated = relevant.substring(0, lastDot);
        } else {
            String beforeParen = relevant.substring(0, paren).strip();
            int lastDot = beforeParen.lastIndexOf('.');
            if (lastDot < 0) {
                return null;
            }
            classGenerated = beforeParen.substring(0, lastDot);
            functionInvoked = beforeParen.substring(lastDot + 1).strip();
        }

        int lastDotInClass = classGenerated.lastIndexOf('.');
        String typeOfRule = lastDotInClass < 0 ? "" : classGenerated.substring(0, lastDotInClass);
        String ruleGenerated = lastDotInClass < 0 ? classGenerated : classGenerated.substring(lastDotInClass + 1);

        return GeneratedFrame.builder()
                .typeOfRule(typeOfRule)
                .ruleGenerated(HASH_SUFFIX.matcher(ruleGenerated).replaceAll(""))
                .functionInvoked(functionInvoked)
                .classGenerated(HASH_SUFFIX.matcher(classGenerated).replaceAll(""))
                .classNameInParens(classNameInParens(relevant, paren));
    }

    private static String classNameInParens(String relevant, int paren) {
        if (paren < 0 || paren >= relevant.length() - 1) {
            return "";
        }
        int close = relevant.indexOf(')', paren + 1);
        if (close <= paren) {
            return "";
        }
        String content = relevant.substring(paren + 1, close).strip();
        if (content.contains(".java:")) {
            return content.substring(0, content.indexOf(".java:")).strip();
        }
        if (content.contains(":")) {
            return content.substring(0, content.indexOf(':')).strip();
        }
        return content;
    }

    private static int lineNumberAt(String text, int position) {
        int line = 1;
        for (int i = 0; i < position; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    private record Occurrence(int lineNumber, int position, String text) {
    }
}
