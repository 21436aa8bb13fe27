package com.di.logsift.frame;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the ordered list of generated rules a stack trace passed through.
 *
 * <p>Accepts either a newline separated Java stack trace or a pipe delimited single line
 * (the stored {@code sequence_summary} form). Every frame is tried against four shapes of the
 * generated class path, first match wins:
 * <ol>
 *   <li>dotted: {@code <ns>.<type>.ra_action_<name>[_hash].<method>}</li>
 *   <li>arrow: {@code <ns>.<type>->ra_action_<name>->}</li>
 *   <li>container: {@code <ns>.<type>.ra_<container>_<name>.}</li>
 *   <li>type-less: {@code <ns>.<Name>_<digits>.}, reported with type {@code NA}</li>
 * </ol>
 * Results are deduplicated on (type, class, name) keeping first-seen order.
 */
public final class StackFrameParser {

    public static final String GENERATED_NAMESPACE = "com.pegarules.generated";

    private static final String NS = Pattern.quote(GENERATED_NAMESPACE);

    private static final Pattern DOTTED_ACTION =
            Pattern.compile(NS + "\\.(\\w+)\\.ra_action_(\\w+)(?:_[a-f0-9]+)?\\.");
    private static final Pattern ARROW_ACTION =
            Pattern.compile(NS + "\\.(\\w+)->ra_action_(\\w+)->");
    private static final Pattern CONTAINER_RULE =
            Pattern.compile(NS + "\\.(\\w+)\\.ra_[a-z]+_(.+?)\\.");
    private static final Pattern TYPELESS_CLASS =
            Pattern.compile(NS + "\\.([A-Za-z]\\w+?)(?:_[0-9_]+)\\.");
    private static final Pattern TRAILING_DIGITS = Pattern.compile("_\\d+.*$");

    private StackFrameParser() {
    }

    public static List<RuleFrame> extractFrames(String stacktrace) {
        if (stacktrace == null || stacktrace.isBlank()) {
            return List.of();
        }
        List<RuleFrame> frames = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String line : splitFrames(stacktrace)) {
            RuleFrame frame = parseFrame(line);
            if (frame != null && seen.add(frame.dedupKey())) {
                frames.add(frame);
            }
        }
        return frames;
    }

    static String[] splitFrames(String stacktrace) {
        if (stacktrace.indexOf('|') >= 0 && stacktrace.indexOf('\n') < 0) {
            return stacktrace.split("\\|");
        }
        return stacktrace.split("\n");
    }

    /**
     * Parses one frame line; returns {@code null} when no generated rule is referenced.
     */
    static RuleFrame parseFrame(String rawLine) {
        String line = rawLine.strip();
        if (line.startsWith("at ")) {
            line = line.substring(3).strip();
        }
        if (!line.contains(GENERATED_NAMESPACE)) {
            return null;
        }

        String type = null;
        String name = null;

        Matcher m = DOTTED_ACTION.matcher(line);
        if (m.find()) {
            type = m.group(1);
            name = RuleNameSplitter.cleanRuleName(m.group(2));
        }
        if (type == null && (m = ARROW_ACTION.matcher(line)).find()) {
            type = m.group(1);
            name = RuleNameSplitter.cleanRuleName(m.group(2));
        }
        if (type == null && (m = CONTAINER_RULE.matcher(line)).find()) {
            type = m.group(1);
            name = RuleNameSplitter.cleanRuleName(m.group(2));
        }
        if (type == null && (m = TYPELESS_CLASS.matcher(line)).find()) {
            type = RuleFrame.ABSENT;
            name = TRAILING_DIGITS.matcher(m.group(1)).replaceAll("");
        }

        if (type == null || name == null || name.isEmpty()) {
            return null;
        }
        String[] classAndName = RuleNameSplitter.splitClassAndName(name);
        return new RuleFrame(type, classAndName[0], classAndName[1]);
    }

    /**
     * Aligned, one-per-line rendering used by the rule export and log output.
     */
    public static String format(List<RuleFrame> frames) {
        if (frames.isEmpty()) {
            return "";
        }
        int typeWidth = frames.stream().mapToInt(f -> f.type().length()).max().orElse(0);
        StringBuilder sb = new StringBuilder();
        for (RuleFrame frame : frames) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            String paddedType = String.format("%-" + typeWidth + "s", frame.type());
            if (frame.hasClass()) {
                sb.append(paddedType).append(" (").append(frame.className()).append(") ->   ").append(frame.name());
            } else {
                sb.append(paddedType).append("    ->   ").append(frame.name());
            }
        }
        return sb.toString();
    }
}
