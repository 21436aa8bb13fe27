package com.di.logsift.runner;

import com.di.logsift.export.GroupRuleExporter;
import com.di.logsift.group.AggregationRequest;
import com.di.logsift.group.AggregationResult;
import com.di.logsift.group.CustomRuleRepository;
import com.di.logsift.group.FailedGroupReplayService;
import com.di.logsift.group.GroupingAggregator;
import com.di.logsift.group.RegroupService;
import com.di.logsift.group.SliceWorkerLauncher;
import com.di.logsift.ingest.DeadLetterReplayService;
import com.di.logsift.ingest.IngestionResult;
import com.di.logsift.ingest.IngestionService;
import com.di.logsift.store.Slice;
import com.di.logsift.store.StoreInterruptedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Dispatches one command from the command line and maps its outcome to an exit code.
 *
 * <pre>
 * ingest &lt;file&gt; [&lt;file&gt;...]
 * retry-dead-letter --file=&lt;path&gt; [--keep-file]
 * group [--limit=N] [--ignore-checkpoint] [--session-id=S] [--batch-size=N]
 *       [--workers=N] [--clear-index] [--slice-id=i --slice-max=N]
 * replay-failed-groups --file=&lt;path&gt; [--keep-file]
 * save-rule --name=&lt;n&gt; --pattern=&lt;regex&gt; [--group-type=Custom]
 * export-rules [--output=group_rule_sequences.json] [--limit=N]
 * </pre>
 */
@Slf4j
@Component
public class LogSiftCommandRunner {

    public static final int EXIT_OK = 0;
    /** The command ran but left work undone (failed writes, failed workers) or threw. */
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;

    static final String DEFAULT_EXPORT_FILE = "group_rule_sequences.json";

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  ingest <file> [<file>...]",
            "  retry-dead-letter --file=<path> [--keep-file]",
            "  group [--limit=N] [--ignore-checkpoint] [--session-id=S] [--batch-size=N]",
            "        [--workers=N] [--clear-index] [--slice-id=i --slice-max=N]",
            "  replay-failed-groups --file=<path> [--keep-file]",
            "  save-rule --name=<n> --pattern=<regex> [--group-type=Custom]",
            "  export-rules [--output=" + DEFAULT_EXPORT_FILE + "] [--limit=N]");

    private final IngestionService ingestionService;
    private final DeadLetterReplayService deadLetterReplayService;
    private final GroupingAggregator aggregator;
    private final RegroupService regroupService;
    private final SliceWorkerLauncher sliceWorkerLauncher;
    private final FailedGroupReplayService failedGroupReplayService;
    private final CustomRuleRepository customRuleRepository;
    private final GroupRuleExporter exporter;

    public LogSiftCommandRunner(IngestionService ingestionService,
                                DeadLetterReplayService deadLetterReplayService,
                                GroupingAggregator aggregator,
                                RegroupService regroupService,
                                SliceWorkerLauncher sliceWorkerLauncher,
                                FailedGroupReplayService failedGroupReplayService,
                                CustomRuleRepository customRuleRepository,
                                GroupRuleExporter exporter) {
        this.ingestionService = ingestionService;
        this.deadLetterReplayService = deadLetterReplayService;
        this.aggregator = aggregator;
        this.regroupService = regroupService;
        this.sliceWorkerLauncher = sliceWorkerLauncher;
        this.failedGroupReplayService = failedGroupReplayService;
        this.customRuleRepository = customRuleRepository;
        this.exporter = exporter;
    }

    public int run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            return usage("No command given");
        }
        String command = positional.get(0);
        List<String> operands = positional.subList(1, positional.size());
        try {
            switch (command) {
                case "ingest":
                    return ingest(operands);
                case "retry-dead-letter":
                    return retryDeadLetter(args);
                case "group":
                    return group(args);
                case "replay-failed-groups":
                    return replayFailedGroups(args);
                case "save-rule":
                    return saveRule(args);
                case "export-rules":
                    return exportRules(args);
                default:
                    return usage("Unknown command: " + command);
            }
        } catch (UsageException e) {
            return usage(e.getMessage());
        } catch (IOException e) {
            log.error("[CLI] {} failed: {}", command, e.getMessage(), e);
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[CLI] {} interrupted", command);
            return EXIT_FAILED;
        } catch (StoreInterruptedException e) {
            log.error("[CLI] {} interrupted: {}", command, e.getMessage());
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            log.error("[CLI] {} failed: {}", command, e.getMessage(), e);
            return EXIT_FAILED;
        }
    }

    /* ------------------------------------------------------------------ */
    /* Commands                                                             */
    /* ------------------------------------------------------------------ */

    private int ingest(List<String> operands) throws IOException {
        if (operands.isEmpty()) {
            throw new UsageException("ingest needs at least one file");
        }
        List<Path> files = new ArrayList<>(operands.size());
        for (String operand : operands) {
            Path file = Path.of(operand);
            if (!Files.isRegularFile(file)) {
                throw new UsageException("Input file not found: " + operand);
            }
            files.add(file);
        }

        IngestionResult total = null;
        for (Path file : files) {
            IngestionResult result = ingestionService.ingestFile(file);
            log.info("[INGEST] {}", result.summary());
            total = total == null ? result : total.plus(result);
        }
        if (files.size() > 1) {
            log.info("[INGEST] total over {} file(s): {}", files.size(), total.summary());
        }
        return total.getFailed() > 0 ? EXIT_FAILED : EXIT_OK;
    }

    private int retryDeadLetter(ApplicationArguments args) throws IOException {
        Path file = requiredFile(args);
        DeadLetterReplayService.ReplayResult result = deadLetterReplayService.replay(file, !args.containsOption("keep-file"));
        log.info("[RETRY] {}: retriedIndexed={} duplicates={} failedAgain={} skippedLines={}", file,
                result.retriedIndexed(), result.duplicates(), result.failedAgain(), result.skippedLines());
        return result.failedAgain() > 0 ? EXIT_FAILED : EXIT_OK;
    }

    private int group(ApplicationArguments args) throws IOException, InterruptedException {
        Integer workers = intOption(args, "workers");
        Integer sliceId = intOption(args, "slice-id");
        Integer sliceMax = intOption(args, "slice-max");
        boolean clearIndex = args.containsOption("clear-index");

        AggregationRequest.AggregationRequestBuilder builder = AggregationRequest.builder()
                .limit(intOption(args, "limit"))
                .batchSize(intOption(args, "batch-size"))
                .ignoreCheckpoint(args.containsOption("ignore-checkpoint"))
                .sessionId(stringOption(args, "session-id"));

        if (workers != null && workers < 1) {
            throw new UsageException("--workers must be at least 1, got " + workers);
        }
        if ((sliceId == null) != (sliceMax == null)) {
            throw new UsageException("--slice-id and --slice-max must be given together");
        }
        boolean parallel = workers != null && workers > 1;
        if (sliceId != null) {
            if (parallel || clearIndex) {
                throw new UsageException("--slice-id cannot be combined with --workers or --clear-index");
            }
            try {
                builder.slice(new Slice(sliceId, sliceMax));
            } catch (IllegalArgumentException e) {
                throw new UsageException(e.getMessage());
            }
        }
        AggregationRequest request = builder.build();

        if (clearIndex) {
            RegroupService.RegroupResult result = parallel
                    ? regroupService.regroupSliced(request, workers)
                    : regroupService.regroup(request);
            log.info("[REGROUP] backedUp={} restored={}", result.backedUp(), result.restored());
            if (result.aggregation() != null) {
                return reportAggregation(result.aggregation());
            }
            return result.workersSucceeded() ? EXIT_OK : EXIT_FAILED;
        }
        if (parallel) {
            List<Integer> exitCodes = sliceWorkerLauncher.launch(workers, request);
            log.info("[GROUP] worker exit codes: {}", exitCodes);
            return exitCodes.stream().allMatch(code -> code == 0) ? EXIT_OK : EXIT_FAILED;
        }
        return reportAggregation(aggregator.aggregate(request));
    }

    private int replayFailedGroups(ApplicationArguments args) throws IOException {
        Path file = requiredFile(args);
        FailedGroupReplayService.ReplayResult result = failedGroupReplayService.replay(file, !args.containsOption("keep-file"));
        log.info("[GROUP] replayed {} failed group update(s) from {}: failedAgain={} skippedLines={}",
                result.replayed(), file, result.failedAgain(), result.skippedLines());
        return result.failedAgain() > 0 ? EXIT_FAILED : EXIT_OK;
    }

    private int saveRule(ApplicationArguments args) {
        String name = requiredOption(args, "name");
        String pattern = requiredOption(args, "pattern");
        String groupType = stringOption(args, "group-type");
        try {
            customRuleRepository.saveRule(name, pattern, groupType);
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private int exportRules(ApplicationArguments args) throws IOException {
        String output = stringOption(args, "output");
        Path file = Path.of(output != null ? output : DEFAULT_EXPORT_FILE);
        int exported = exporter.export(file, intOption(args, "limit"));
        log.info("[EXPORT] {} rule sequence group(s) written to {}", exported, file);
        return EXIT_OK;
    }

    /* ------------------------------------------------------------------ */
    /* Option helpers                                                       */
    /* ------------------------------------------------------------------ */

    private int reportAggregation(AggregationResult result) {
        log.info("[GROUP] {}", result.summary());
        return result.getFailed() > 0 ? EXIT_FAILED : EXIT_OK;
    }

    private int usage(String problem) {
        log.error("[CLI] {}", problem);
        System.err.println(problem);
        System.err.println(USAGE);
        return EXIT_USAGE;
    }

    private static Path requiredFile(ApplicationArguments args) {
        String value = requiredOption(args, "file");
        Path file = Path.of(value);
        if (!Files.isRegularFile(file)) {
            throw new UsageException("File not found: " + value);
        }
        return file;
    }

    private static String requiredOption(ApplicationArguments args, String name) {
        String value = stringOption(args, name);
        if (value == null || value.isBlank()) {
            throw new UsageException("--" + name + " is required");
        }
        return value;
    }

    static String stringOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    static Integer intOption(ApplicationArguments args, String name) {
        String value = stringOption(args, name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("--" + name + " must be an integer, got '" + value + "'");
        }
    }

    private static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
