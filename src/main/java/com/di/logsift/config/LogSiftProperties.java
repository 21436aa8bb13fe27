package com.di.logsift.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Single binding for all pipeline configuration.
 *
 * <pre>
 * logsift:
 *   indices:
 *     raw-logs: raw-error-logs
 *     groups: log-groups
 *   ingest:
 *     chunk-size: 1500
 *     thread-count: 3
 *   grouping:
 *     batch-size: 1000
 * </pre>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "logsift")
public class LogSiftProperties {

    @Valid
    private Indices indices = new Indices();

    @Valid
    private Store store = new Store();

    @Valid
    private Ingest ingest = new Ingest();

    @Valid
    private Grouping grouping = new Grouping();

    @Data
    public static class Indices {
        @NotBlank
        private String rawLogs = "raw-error-logs";
        @NotBlank
        private String groups = "log-groups";
        /** Membership ledger: one document per raw log id already counted into a group. */
        @NotBlank
        private String groupMembers = "log-group-members";
        @NotBlank
        private String checkpoint = "log-grouper-checkpoint";
        @NotBlank
        private String customPatterns = "log-custom-patterns";
    }

    @Data
    public static class Store {
        /** {@code elasticsearch} or {@code in-memory}. */
        private String type = "elasticsearch";
        @Min(1)
        private int connectMaxRetries = 10;
        private Duration connectRetryDelay = Duration.ofSeconds(5);
    }

    @Data
    public static class Ingest {
        /**
         * Substrings a raw line must contain before it is parsed at all. Lines without any of
         * them are skipped unparsed, so error records that spell their level differently are
         * missed; widen the list when that matters.
         */
        @NotEmpty
        private List<String> admissionTokens = new ArrayList<>(List.of("ERROR", "exception", "FATAL", "FAIL"));
        /** Upper-cased level substrings that admit a parsed record. */
        @NotEmpty
        private List<String> errorLevels = new ArrayList<>(List.of("ERROR", "FATAL", "FAIL"));
        @Min(1)
        private int chunkSize = 1500;
        private DataSize maxChunkBytes = DataSize.ofMegabytes(8);
        @Min(1)
        private int threadCount = 3;
        @Min(0)
        private int queueSize = 3;
        @Min(0)
        private int maxRetries = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(10);
        @Min(0)
        private int maxRetryQueue = 50_000;
        @Min(1)
        private int retryChunkSize = 500;
        @NotBlank
        private String deadLetterFile = "failed_docs.jsonl";
        @Min(1)
        private int maxNormalizedLength = 32_000;
        private boolean optimizeIndexSettings = true;
        private int progressInterval = 50_000;
    }

    @Data
    public static class Grouping {
        @Min(1)
        private int batchSize = 1000;
        @Min(1)
        private int scanPageSize = 500;
        private Duration scrollKeepAlive = Duration.ofMinutes(30);
        @Min(0)
        private int scanMaxRetries = 10;
        private Duration scanInitialBackoff = Duration.ofSeconds(2);
        private Duration scanMaxBackoff = Duration.ofSeconds(60);
        /** Values of {@code level} the grouping scan admits. */
        @NotEmpty
        private List<String> errorLevels = new ArrayList<>(List.of("ERROR"));
        @Min(1)
        private int maxRawLogIds = 50;
        @Min(1)
        private int maxSignatures = 10;
        @Min(0)
        private int retryOnConflict = 5;
        @Min(1)
        private int bulkRetries = 3;
        private Duration bulkBackoff = Duration.ofSeconds(1);
        @Min(1)
        private int bulkChunkSize = 1000;
        @NotBlank
        private String failedGroupsFile = "failed_groups.jsonl";
        @Min(1)
        private int maxCustomRules = 1000;
        private int progressInterval = 2000;
    }
}
