package com.di.logsift.group;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only JSON-lines file of group merges that failed, for offline replay.
 */
@Slf4j
public class FailedGroupLog {

    private final Path file;
    private final ObjectMapper objectMapper;

    public FailedGroupLog(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public Path getFile() {
        return file;
    }

    public synchronized void append(List<FailedGroupAction> actions) {
        if (actions.isEmpty()) {
            return;
        }
        log.warn("[GROUP] saving {} failed group(s) to {}", actions.size(), file);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (FailedGroupAction action : actions) {
                writer.write(objectMapper.writeValueAsString(action));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write failed groups to " + file, e);
        }
    }

    /**
     * Reads every parseable line; unreadable lines are logged and counted in {@code skipped}.
     */
    public static ReadResult read(Path file, ObjectMapper objectMapper) throws IOException {
        List<FailedGroupAction> actions = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    actions.add(objectMapper.readValue(line, FailedGroupAction.class));
                } catch (JsonProcessingException e) {
                    skipped++;
                    log.warn("[GROUP] skipping bad line {} of {}: {}", lineNumber, file, e.getOriginalMessage());
                }
            }
        }
        return new ReadResult(actions, skipped);
    }

    public record ReadResult(List<FailedGroupAction> actions, int skipped) {
    }
}
