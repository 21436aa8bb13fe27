package com.di.logsift.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;

/**
 * Append-only JSON-lines overflow for documents that could not be written.
 * Safe to share between bulk worker threads.
 */
@Slf4j
public class DeadLetterWriter {

    private final Path file;
    private final ObjectMapper objectMapper;

    public DeadLetterWriter(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public Path getFile() {
        return file;
    }

    /**
     * @throws UncheckedIOException when the file cannot be written; the documents would
     *                              otherwise be lost
     */
    public synchronized void append(Collection<RawDocument> documents) {
        if (documents.isEmpty()) {
            return;
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            for (RawDocument document : documents) {
                writer.write(toLine(document));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not append " + documents.size() + " document(s) to " + file, e);
        }
        log.warn("[DLQ] wrote {} document(s) to {}", documents.size(), file);
    }

    private String toLine(RawDocument document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Document " + document.id() + " is not serializable", e);
        }
    }
}
