package com.di.logsift.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the content of one archive entry into log lines. The entry is sniffed as a whole:
 * a JSON array yields one line per element, a single (possibly pretty-printed) JSON object yields
 * one line, anything else is read line by line as NDJSON or raw text.
 */
public final class ArchiveEntryReader {

    private ArchiveEntryReader() {
    }

    public static List<String> lines(String content, ObjectMapper objectMapper) {
        ObjectReader reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        JsonNode document;
        try {
            document = reader.readTree(content);
        } catch (JsonProcessingException e) {
            // not a single JSON document: NDJSON or plain text
            return content.lines().toList();
        }
        if (document != null && document.isArray()) {
            List<String> elements = new ArrayList<>(document.size());
            document.forEach(element -> elements.add(element.toString()));
            return elements;
        }
        if (document != null && document.isObject()) {
            return List.of(document.toString());
        }
        return content.lines().toList();
    }
}
