package com.di.logsift.ingest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A document on its way to the raw-log index. Serialized as-is, this is also one line of the
 * dead-letter file, so replaying that file sends exactly what the primary path would have sent.
 */
public record RawDocument(@JsonProperty("_index") String index,
                          @JsonProperty("_id") String id,
                          @JsonProperty("_source") Map<String, Object> source) {
}
