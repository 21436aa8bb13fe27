package com.di.logsift.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Timestamp handling shared by ingestion and grouping.
 *
 * <p>Stored timestamps use one fixed-width UTC form ({@code yyyy-MM-dd'T'HH:mm:ss.SSS'Z'}) so that
 * string comparison, which the store-side merge script relies on, is chronological.
 */
public final class Timestamps {

    public static final DateTimeFormatter STORED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final List<Function<String, Instant>> PARSERS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            localParser(DateTimeFormatter.ISO_LOCAL_DATE_TIME),
            localParser(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS")),
            localParser(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")),
            localParser(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")));

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return STORED_FORMAT.format(instant);
    }

    public static String now() {
        return format(Instant.now());
    }

    /**
     * Parses ISO-8601 instants, offset date-times and the common local date-time layouts
     * (read as UTC) into the stored form.
     */
    public static Optional<String> normalize(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String value = text.strip();
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return Optional.of(format(parser.apply(value)));
            } catch (DateTimeParseException e) {
                continue;
            }
        }
        return Optional.empty();
    }

    private static Function<String, Instant> localParser(DateTimeFormatter formatter) {
        return value -> LocalDateTime.parse(value, formatter).toInstant(ZoneOffset.UTC);
    }

    /** The later of two stored timestamps; {@code null} loses. */
    public static String max(String a, String b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    /** The earlier of two stored timestamps; {@code null} loses. */
    public static String min(String a, String b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) <= 0 ? a : b;
    }
}
