package com.stagehand.orchestrator.store;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Timestamps are written as ISO-8601 instants. Rows created by column
 * defaults carry SQLite's {@code datetime('now')} form ("yyyy-MM-dd HH:mm:ss",
 * UTC), so reads accept both.
 */
public final class Timestamps {

    private static final DateTimeFormatter SQLITE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Timestamps() {}

    public static String now() {
        return Instant.now().toString();
    }

    public static String format(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    public static Instant parse(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(value, SQLITE).toInstant(ZoneOffset.UTC);
        }
    }
}
