package com.example.punchsync.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Parsing helpers for the timestamp formats terminals emit.
 */
public final class DateTimes {
    private static final DateTimeFormatter[] OFFSET_FORMATS = new DateTimeFormatter[] {
        DateTimeFormatter.ISO_OFFSET_DATE_TIME,
        DateTimeFormatter.ISO_ZONED_DATE_TIME
    };
    private static final DateTimeFormatter[] LOCAL_FORMATS = new DateTimeFormatter[] {
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss")
    };

    private DateTimes() {
    }

    /**
     * Parses {@code text} into an instant. Values carrying an offset keep it; values without
     * one are interpreted in {@code localZone}.
     */
    public static Optional<Instant> parse(String text, ZoneId localZone) {
        if (text == null || text.trim().isEmpty()) {
            return Optional.empty();
        }
        String value = text.trim();
        for (DateTimeFormatter formatter : OFFSET_FORMATS) {
            try {
                return Optional.of(OffsetDateTime.parse(value, formatter).toInstant());
            } catch (DateTimeParseException ignore) {
                // Try next formatter
            }
        }
        for (DateTimeFormatter formatter : LOCAL_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(value, formatter).atZone(localZone).toInstant());
            } catch (DateTimeParseException ignore) {
                // Try next formatter
            }
        }
        return Optional.empty();
    }

    /**
     * Canonical form used for storage and deduplication: UTC, whole seconds.
     */
    public static Instant canonical(Instant instant) {
        return instant.truncatedTo(ChronoUnit.SECONDS);
    }

    public static LocalDateTime toUtcLocal(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    public static Instant fromUtcLocal(LocalDateTime value) {
        return value.toInstant(ZoneOffset.UTC);
    }

    /**
     * Formats an instant for ISAPI search conditions, e.g. {@code 2024-01-01T09:00:00+08:00}.
     */
    public static String toDeviceTime(Instant instant, ZoneId zone) {
        return OffsetDateTime.ofInstant(instant, zone)
            .truncatedTo(ChronoUnit.SECONDS)
            .format(DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX"));
    }
}
