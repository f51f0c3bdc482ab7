package com.quakesentinel.collectors.p2pquake;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;

/**
 * P2PQuake reports local Japan time as {@code yyyy/MM/dd HH:mm:ss[.SSS]} without an offset.
 * ISO-8601 instants and offset date-times are accepted too.
 */
public final class P2pQuakeTimestamps {
    public static final ZoneId FEED_ZONE = ZoneId.of("Asia/Tokyo");

    private static final DateTimeFormatter FEED_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("uuuu/MM/dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private P2pQuakeTimestamps() {
    }

    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            throw new FeedFormatException("Missing timestamp");
        }
        String trimmed = text.trim();
        try {
            if (trimmed.indexOf('T') > 0) {
                return trimmed.endsWith("Z")
                        ? Instant.parse(trimmed)
                        : OffsetDateTime.parse(trimmed).toInstant();
            }
            return LocalDateTime.parse(trimmed, FEED_FORMAT).atZone(FEED_ZONE).toInstant();
        } catch (DateTimeParseException e) {
            throw new FeedFormatException("Unparseable timestamp '" + trimmed + "'", e);
        }
    }
}
