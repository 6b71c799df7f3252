package com.realtycrm.mlssync.service.mapping;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;

/**
 * Parses the timestamp forms MLS feeds use: offset date-times, zone-less date-times (read as UTC) and
 * plain dates (start of day, UTC).
 */
public final class SourceTimestamps {

    private static final DateTimeFormatter FLEXIBLE_ISO = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter();

    private SourceTimestamps() {
    }

    /**
     * @throws java.time.format.DateTimeParseException if the text matches none of the supported forms.
     */
    public static Instant parse(String text) {
        final TemporalAccessor parsed = FLEXIBLE_ISO.parseBest(text.trim(), OffsetDateTime::from,
                                                               LocalDateTime::from, LocalDate::from);
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (parsed instanceof LocalDateTime localDateTime) {
            return localDateTime.toInstant(ZoneOffset.UTC);
        }
        return ((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
}
