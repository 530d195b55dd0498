package com.jreinhal.querygate.sanitize;

import com.jreinhal.querygate.query.OpaqueId;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Locale;
import org.bson.types.ObjectId;

/**
 * Parsers for the string forms translators use for typed catalog fields.
 */
final class TypedValues {
    // 2024-01-31, 2024-01-31T10:15, 2024-01-31T10:15:30.5Z, 2024-01-31T10:15:30+05:30
    private static final DateTimeFormatter ISO_DATE_OR_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    private TypedValues() {
    }

    /**
     * Reads an ISO-8601 date or date-time. Values without an offset are taken as UTC; a bare date is
     * the start of that day.
     */
    static Date parseDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            TemporalAccessor parsed = ISO_DATE_OR_DATE_TIME.parseBest(text.trim(),
                    OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
            Instant instant;
            if (parsed instanceof OffsetDateTime offset) {
                instant = offset.toInstant();
            } else if (parsed instanceof LocalDateTime local) {
                instant = local.toInstant(ZoneOffset.UTC);
            } else {
                instant = ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Date.from(instant);
        }
        catch (DateTimeParseException | IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Returns the id for a 24-hex string, or null when the text is not one.
     */
    static OpaqueId parseObjectId(String text) {
        if (text == null) {
            return null;
        }
        String hex = text.trim();
        return ObjectId.isValid(hex) ? new OpaqueId(hex.toLowerCase(Locale.ROOT)) : null;
    }
}
