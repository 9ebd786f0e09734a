package com.evently.service.core.convert;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;

/** ISO-8601 parsing normalized to UTC. Timestamps without an offset are read as UTC. */
final class Timestamps {

    // "2012-05-08T20:23:41.425105" with an optional "Z", "+0200", "+02:00" or "+02" offset. A single space in place
    // of the 'T' is normalized before parsing. The colon-less offset is tried first so "+0200" is not cut at "+02".
    private static final DateTimeFormatter ISO_LENIENT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffset("+HHMM", "Z")
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HH:mm", "Z")
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final int DATE_LENGTH = "yyyy-MM-dd".length();

    private Timestamps() {}

    /**
     * @throws IllegalArgumentException when the value is not an ISO-8601 timestamp
     */
    static Instant parse(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime odt) {
            return odt.toInstant();
        }
        if (value instanceof ZonedDateTime zdt) {
            return zdt.toInstant();
        }
        if (value instanceof LocalDateTime ldt) {
            return ldt.toInstant(ZoneOffset.UTC);
        }
        String text = value == null ? "" : value.toString().trim();
        try {
            TemporalAccessor parsed =
                    ISO_LENIENT.parseBest(normalizeSeparator(text), OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) {
                return odt.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Not an ISO-8601 timestamp: '" + text + "'", ex);
        }
    }

    private static String normalizeSeparator(String text) {
        if (text.length() > DATE_LENGTH && text.charAt(DATE_LENGTH) == ' ') {
            return text.substring(0, DATE_LENGTH) + 'T' + text.substring(DATE_LENGTH + 1);
        }
        return text;
    }
}
