package it.unimib.datai.runinator.common.codec;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Locale;

/**
 * Timestamp formats used on the wire.
 *
 * <p>Parsing accepts ISO-8601 with fractional seconds first, then plain ISO-8601. A trailing offset is
 * accepted but ignored: the wall-clock value is taken as UTC.</p>
 */
public final class TaskTimestamps {
    private static final DateTimeFormatter WITH_FRACTION = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendPattern("HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter WITHOUT_FRACTION = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral('T')
            .appendPattern("HH:mm")
            .optionalStart()
            .appendLiteral(':')
            .appendPattern("ss")
            .optionalEnd()
            .optionalStart()
            .appendOffsetId()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter WIRE = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSS'Z'", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private static final DateTimeFormatter DISPLAY = DateTimeFormatter
            .ofPattern("uuuu-MM-dd HH:mm:ss", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private TaskTimestamps() {}

    /**
     * Parses a wire timestamp, returning {@code null} when the text is blank or matches neither format.
     */
    public static Instant parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        LocalDateTime local = tryParse(trimmed, WITH_FRACTION);
        if (local == null) {
            local = tryParse(trimmed, WITHOUT_FRACTION);
        }
        return local == null ? null : local.toInstant(ZoneOffset.UTC);
    }

    public static String format(Instant instant) {
        return instant == null ? null : WIRE.format(instant);
    }

    public static String display(Instant instant) {
        return instant == null ? "-" : DISPLAY.format(instant);
    }

    private static LocalDateTime tryParse(String text, DateTimeFormatter formatter) {
        try {
            return LocalDateTime.parse(text, formatter);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
