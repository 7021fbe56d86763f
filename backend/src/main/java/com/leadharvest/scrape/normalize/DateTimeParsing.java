package com.leadharvest.scrape.normalize;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Lenient date parsing for scraped text. Values without an offset are read as UTC;
 * calendar dates that do not exist are rejected, never clamped.
 */
public final class DateTimeParsing {
    private static final Pattern WEEKDAY_PREFIX = Pattern.compile(
        "^(mon|tue|wed|thu|fri|sat|sun)[a-z]*\\.?,?\\s+",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern AT_SEPARATOR = Pattern.compile("\\s+at\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern ORDINAL_SUFFIX = Pattern.compile("(\\d{1,2})(st|nd|rd|th)\\b", Pattern.CASE_INSENSITIVE);

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
        formatter("uuuu-MM-dd HH:mm[:ss]"),
        formatter("uuuu/MM/dd HH:mm[:ss]"),
        formatter("MMM d, uuuu h:mm a"),
        formatter("MMMM d, uuuu h:mm a"),
        formatter("MMM d, uuuu HH:mm"),
        formatter("MMMM d, uuuu HH:mm"),
        formatter("d MMMM uuuu HH:mm"),
        formatter("d MMM uuuu HH:mm"),
        formatter("d MMMM uuuu h:mm a"),
        formatter("d MMM uuuu h:mm a"),
        formatter("MM/dd/uuuu h:mm a"),
        formatter("MM/dd/uuuu HH:mm")
    );
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        formatter("d MMMM uuuu"),
        formatter("d MMM uuuu"),
        formatter("MMMM d, uuuu"),
        formatter("MMM d, uuuu"),
        formatter("MMMM d uuuu"),
        formatter("MMM d uuuu"),
        formatter("uuuu/MM/dd"),
        formatter("M/d/uuuu"),
        formatter("d.M.uuuu")
    );

    private DateTimeParsing() {}

    public static Optional<OffsetDateTime> parseDateTime(String text) {
        String value = text == null ? "" : text.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        Optional<OffsetDateTime> iso = parseIso(value);
        if (iso.isPresent()) {
            return iso;
        }
        try {
            return Optional.of(ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME.withResolverStyle(ResolverStyle.STRICT)).toOffsetDateTime());
        } catch (DateTimeParseException ignored) {
            // not RFC-1123, fall through to the human formats
        }

        String human = cleanHuman(value);
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(human, format).atOffset(ZoneOffset.UTC));
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return parseHumanDate(human).map(date -> date.atStartOfDay().atOffset(ZoneOffset.UTC));
    }

    public static Optional<LocalDate> parseDate(String text) {
        return parseDateTime(text).map(OffsetDateTime::toLocalDate);
    }

    private static Optional<OffsetDateTime> parseIso(String value) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                value,
                OffsetDateTime::from,
                LocalDateTime::from
            );
            if (parsed instanceof OffsetDateTime offset) {
                return Optional.of(offset);
            }
            return Optional.of(((LocalDateTime) parsed).atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // not a full ISO date-time
        }
        try {
            return Optional.of(LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay().atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> parseHumanDate(String value) {
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(value, format));
            } catch (DateTimeParseException ignored) {
                // try the next format
            }
        }
        return Optional.empty();
    }

    private static String cleanHuman(String value) {
        String cleaned = WEEKDAY_PREFIX.matcher(value).replaceFirst("");
        cleaned = AT_SEPARATOR.matcher(cleaned).replaceAll(" ");
        cleaned = ORDINAL_SUFFIX.matcher(cleaned).replaceAll("$1");
        return cleaned.replaceAll("\\s+", " ").trim();
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);
    }
}
