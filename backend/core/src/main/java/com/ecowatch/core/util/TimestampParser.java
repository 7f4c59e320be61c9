package com.ecowatch.core.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns the separate date and time cells of scraped feeds into an instant.
 *
 * <p>Feeds mix {@code 15/03/2024}, {@code 15-03-2024} and {@code 2024-03-15}; day-first dates are
 * reordered to year-first before a strict parse. Anything that does not resolve to a real
 * calendar date-time is reported as empty.
 */
public final class TimestampParser {
    private static final Pattern DAY_FIRST = Pattern.compile("(\\d{2})-(\\d{2})-(\\d{4})");
    private static final Pattern HAS_TIME = Pattern.compile("\\d{1,2}:\\d{2}");
    private static final Pattern OFFSET_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$");

    private static final DateTimeFormatter LOCAL_DATE_TIME = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-M-d")
            .optionalStart()
            .appendLiteral(' ')
            .optionalEnd()
            .optionalStart()
            .appendLiteral('T')
            .optionalEnd()
            .appendPattern("H:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private static final DateTimeFormatter LOCAL_DATE = DateTimeFormatter.ofPattern("uuuu-M-d")
            .withResolverStyle(ResolverStyle.STRICT);

    private TimestampParser() {
    }

    public static Optional<Instant> parse(String dateCell, String timeCell, ZoneId zone) {
        String date = HtmlUtils.normalizeText(dateCell);
        String time = HtmlUtils.normalizeText(timeCell);
        String candidate = (date + " " + time).trim();
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        String canonical = DAY_FIRST.matcher(candidate.replace('/', '-')).replaceAll("$3-$2-$1");
        return parseCanonical(canonical, zone);
    }

    private static Optional<Instant> parseCanonical(String value, ZoneId zone) {
        try {
            if (!HAS_TIME.matcher(value).find()) {
                return Optional.of(LocalDate.parse(value, LOCAL_DATE).atStartOfDay(zone).toInstant());
            }
            if (OFFSET_SUFFIX.matcher(value).find()) {
                return Optional.of(OffsetDateTime.parse(value.replace(' ', 'T')).toInstant());
            }
            return Optional.of(LocalDateTime.parse(value, LOCAL_DATE_TIME).atZone(zone).toInstant());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
