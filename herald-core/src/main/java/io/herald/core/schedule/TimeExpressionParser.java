package io.herald.core.schedule;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the {@code at} value of one-shot jobs: ISO instants and date-times, plus short relative
 * forms such as {@code in 10m} or {@code tomorrow at 9:30}.
 */
public final class TimeExpressionParser {
    private static final Pattern IN_PATTERN = Pattern.compile(
        "^in\\s+(\\d+)\\s*(s|sec|secs|second|seconds|m|min|mins|minute|minutes|h|hr|hrs|hour|hours|d|day|days)$");
    private static final Pattern DAY_AT_PATTERN = Pattern.compile("^(today|tomorrow)(?:\\s+at\\s+(.+))?$");
    private static final Pattern MERIDIEM = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?(am|pm)$");
    private static final Pattern TWENTY_FOUR = Pattern.compile("^(\\d{1,2})(?::(\\d{2}))?$");
    private static final DateTimeFormatter DATE_TIME_SPACE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    private final Clock clock;
    private final ZoneId zone;

    public TimeExpressionParser(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    public Instant parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("time expression is required");
        }
        String raw = expression.trim();
        String normalized = raw.toLowerCase(Locale.ROOT);

        Matcher in = IN_PATTERN.matcher(normalized);
        if (in.matches()) {
            return relative(Long.parseLong(in.group(1)), in.group(2), raw);
        }

        Matcher day = DAY_AT_PATTERN.matcher(normalized);
        if (day.matches()) {
            LocalDate date = LocalDate.ofInstant(clock.instant(), zone);
            if ("tomorrow".equals(day.group(1))) {
                date = date.plusDays(1);
            }
            return LocalDateTime.of(date, parseTimeOfDay(day.group(2))).atZone(zone).toInstant();
        }

        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException ignored) {
            // not an instant, try the next form
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException ignored) {
            // no offset, try local forms
        }
        try {
            return LocalDateTime.parse(raw).atZone(zone).toInstant();
        } catch (DateTimeParseException ignored) {
            // not ISO local
        }
        try {
            return LocalDateTime.parse(raw, DATE_TIME_SPACE).atZone(zone).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through
        }
        throw new IllegalArgumentException("unable to parse time expression: " + expression);
    }

    private Instant relative(long amount, String unit, String expression) {
        try {
            return clock.instant().plusSeconds(Math.multiplyExact(amount, unitSeconds(unit)));
        } catch (ArithmeticException | DateTimeException e) {
            throw new IllegalArgumentException("time expression out of range: " + expression, e);
        }
    }

    private long unitSeconds(String unit) {
        return switch (unit) {
            case "s", "sec", "secs", "second", "seconds" -> 1;
            case "m", "min", "mins", "minute", "minutes" -> 60;
            case "h", "hr", "hrs", "hour", "hours" -> 3_600;
            case "d", "day", "days" -> 86_400;
            default -> throw new IllegalArgumentException("unsupported time unit: " + unit);
        };
    }

    private LocalTime parseTimeOfDay(String token) {
        if (token == null || token.isBlank()) {
            return LocalTime.of(9, 0);
        }
        try {
            return parseClockTime(token);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid time of day: " + token, e);
        }
    }

    private LocalTime parseClockTime(String token) {
        String value = token.trim().replace(" ", "");
        Matcher meridiem = MERIDIEM.matcher(value);
        if (meridiem.matches()) {
            int hour = Integer.parseInt(meridiem.group(1)) % 12;
            if ("pm".equals(meridiem.group(3))) {
                hour += 12;
            }
            return LocalTime.of(hour, minutes(meridiem.group(2)));
        }
        Matcher twentyFour = TWENTY_FOUR.matcher(value);
        if (twentyFour.matches()) {
            return LocalTime.of(Integer.parseInt(twentyFour.group(1)), minutes(twentyFour.group(2)));
        }
        throw new IllegalArgumentException("invalid time format: " + token);
    }

    private int minutes(String group) {
        return group == null ? 0 : Integer.parseInt(group);
    }
}
