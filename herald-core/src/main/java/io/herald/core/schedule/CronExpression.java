package io.herald.core.schedule;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Five-field cron expression ({@code minute hour day-of-month month day-of-week}) evaluated
 * against local wall-clock time of a zone.
 *
 * <p>When both day fields are restricted a day matches if either of them matches. Local times
 * that do not exist because of a daylight-saving gap resolve to the first instant after the gap;
 * local times that occur twice resolve to the earliest occurrence after the reference instant.
 */
public final class CronExpression {
    private static final int SEARCH_YEARS = 5;
    private static final Map<String, String> MACROS = Map.of(
        "@yearly", "0 0 1 1 *",
        "@annually", "0 0 1 1 *",
        "@monthly", "0 0 1 * *",
        "@weekly", "0 0 * * 0",
        "@daily", "0 0 * * *",
        "@midnight", "0 0 * * *",
        "@hourly", "0 * * * *"
    );
    private static final Map<String, Integer> MONTH_NAMES = Map.ofEntries(
        Map.entry("JAN", 1), Map.entry("FEB", 2), Map.entry("MAR", 3), Map.entry("APR", 4),
        Map.entry("MAY", 5), Map.entry("JUN", 6), Map.entry("JUL", 7), Map.entry("AUG", 8),
        Map.entry("SEP", 9), Map.entry("OCT", 10), Map.entry("NOV", 11), Map.entry("DEC", 12)
    );
    private static final Map<String, Integer> DAY_NAMES = Map.of(
        "SUN", 0, "MON", 1, "TUE", 2, "WED", 3, "THU", 4, "FRI", 5, "SAT", 6
    );

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthWildcard;
    private final boolean dayOfWeekWildcard;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.minutes = parseField(fields[0], "minute", 0, 59, Map.of());
        this.hours = parseField(fields[1], "hour", 0, 23, Map.of());
        this.daysOfMonth = parseField(fields[2], "day-of-month", 1, 31, Map.of());
        this.months = parseField(fields[3], "month", 1, 12, MONTH_NAMES);
        BitSet weekdays = parseField(fields[4], "day-of-week", 0, 7, DAY_NAMES);
        if (weekdays.get(7)) {
            weekdays.set(0);
            weekdays.clear(7);
        }
        this.daysOfWeek = weekdays;
        this.dayOfMonthWildcard = isWildcard(fields[2]);
        this.dayOfWeekWildcard = isWildcard(fields[4]);
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression is required");
        }
        String trimmed = expression.trim();
        String expanded = MACROS.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
        String[] fields = expanded.split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException(
                "cron expression must have 5 fields (minute hour day-of-month month day-of-week): " + expression);
        }
        return new CronExpression(trimmed, fields);
    }

    public String expression() {
        return expression;
    }

    public boolean matches(LocalDateTime time) {
        return months.get(time.getMonthValue())
            && dayMatches(time.toLocalDate())
            && hours.get(time.getHour())
            && minutes.get(time.getMinute());
    }

    /**
     * Earliest instant strictly after {@code after} whose wall-clock time in {@code zone} matches,
     * or empty when nothing matches within the search horizon.
     */
    public Optional<Instant> nextAfter(Instant after, ZoneId zone) {
        ZoneRules rules = zone.getRules();
        LocalDateTime cursor = LocalDateTime.ofInstant(after, zone).truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDateTime limit = cursor.plusYears(SEARCH_YEARS);

        while (!cursor.isAfter(limit)) {
            if (!months.get(cursor.getMonthValue())) {
                cursor = cursor.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!dayMatches(cursor.toLocalDate())) {
                cursor = cursor.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (!hours.get(cursor.getHour())) {
                cursor = cursor.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.get(cursor.getMinute())) {
                cursor = cursor.plusMinutes(1);
                continue;
            }

            Instant resolved = resolve(cursor, rules, after);
            if (resolved != null) {
                return Optional.of(resolved);
            }
            cursor = cursor.plusMinutes(1);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return expression;
    }

    private Instant resolve(LocalDateTime local, ZoneRules rules, Instant after) {
        List<ZoneOffset> offsets = rules.getValidOffsets(local);
        if (offsets.isEmpty()) {
            ZoneOffsetTransition gap = rules.getTransition(local);
            Instant endOfGap = gap.getInstant();
            return endOfGap.isAfter(after) ? endOfGap : null;
        }
        return offsets.stream()
            .map(local::toInstant)
            .sorted(Comparator.naturalOrder())
            .filter(instant -> instant.isAfter(after))
            .findFirst()
            .orElse(null);
    }

    private boolean dayMatches(LocalDate date) {
        boolean dom = daysOfMonth.get(date.getDayOfMonth());
        boolean dow = daysOfWeek.get(cronWeekday(date.getDayOfWeek()));
        if (dayOfMonthWildcard || dayOfWeekWildcard) {
            return dom && dow;
        }
        return dom || dow;
    }

    private static int cronWeekday(DayOfWeek dayOfWeek) {
        return dayOfWeek.getValue() % 7;
    }

    private static boolean isWildcard(String field) {
        return field.startsWith("*") || field.equals("?");
    }

    private static BitSet parseField(String field, String label, int min, int max, Map<String, Integer> names) {
        BitSet bits = new BitSet(max + 1);
        for (String part : field.split(",", -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("empty list element in " + label + " field: " + field);
            }
            int step = 1;
            String range = part;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), label, Map.of());
                if (step <= 0) {
                    throw new IllegalArgumentException("step must be positive in " + label + " field: " + part);
                }
            }

            int start;
            int end;
            if (range.equals("*") || range.equals("?")) {
                start = min;
                end = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", 2);
                start = parseNumber(bounds[0], label, names);
                end = parseNumber(bounds[1], label, names);
                if (start > end) {
                    throw new IllegalArgumentException("descending range in " + label + " field: " + part);
                }
            } else {
                start = parseNumber(range, label, names);
                end = slash >= 0 ? max : start;
            }

            if (start < min || end > max) {
                throw new IllegalArgumentException(
                    label + " value out of range [" + min + "-" + max + "]: " + part);
            }
            for (int value = start; value <= end; value += step) {
                bits.set(value);
            }
        }
        return bits;
    }

    private static int parseNumber(String token, String label, Map<String, Integer> names) {
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        Integer named = names.get(normalized);
        if (named != null) {
            return named;
        }
        try {
            return Integer.parseInt(normalized);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + label + " value: " + token);
        }
    }
}
