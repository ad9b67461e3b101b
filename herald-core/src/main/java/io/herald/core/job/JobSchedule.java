package io.herald.core.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Recurrence of a job. Exactly one variant is populated: a cron expression with its timezone,
 * a fixed interval, or a single absolute instant.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobSchedule(
    ScheduleKind kind,
    String cronExpr,
    String timezone,
    Long everySeconds,
    Instant at
) {

    public JobSchedule {
        Objects.requireNonNull(kind, "kind must not be null");
        switch (kind) {
            case CRON -> {
                requirePresent(cronExpr != null && !cronExpr.isBlank(), "cron schedule requires cron_expr");
                requirePresent(timezone != null && !timezone.isBlank(), "cron schedule requires a timezone");
                requirePresent(everySeconds == null && at == null, "cron schedule must not carry every_seconds or at");
                cronExpr = cronExpr.trim();
                timezone = timezone.trim();
            }
            case EVERY -> {
                requirePresent(everySeconds != null, "interval schedule requires every_seconds");
                requirePresent(cronExpr == null && timezone == null && at == null,
                    "interval schedule must not carry cron_expr, tz or at");
            }
            case AT -> {
                requirePresent(at != null, "one-shot schedule requires at");
                requirePresent(cronExpr == null && timezone == null && everySeconds == null,
                    "one-shot schedule must not carry cron_expr, tz or every_seconds");
            }
        }
    }

    public static JobSchedule cron(String cronExpr, String timezone) {
        return new JobSchedule(ScheduleKind.CRON, cronExpr, timezone, null, null);
    }

    public static JobSchedule every(long seconds) {
        return new JobSchedule(ScheduleKind.EVERY, null, null, seconds, null);
    }

    public static JobSchedule at(Instant at) {
        return new JobSchedule(ScheduleKind.AT, null, null, null, at);
    }

    public boolean oneShot() {
        return kind == ScheduleKind.AT;
    }

    public Duration interval() {
        return everySeconds == null ? Duration.ZERO : Duration.ofSeconds(everySeconds);
    }

    public String describe() {
        return switch (kind) {
            case CRON -> "cron '" + cronExpr + "' (" + timezone + ")";
            case EVERY -> "every " + everySeconds + "s";
            case AT -> "once at " + at;
        };
    }

    private static void requirePresent(boolean condition, String message) {
        if (!condition) {
            throw new JobValidationException(message);
        }
    }
}
