package io.herald.core.schedule;

import io.herald.core.job.JobSchedule;
import io.herald.core.job.JobValidationException;
import io.herald.core.job.ScheduleKind;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;

public final class ScheduleFactory {
    private final Clock clock;
    private final ZoneId defaultZone;
    private final ScheduleEvaluator evaluator;

    public ScheduleFactory(Clock clock, ZoneId defaultZone) {
        this(clock, defaultZone, new ScheduleEvaluator());
    }

    public ScheduleFactory(Clock clock, ZoneId defaultZone, ScheduleEvaluator evaluator) {
        this.clock = clock;
        this.defaultZone = defaultZone;
        this.evaluator = evaluator;
    }

    public ZoneId defaultZone() {
        return defaultZone;
    }

    public JobSchedule fromFields(String cronExpr, String tz, Long everySeconds, String at) {
        boolean hasCron = cronExpr != null && !cronExpr.isBlank();
        boolean hasEvery = everySeconds != null;
        boolean hasAt = at != null && !at.isBlank();
        boolean hasTz = tz != null && !tz.isBlank();

        int provided = (hasCron ? 1 : 0) + (hasEvery ? 1 : 0) + (hasAt ? 1 : 0);
        if (provided != 1) {
            throw new JobValidationException("provide exactly one of cron_expr, every_seconds or at");
        }
        if (hasTz && !hasCron) {
            throw new JobValidationException("tz can only be used with cron_expr");
        }

        JobSchedule schedule;
        if (hasCron) {
            String zone = hasTz ? zone(tz).getId() : defaultZone.getId();
            schedule = JobSchedule.cron(cronExpr, zone);
        } else if (hasEvery) {
            schedule = JobSchedule.every(everySeconds);
        } else {
            schedule = JobSchedule.at(parseAt(at));
        }
        validate(schedule);
        return schedule;
    }

    /**
     * Builds the replacement schedule for a partial update, or returns {@code null} when no
     * schedule field is given. A lone {@code tz} re-zones the current cron expression.
     */
    public JobSchedule revise(JobSchedule current, String cronExpr, String tz, Long everySeconds, String at) {
        boolean hasCron = cronExpr != null && !cronExpr.isBlank();
        boolean hasAt = at != null && !at.isBlank();
        boolean hasTz = tz != null && !tz.isBlank();
        if (!hasCron && everySeconds == null && !hasAt) {
            if (!hasTz) {
                return null;
            }
            if (current == null || current.kind() != ScheduleKind.CRON) {
                throw new JobValidationException("tz can only be used with cron_expr");
            }
            return fromFields(current.cronExpr(), tz, null, null);
        }
        return fromFields(cronExpr, tz, everySeconds, at);
    }

    public Instant parseAt(String at) {
        try {
            return new TimeExpressionParser(clock, defaultZone).parse(at);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new JobValidationException("invalid at datetime: " + e.getMessage());
        }
    }

    public void validate(JobSchedule schedule) {
        if (schedule == null) {
            throw new JobValidationException("schedule is required");
        }
        switch (schedule.kind()) {
            case CRON -> {
                ZoneId zone = zone(schedule.timezone());
                CronExpression expression;
                try {
                    expression = evaluator.expression(schedule.cronExpr());
                } catch (IllegalArgumentException e) {
                    throw new JobValidationException("invalid cron_expr: " + e.getMessage());
                }
                if (expression.nextAfter(clock.instant(), zone).isEmpty()) {
                    throw new JobValidationException("cron_expr never matches: " + schedule.cronExpr());
                }
            }
            case EVERY -> {
                if (schedule.everySeconds() < 1) {
                    throw new JobValidationException("every_seconds must be at least 1");
                }
            }
            case AT -> {
                // instant already parsed
            }
        }
    }

    private ZoneId zone(String tz) {
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            throw new JobValidationException("unknown timezone '" + tz + "'");
        }
    }
}
