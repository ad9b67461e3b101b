package io.herald.core.schedule;

import io.herald.core.job.JobSchedule;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a schedule and its last fire time to the next fire time. Schedules are validated when a
 * job is stored, so evaluation assumes a well-formed expression and zone.
 */
public final class ScheduleEvaluator {
    static final Duration EPSILON = Duration.ofMillis(1);

    private final Map<String, CronExpression> expressions = new ConcurrentHashMap<>();

    public Optional<Instant> nextFireTime(JobSchedule schedule, Instant lastFiredAt, Instant now) {
        return switch (schedule.kind()) {
            case CRON -> {
                Instant floor = now.minus(EPSILON);
                Instant reference = lastFiredAt != null && lastFiredAt.isAfter(floor) ? lastFiredAt : floor;
                yield expression(schedule.cronExpr()).nextAfter(reference, ZoneId.of(schedule.timezone()));
            }
            case EVERY -> Optional.of(lastFiredAt == null ? now : lastFiredAt.plus(schedule.interval()));
            case AT -> lastFiredAt == null ? Optional.of(schedule.at()) : Optional.empty();
        };
    }

    public CronExpression expression(String cronExpr) {
        return expressions.computeIfAbsent(cronExpr, CronExpression::parse);
    }
}
