package io.herald.core.job;

public enum ScheduleKind {
    CRON,
    EVERY,
    AT
}
