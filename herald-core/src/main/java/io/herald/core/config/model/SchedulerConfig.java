package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.DateTimeException;
import java.time.ZoneId;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SchedulerConfig(
    int maxIdleSeconds,
    int firingThreads,
    int sessionTimeoutSeconds,
    String defaultTimezone
) {

    public SchedulerConfig {
        defaultTimezone = defaultTimezone == null ? "" : defaultTimezone.trim();
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig(60, 4, 300, "");
    }

    /**
     * The zone for cron jobs created without one; blank means the system zone.
     */
    public ZoneId zone() {
        if (defaultTimezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(defaultTimezone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("scheduler.defaultTimezone is not a valid zone: " + defaultTimezone, e);
        }
    }
}
