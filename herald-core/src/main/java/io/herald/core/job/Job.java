package io.herald.core.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Job(
    String id,
    String name,
    String message,
    JobSchedule schedule,
    DeliverPolicy deliver,
    String channel,
    String to,
    boolean enabled,
    Instant createdAt,
    Instant lastFiredAt
) {

    public Job {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        deliver = deliver == null ? DeliverPolicy.ALWAYS : deliver;
        name = name == null ? "" : name;
        message = message == null ? "" : message;
        channel = channel == null ? "" : channel;
        to = to == null ? "" : to;
    }

    public Job withLastFiredAt(Instant firedAt) {
        return new Job(id, name, message, schedule, deliver, channel, to, enabled, createdAt, firedAt);
    }

    public Job withEnabled(boolean value) {
        return new Job(id, name, message, schedule, deliver, channel, to, value, createdAt, lastFiredAt);
    }
}
