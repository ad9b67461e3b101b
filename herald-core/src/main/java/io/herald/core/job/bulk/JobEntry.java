package io.herald.core.job.bulk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "name", "message", "enabled", "schedule", "deliver", "channel", "to"})
public record JobEntry(
    String id,
    String name,
    String message,
    Boolean enabled,
    ScheduleEntry schedule,
    String deliver,
    String channel,
    String to
) {
}
