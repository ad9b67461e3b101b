package io.herald.core.job;

/**
 * Partial update of a job. {@code null} components leave the stored value untouched.
 */
public record JobPatch(
    String name,
    String message,
    JobSchedule schedule,
    DeliverPolicy deliver,
    String channel,
    String to,
    Boolean enabled
) {

    public static JobPatch empty() {
        return new JobPatch(null, null, null, null, null, null, null);
    }

    public JobPatch withName(String value) {
        return new JobPatch(value, message, schedule, deliver, channel, to, enabled);
    }

    public JobPatch withMessage(String value) {
        return new JobPatch(name, value, schedule, deliver, channel, to, enabled);
    }

    public JobPatch withSchedule(JobSchedule value) {
        return new JobPatch(name, message, value, deliver, channel, to, enabled);
    }

    public JobPatch withDeliver(DeliverPolicy value) {
        return new JobPatch(name, message, schedule, value, channel, to, enabled);
    }

    public JobPatch withChannel(String value) {
        return new JobPatch(name, message, schedule, deliver, value, to, enabled);
    }

    public JobPatch withTo(String value) {
        return new JobPatch(name, message, schedule, deliver, channel, value, enabled);
    }

    public JobPatch withEnabled(Boolean value) {
        return new JobPatch(name, message, schedule, deliver, channel, to, value);
    }

    public boolean isEmpty() {
        return name == null && message == null && schedule == null && deliver == null
            && channel == null && to == null && enabled == null;
    }
}
