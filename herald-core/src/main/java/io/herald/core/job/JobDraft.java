package io.herald.core.job;

/**
 * Fields supplied when creating a job; the store assigns the id and timestamps.
 */
public record JobDraft(
    String name,
    String message,
    JobSchedule schedule,
    DeliverPolicy deliver,
    String channel,
    String to,
    boolean enabled
) {

    public static JobDraft of(String message, JobSchedule schedule) {
        return new JobDraft(null, message, schedule, DeliverPolicy.ALWAYS, null, null, true);
    }

    public JobDraft withName(String value) {
        return new JobDraft(value, message, schedule, deliver, channel, to, enabled);
    }

    public JobDraft withDeliver(DeliverPolicy value) {
        return new JobDraft(name, message, schedule, value, channel, to, enabled);
    }

    public JobDraft withDestination(String channelValue, String toValue) {
        return new JobDraft(name, message, schedule, deliver, channelValue, toValue, enabled);
    }

    public JobDraft withEnabled(boolean value) {
        return new JobDraft(name, message, schedule, deliver, channel, to, value);
    }
}
