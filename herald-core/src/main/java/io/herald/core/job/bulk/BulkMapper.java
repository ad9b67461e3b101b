package io.herald.core.job.bulk;

import io.herald.core.job.DeliverPolicy;
import io.herald.core.job.Job;
import io.herald.core.job.JobDraft;
import io.herald.core.job.JobSchedule;
import io.herald.core.job.JobValidationException;
import io.herald.core.schedule.ScheduleFactory;

public final class BulkMapper {
    private final ScheduleFactory schedules;

    public BulkMapper(ScheduleFactory schedules) {
        this.schedules = schedules;
    }

    public JobEntry toEntry(Job job) {
        return new JobEntry(
            job.id(),
            job.name(),
            job.message(),
            job.enabled(),
            toScheduleEntry(job.schedule()),
            job.deliver().value(),
            blankToNull(job.channel()),
            blankToNull(job.to())
        );
    }

    public JobDraft toDraft(JobEntry entry, String label) {
        if (entry == null) {
            throw new JobValidationException(label, "entry is empty");
        }
        try {
            ScheduleEntry schedule = entry.schedule();
            if (schedule == null) {
                throw new JobValidationException("schedule is required");
            }
            JobSchedule parsed = schedules.fromFields(
                schedule.cronExpr(),
                schedule.tz(),
                schedule.everySeconds(),
                schedule.at()
            );
            return new JobDraft(
                entry.name(),
                entry.message(),
                parsed,
                DeliverPolicy.from(entry.deliver()),
                entry.channel(),
                entry.to(),
                entry.enabled() == null || entry.enabled()
            );
        } catch (JobValidationException e) {
            throw new JobValidationException(label, e.getMessage());
        }
    }

    private ScheduleEntry toScheduleEntry(JobSchedule schedule) {
        return switch (schedule.kind()) {
            case CRON -> new ScheduleEntry(schedule.cronExpr(), schedule.timezone(), null, null);
            case EVERY -> new ScheduleEntry(null, null, schedule.everySeconds(), null);
            case AT -> new ScheduleEntry(null, null, null, schedule.at().toString());
        };
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
