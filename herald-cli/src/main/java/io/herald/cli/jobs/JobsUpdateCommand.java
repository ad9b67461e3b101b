package io.herald.cli.jobs;

import io.herald.cli.CliContext;
import io.herald.core.job.DeliverPolicy;
import io.herald.core.job.Job;
import io.herald.core.job.JobPatch;
import io.herald.core.job.JobSchedule;
import io.herald.core.job.JobValidationException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "update", description = "Change fields of a job; omitted fields keep their value")
public final class JobsUpdateCommand extends AbstractJobCommand {

    @Parameters(index = "0", paramLabel = "ID", description = "Job id")
    String id;

    @Option(names = "--message")
    String message;

    @Option(names = "--name")
    String name;

    @Option(names = "--cron")
    String cron;

    @Option(names = "--tz")
    String tz;

    @Option(names = "--every")
    Long every;

    @Option(names = "--at")
    String at;

    @Option(names = "--deliver", description = "always, auto or never")
    String deliver;

    @Option(names = "--channel")
    String channel;

    @Option(names = "--to")
    String to;

    public JobsUpdateCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int execute() throws Exception {
        Job current = context.jobService().get(id);
        JobPatch patch = JobPatch.empty()
            .withMessage(message)
            .withName(name)
            .withChannel(channel)
            .withTo(to);
        if (deliver != null) {
            patch = patch.withDeliver(DeliverPolicy.from(deliver));
        }
        JobSchedule schedule = context.jobService().schedules().revise(current.schedule(), cron, tz, every, at);
        if (schedule != null) {
            patch = patch.withSchedule(schedule);
        }
        if (patch.isEmpty()) {
            throw new JobValidationException("nothing to update");
        }
        Job updated = context.jobService().update(id, patch);
        System.out.println("Updated job '" + updated.name() + "' (" + updated.id() + ")");
        return 0;
    }
}
