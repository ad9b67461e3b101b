package io.herald.cli.jobs;

import io.herald.cli.CliContext;
import io.herald.core.job.DeliverPolicy;
import io.herald.core.job.Job;
import io.herald.core.job.JobDraft;
import io.herald.core.job.JobSchedule;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "add", description = "Add a scheduled job")
public final class JobsAddCommand extends AbstractJobCommand {

    @Option(names = "--message", required = true, description = "Message handed to the job's session")
    String message;

    @Option(names = "--name", description = "Job name (default: first 30 characters of the message)")
    String name;

    @Option(names = "--cron", description = "Cron expression, e.g. '0 9 * * *'")
    String cron;

    @Option(names = "--tz", description = "IANA timezone for --cron")
    String tz;

    @Option(names = "--every", description = "Interval in seconds")
    Long every;

    @Option(names = "--at", description = "One-shot time (ISO datetime, 'in 10 minutes', 'tomorrow at 9am')")
    String at;

    @Option(names = "--deliver", defaultValue = "always", description = "always, auto or never")
    String deliver;

    @Option(names = "--channel", description = "Delivery channel")
    String channel;

    @Option(names = "--to", description = "Delivery recipient")
    String to;

    @Option(names = "--disabled", description = "Store the job disabled")
    boolean disabled;

    public JobsAddCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int execute() throws Exception {
        JobSchedule schedule = context.jobService().schedules().fromFields(cron, tz, every, at);
        JobDraft draft = JobDraft.of(message, schedule)
            .withName(name)
            .withDeliver(DeliverPolicy.from(deliver))
            .withDestination(channel, to)
            .withEnabled(!disabled);
        Job job = context.jobService().add(draft);
        System.out.println("Created job '" + job.name() + "' (id: " + job.id() + ")");
        return 0;
    }
}
