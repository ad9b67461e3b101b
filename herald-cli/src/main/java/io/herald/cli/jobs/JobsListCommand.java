package io.herald.cli.jobs;

import io.herald.cli.CliContext;
import io.herald.core.job.Job;
import java.time.Instant;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list", description = "List scheduled jobs")
public final class JobsListCommand extends AbstractJobCommand {
    private static final String ROW = "%-8s  %-30s  %-36s  %-7s  %-7s  %s%n";

    @Option(names = "--all", description = "Include disabled jobs")
    boolean all;

    public JobsListCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int execute() throws Exception {
        List<Job> jobs = context.jobService().list(all);
        if (jobs.isEmpty()) {
            System.out.println("No scheduled jobs.");
            return 0;
        }
        Instant now = context.clock().instant();
        System.out.printf(ROW, "ID", "NAME", "SCHEDULE", "DELIVER", "ENABLED", "NEXT RUN");
        for (Job job : jobs) {
            System.out.printf(ROW,
                job.id(),
                truncate(job.name(), 30),
                truncate(job.schedule().describe(), 36),
                job.deliver().value(),
                job.enabled() ? "yes" : "no",
                nextRun(job, now));
        }
        return 0;
    }

    private String nextRun(Job job, Instant now) {
        if (!job.enabled()) {
            return "-";
        }
        return context.evaluator().nextFireTime(job.schedule(), job.lastFiredAt(), now)
            .map(next -> next.isAfter(now) ? next.toString() : "due")
            .orElse("-");
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max - 3) + "...";
    }
}
