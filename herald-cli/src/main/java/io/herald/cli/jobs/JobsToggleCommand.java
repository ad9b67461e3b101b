package io.herald.cli.jobs;

import io.herald.cli.CliContext;
import io.herald.core.job.Job;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(description = "Enable or disable a job")
public final class JobsToggleCommand extends AbstractJobCommand {
    private final boolean enable;

    @Parameters(index = "0", paramLabel = "ID", description = "Job id")
    String id;

    public JobsToggleCommand(CliContext context, boolean enable) {
        super(context);
        this.enable = enable;
    }

    @Override
    protected int execute() throws Exception {
        Job job = context.jobService().setEnabled(id, enable);
        System.out.println((enable ? "Enabled" : "Disabled") + " job '" + job.name() + "' (" + job.id() + ")");
        return 0;
    }
}
