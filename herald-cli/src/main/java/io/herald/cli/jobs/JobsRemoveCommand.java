package io.herald.cli.jobs;

import io.herald.cli.CliContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "remove", description = "Remove a job")
public final class JobsRemoveCommand extends AbstractJobCommand {

    @Parameters(index = "0", paramLabel = "ID", description = "Job id")
    String id;

    public JobsRemoveCommand(CliContext context) {
        super(context);
    }

    @Override
    protected int execute() throws Exception {
        context.jobService().remove(id);
        System.out.println("Removed job " + id);
        return 0;
    }
}
