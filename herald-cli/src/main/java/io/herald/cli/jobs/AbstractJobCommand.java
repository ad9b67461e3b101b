package io.herald.cli.jobs;

import io.herald.cli.CliContext;
import io.herald.core.job.JobNotFoundException;
import io.herald.core.job.JobValidationException;
import java.util.concurrent.Callable;

/**
 * Maps store errors to exit code 1 with the message on stderr.
 */
abstract class AbstractJobCommand implements Callable<Integer> {
    protected final CliContext context;

    AbstractJobCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public final Integer call() {
        try {
            return execute();
        } catch (JobValidationException | JobNotFoundException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            System.err.println("Jobs command failed: " + e.getMessage());
            return 1;
        }
    }

    protected abstract int execute() throws Exception;
}
