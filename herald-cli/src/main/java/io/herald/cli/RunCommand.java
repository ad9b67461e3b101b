package io.herald.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "run", description = "Run the scheduler until interrupted")
public final class RunCommand implements Callable<Integer> {
    private final CliContext context;

    public RunCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.schedulerRunner().run();
        } catch (Exception e) {
            System.err.println("Run command failed: " + e.getMessage());
            return 1;
        }
    }
}
