package io.herald.cli;

import io.herald.cli.jobs.JobsAddCommand;
import io.herald.cli.jobs.JobsCommand;
import io.herald.cli.jobs.JobsExportCommand;
import io.herald.cli.jobs.JobsGetCommand;
import io.herald.cli.jobs.JobsImportCommand;
import io.herald.cli.jobs.JobsListCommand;
import io.herald.cli.jobs.JobsRemoveCommand;
import io.herald.cli.jobs.JobsToggleCommand;
import io.herald.cli.jobs.JobsUpdateCommand;
import java.nio.file.Path;
import picocli.CommandLine;

public final class HeraldCli {

    private HeraldCli() {
    }

    public static CommandLine commandLine(CliContext context) {
        CommandLine jobs = new CommandLine(new JobsCommand());
        jobs.addSubcommand("add", new JobsAddCommand(context));
        jobs.addSubcommand("get", new JobsGetCommand(context));
        jobs.addSubcommand("list", new JobsListCommand(context));
        jobs.addSubcommand("update", new JobsUpdateCommand(context));
        jobs.addSubcommand("enable", new JobsToggleCommand(context, true));
        jobs.addSubcommand("disable", new JobsToggleCommand(context, false));
        jobs.addSubcommand("remove", new JobsRemoveCommand(context));
        jobs.addSubcommand("export", new JobsExportCommand(context));
        jobs.addSubcommand("import", new JobsImportCommand(context));

        CommandLine commandLine = new CommandLine(new HeraldCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("jobs", jobs);
        return commandLine;
    }

    /**
     * Finds the value of a leading {@code --config} option without parsing the rest.
     */
    public static Path configPathFrom(String[] args, Path fallback) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--config") && i + 1 < args.length) {
                return Path.of(args[i + 1]);
            }
            if (arg.startsWith("--config=")) {
                return Path.of(arg.substring("--config=".length()));
            }
        }
        return fallback;
    }
}
