package io.herald.cli;

import io.herald.core.config.ConfigPaths;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.job.Job;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and job store status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            HeraldConfig config = context.configService().load(context.configPath());
            List<Job> jobs = context.jobService().list(true);
            long enabled = jobs.stream().filter(Job::enabled).count();
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Job store: " + ConfigPaths.resolve(config.store().path()));
            System.out.println("Default timezone: " + config.scheduler().zone().getId());
            System.out.println("Default channel: " + config.channels().defaultChannel());
            System.out.println("Webhook configured: " + config.channels().webhook().enabled());
            System.out.println("Jobs: " + jobs.size() + " (" + enabled + " enabled)");
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
