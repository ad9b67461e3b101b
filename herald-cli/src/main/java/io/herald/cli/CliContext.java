package io.herald.cli;

import io.herald.core.config.ConfigService;
import io.herald.core.job.JobService;
import io.herald.core.job.bulk.BulkCodec;
import io.herald.core.schedule.ScheduleEvaluator;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    JobService jobService,
    ScheduleEvaluator evaluator,
    BulkCodec bulkCodec,
    SchedulerRunner schedulerRunner,
    Clock clock
) {
    public CliContext(ConfigService configService, Path configPath, JobService jobService, ScheduleEvaluator evaluator) {
        this(configService, configPath, jobService, evaluator, new BulkCodec(), () -> {
            throw new UnsupportedOperationException("scheduler runner is not configured");
        }, Clock.systemUTC());
    }
}
