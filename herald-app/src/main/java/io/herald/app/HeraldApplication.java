package io.herald.app;

import io.herald.cli.CliContext;
import io.herald.cli.HeraldCli;
import io.herald.core.bus.InMemoryMessageBus;
import io.herald.core.bus.OutboundMessage;
import io.herald.core.config.ConfigPaths;
import io.herald.core.config.ConfigService;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.delivery.BusNotificationChannel;
import io.herald.core.delivery.ChannelRouter;
import io.herald.core.delivery.WebhookNotificationChannel;
import io.herald.core.execution.ExecutionContextManager;
import io.herald.core.execution.ReminderAgentRunner;
import io.herald.core.job.FileJobStore;
import io.herald.core.job.JobService;
import io.herald.core.job.bulk.BulkCodec;
import io.herald.core.schedule.ScheduleEvaluator;
import io.herald.core.schedule.ScheduleFactory;
import io.herald.core.scheduler.JobScheduler;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class HeraldApplication {
    private static final Logger LOG = LoggerFactory.getLogger(HeraldApplication.class);

    private HeraldApplication() {
    }

    public static void main(String[] args) {
        Path configPath = HeraldCli.configPathFrom(args, ConfigPaths.defaultConfigPath());
        ConfigService configService = new ConfigService();
        HeraldConfig config = loadConfig(configService, configPath);
        Clock clock = Clock.systemUTC();

        ScheduleEvaluator evaluator = new ScheduleEvaluator();
        ScheduleFactory schedules = new ScheduleFactory(clock, config.scheduler().zone(), evaluator);
        JobService jobService = new JobService(
            new FileJobStore(ConfigPaths.resolve(config.store().path())),
            clock,
            schedules
        );

        CliContext context = new CliContext(
            configService,
            configPath,
            jobService,
            evaluator,
            new BulkCodec(),
            () -> runScheduler(config, jobService, evaluator, clock),
            clock
        );

        int exitCode = HeraldCli.commandLine(context).execute(args);
        System.exit(exitCode);
    }

    private static HeraldConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Could not load config {}, using defaults: {}", configPath, e.getMessage());
            return HeraldConfig.defaults();
        }
    }

    private static int runScheduler(HeraldConfig config, JobService jobService, ScheduleEvaluator evaluator, Clock clock)
        throws InterruptedException {
        InMemoryMessageBus messageBus = new InMemoryMessageBus();
        ChannelRouter router = new ChannelRouter(config.channels().defaultChannel())
            .register(new BusNotificationChannel("console", messageBus, clock));
        if (config.channels().webhook().enabled()) {
            router.register(new WebhookNotificationChannel(
                "webhook",
                config.channels().webhook().url(),
                config.channels().webhook().headers()
            ));
        }

        ExecutionContextManager contextManager = new ExecutionContextManager(
            new ReminderAgentRunner(),
            router,
            clock,
            Duration.ofSeconds(config.scheduler().sessionTimeoutSeconds())
        );
        AtomicInteger firingCounter = new AtomicInteger();
        ExecutorService firingPool = Executors.newFixedThreadPool(config.scheduler().firingThreads(), task -> {
            Thread thread = new Thread(task, "herald-firing-" + firingCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        JobScheduler scheduler = new JobScheduler(
            jobService,
            evaluator,
            job -> contextManager.execute(job),
            firingPool,
            clock,
            Duration.ofSeconds(config.scheduler().maxIdleSeconds())
        );

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.close();
            contextManager.close();
            stopped.countDown();
        }, "herald-shutdown"));

        scheduler.start();
        System.out.println("Herald scheduler running with channels " + router.names() + " (Ctrl+C to stop)");
        while (!stopped.await(250, TimeUnit.MILLISECONDS)) {
            drain(messageBus);
        }
        drain(messageBus);
        return 0;
    }

    private static void drain(InMemoryMessageBus messageBus) {
        Optional<OutboundMessage> next = messageBus.poll();
        while (next.isPresent()) {
            OutboundMessage message = next.get();
            System.out.println("[" + message.channel() + ":" + message.to() + "] " + message.content());
            next = messageBus.poll();
        }
    }
}
