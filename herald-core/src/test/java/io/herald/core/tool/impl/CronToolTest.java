package io.herald.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.herald.core.delivery.DeliveryArbiter;
import io.herald.core.delivery.RecordingChannel;
import io.herald.core.execution.ExecutionSession;
import io.herald.core.job.DeliverPolicy;
import io.herald.core.job.FileJobStore;
import io.herald.core.job.Job;
import io.herald.core.job.JobDraft;
import io.herald.core.job.JobSchedule;
import io.herald.core.job.JobService;
import io.herald.core.schedule.ScheduleFactory;
import io.herald.core.tool.ToolContext;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CronToolTest {

    @TempDir
    Path tempDir;

    private final CronTool tool = new CronTool();
    private JobService jobService;
    private ToolContext context;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T10:00:00Z"), ZoneOffset.UTC);
        jobService = new JobService(
            new FileJobStore(tempDir.resolve("jobs.json")),
            clock,
            new ScheduleFactory(clock, ZoneOffset.UTC)
        );
        Job parent = new Job("a1b2c3d4", "chat", "chat", JobSchedule.every(60), DeliverPolicy.ALWAYS,
            "telegram", "42", true, Instant.EPOCH, null);
        ExecutionSession session = new ExecutionSession("s1", parent, Instant.EPOCH, Instant.EPOCH.plusSeconds(60),
            new DeliveryArbiter(DeliverPolicy.ALWAYS, new RecordingChannel("telegram"), "telegram", "42", "a1b2c3d4", "s1"));
        context = new ToolContext(session, Map.of("jobService", jobService));
    }

    @Test
    void shouldAddJobDeliveringToSessionDestination() throws Exception {
        String result = tool.execute(Map.of(
            "action", "add",
            "message", "Check whether the nightly backup failed",
            "cron_expr", "0 7 * * *",
            "tz", "Europe/Berlin",
            "deliver", "auto"
        ), context);

        assertThat(result).startsWith("Created job 'Check whether the nightly back'");
        Job job = jobService.list(true).get(0);
        assertThat(job.deliver()).isEqualTo(DeliverPolicy.AUTO);
        assertThat(job.channel()).isEqualTo("telegram");
        assertThat(job.to()).isEqualTo("42");
        assertThat(job.schedule()).isEqualTo(JobSchedule.cron("0 7 * * *", "Europe/Berlin"));
    }

    @Test
    void shouldFallBackToAlwaysForUnknownDeliverOnAdd() throws Exception {
        tool.execute(Map.of("action", "add", "message", "ping", "every_seconds", 60, "deliver", "sometimes"), context);

        assertThat(jobService.list(true).get(0).deliver()).isEqualTo(DeliverPolicy.ALWAYS);
    }

    @Test
    void shouldRequireSessionDestinationForAdd() throws Exception {
        ToolContext noSession = new ToolContext(null, Map.of("jobService", jobService));

        String result = tool.execute(Map.of("action", "add", "message", "ping", "every_seconds", 60), noSession);

        assertThat(result).startsWith("Error: no session context");
        assertThat(jobService.list(true)).isEmpty();
    }

    @Test
    void shouldReportValidationErrors() {
        assertThat(tool.execute(Map.of("action", "add", "message", "ping", "every_seconds", 60, "tz", "UTC"), context))
            .isEqualTo("Error: tz can only be used with cron_expr");
        assertThat(tool.execute(Map.of("action", "add", "message", "ping", "every_seconds", 0), context))
            .isEqualTo("Error: every_seconds must be at least 1");
        assertThat(tool.execute(Map.of("action", "add", "message", " ", "every_seconds", 60), context))
            .startsWith("Error: message is required");
        assertThat(tool.execute(Map.of("action", "explode"), context))
            .isEqualTo("Error: unsupported action: explode");
    }

    @Test
    void shouldUpdateOnlyGivenFields() throws Exception {
        Job job = jobService.add(JobDraft.of("ping", JobSchedule.every(60)).withName("heartbeat"));

        String result = tool.execute(Map.of("action", "update", "job_id", job.id(), "deliver", "never"), context);

        assertThat(result).isEqualTo("Updated job 'heartbeat' (" + job.id() + ")");
        Job updated = jobService.get(job.id());
        assertThat(updated.deliver()).isEqualTo(DeliverPolicy.NEVER);
        assertThat(updated.schedule()).isEqualTo(JobSchedule.every(60));
    }

    @Test
    void shouldRejectUnknownDeliverOnUpdate() throws Exception {
        Job job = jobService.add(JobDraft.of("ping", JobSchedule.every(60)));

        String result = tool.execute(Map.of("action", "update", "job_id", job.id(), "deliver", "sometimes"), context);

        assertThat(result).startsWith("Error: deliver must be one of");
        assertThat(jobService.get(job.id()).deliver()).isEqualTo(DeliverPolicy.ALWAYS);
    }

    @Test
    void shouldListDisableAndRemoveJobs() throws Exception {
        Job job = jobService.add(JobDraft.of("ping", JobSchedule.every(60)).withName("heartbeat"));

        assertThat(tool.execute(Map.of("action", "list"), context))
            .contains("heartbeat (id: " + job.id() + ", every 60s, deliver=always)");
        assertThat(tool.execute(Map.of("action", "disable", "job_id", job.id()), context)).startsWith("Disabled");
        assertThat(jobService.get(job.id()).enabled()).isFalse();
        assertThat(tool.execute(Map.of("action", "remove", "job_id", job.id()), context))
            .isEqualTo("Removed job " + job.id());
        assertThat(tool.execute(Map.of("action", "remove", "job_id", job.id()), context))
            .isEqualTo("Job " + job.id() + " not found");
        assertThat(tool.execute(Map.of("action", "list"), context)).isEqualTo("No scheduled jobs.");
    }
}
