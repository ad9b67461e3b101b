package io.herald.core.tool.impl;

import io.herald.core.execution.ExecutionSession;
import io.herald.core.job.DeliverPolicy;
import io.herald.core.job.Job;
import io.herald.core.job.JobDraft;
import io.herald.core.job.JobNotFoundException;
import io.herald.core.job.JobPatch;
import io.herald.core.job.JobSchedule;
import io.herald.core.job.JobService;
import io.herald.core.job.JobValidationException;
import io.herald.core.tool.Tool;
import io.herald.core.tool.ToolContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class CronTool implements Tool {

    @Override
    public String name() {
        return "cron";
    }

    @Override
    public String description() {
        return "Schedule reminders and recurring tasks. Actions: add, list, remove, update, enable, disable. "
            + "deliver: always (always send the response), auto (agent decides via the message tool), never.";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "action", Map.of(
                    "type", "string",
                    "enum", List.of("add", "list", "remove", "update", "enable", "disable")),
                "message", Map.of("type", "string", "description", "Job message (for add/update)"),
                "every_seconds", Map.of("type", "integer", "description", "Interval in seconds"),
                "cron_expr", Map.of("type", "string", "description", "Cron expression e.g. '0 9 * * *'"),
                "tz", Map.of("type", "string", "description", "IANA timezone for cron_expr"),
                "at", Map.of("type", "string", "description", "ISO datetime for a one-time run"),
                "job_id", Map.of("type", "string", "description", "Job id (for remove/update/enable/disable)"),
                "deliver", Map.of("type", "string", "enum", List.of("always", "auto", "never")),
                "name", Map.of("type", "string", "description", "Job name"),
                "enabled", Map.of("type", "boolean", "description", "Enable or disable the job (for update)")
            ),
            "required", List.of("action")
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        JobService jobService = context.service("jobService", JobService.class);
        if (jobService == null) {
            return "Error: job service is not configured";
        }
        String action = ToolInputs.string(input, "action");
        try {
            return switch (action) {
                case "add" -> add(jobService, input, context.session());
                case "list" -> list(jobService);
                case "remove" -> remove(jobService, input);
                case "update" -> update(jobService, input);
                case "enable" -> setEnabled(jobService, input, true);
                case "disable" -> setEnabled(jobService, input, false);
                default -> "Error: unsupported action: " + action;
            };
        } catch (JobNotFoundException e) {
            return "Job " + e.jobId() + " not found";
        } catch (Exception e) {
            return "Error: " + e.getMessage();
        }
    }

    private String add(JobService jobService, Map<String, Object> input, ExecutionSession session) throws Exception {
        String message = ToolInputs.string(input, "message");
        if (message.isBlank()) {
            return "Error: message is required for add and must be non-empty";
        }
        if (session == null || session.channel().isBlank() || session.to().isBlank()) {
            return "Error: no session context (channel/chat_id). Cron needs this to deliver responses.";
        }
        DeliverPolicy deliver;
        try {
            deliver = DeliverPolicy.from(ToolInputs.optionalString(input, "deliver"));
        } catch (JobValidationException e) {
            deliver = DeliverPolicy.ALWAYS;
        }
        JobSchedule schedule = jobService.schedules().fromFields(
            ToolInputs.optionalString(input, "cron_expr"),
            ToolInputs.optionalString(input, "tz"),
            ToolInputs.optionalLong(input, "every_seconds"),
            ToolInputs.optionalString(input, "at")
        );
        JobDraft draft = JobDraft.of(message, schedule)
            .withName(ToolInputs.optionalString(input, "name"))
            .withDeliver(deliver)
            .withDestination(session.channel(), session.to());
        Job job = jobService.add(draft);
        return "Created job '" + job.name() + "' (id: " + job.id() + ")";
    }

    private String list(JobService jobService) throws Exception {
        List<Job> jobs = jobService.list(true);
        if (jobs.isEmpty()) {
            return "No scheduled jobs.";
        }
        List<String> lines = new ArrayList<>();
        for (Job job : jobs) {
            lines.add("- " + job.name()
                + " (id: " + job.id()
                + ", " + job.schedule().describe()
                + ", deliver=" + job.deliver().value()
                + (job.enabled() ? "" : ", disabled")
                + ")");
        }
        return "Scheduled jobs:\n" + String.join("\n", lines);
    }

    private String remove(JobService jobService, Map<String, Object> input) throws Exception {
        String id = ToolInputs.string(input, "job_id");
        if (id.isBlank()) {
            return "Error: job_id is required for remove. Get IDs from cron(action='list').";
        }
        jobService.remove(id);
        return "Removed job " + id;
    }

    private String update(JobService jobService, Map<String, Object> input) throws Exception {
        String id = ToolInputs.string(input, "job_id");
        if (id.isBlank()) {
            return "Error: job_id is required for update. Example: cron(action='update', job_id='abc123', deliver='auto').";
        }
        JobPatch patch = JobPatch.empty()
            .withName(ToolInputs.optionalString(input, "name"))
            .withMessage(ToolInputs.optionalString(input, "message"))
            .withEnabled(ToolInputs.optionalFlag(input, "enabled"));

        String deliver = ToolInputs.optionalString(input, "deliver");
        if (deliver != null) {
            patch = patch.withDeliver(DeliverPolicy.from(deliver));
        }

        JobSchedule schedule = jobService.schedules().revise(
            jobService.get(id).schedule(),
            ToolInputs.optionalString(input, "cron_expr"),
            ToolInputs.optionalString(input, "tz"),
            ToolInputs.optionalLong(input, "every_seconds"),
            ToolInputs.optionalString(input, "at")
        );
        if (schedule != null) {
            patch = patch.withSchedule(schedule);
        }
        if (patch.isEmpty()) {
            return "Error: nothing to update for job " + id;
        }
        Job job = jobService.update(id, patch);
        return "Updated job '" + job.name() + "' (" + id + ")";
    }

    private String setEnabled(JobService jobService, Map<String, Object> input, boolean enabled) throws Exception {
        String id = ToolInputs.string(input, "job_id");
        if (id.isBlank()) {
            return "Error: job_id is required";
        }
        Job job = jobService.setEnabled(id, enabled);
        return (enabled ? "Enabled" : "Disabled") + " job '" + job.name() + "' (" + id + ")";
    }
}
