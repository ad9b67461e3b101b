package io.herald.core.tool.impl;

import io.herald.core.delivery.DeliveryOutcome;
import io.herald.core.execution.ExecutionSession;
import io.herald.core.tool.Tool;
import io.herald.core.tool.ToolContext;
import java.util.List;
import java.util.Map;

/**
 * The notification primitive of a job session. Every call goes through the session's delivery
 * arbiter, so the job's deliver policy decides whether the message leaves the process.
 */
public final class MessageTool implements Tool {

    @Override
    public String name() {
        return "message";
    }

    @Override
    public String description() {
        return "Send a message to the user. In a scheduled job with deliver=auto the first call returns a "
            + "confirmation prompt; call again with confirm_send=true only when the alert condition is met.";
    }

    @Override
    public Map<String, Object> schema() {
        return Map.of(
            "type", "object",
            "properties", Map.of(
                "content", Map.of("type", "string", "description", "The message content to send"),
                "channel", Map.of("type", "string", "description", "Optional target channel"),
                "chat_id", Map.of("type", "string", "description", "Optional target chat/user id"),
                "confirm_send", Map.of(
                    "type", "boolean",
                    "description", "For deliver=auto jobs: set true to confirm sending after the prompt")
            ),
            "required", List.of("content")
        );
    }

    @Override
    public String execute(Map<String, Object> input, ToolContext context) {
        ExecutionSession session = context.session();
        if (session == null) {
            return "Error: no active execution session; message was not sent";
        }
        String content = ToolInputs.string(input, "content");
        if (content.isBlank()) {
            return "Error: content is required";
        }
        DeliveryOutcome outcome = session.arbiter().attempt(
            content,
            ToolInputs.flag(input, "confirm_send"),
            ToolInputs.optionalString(input, "channel"),
            ToolInputs.optionalString(input, "chat_id")
        );
        return outcome.message();
    }
}
