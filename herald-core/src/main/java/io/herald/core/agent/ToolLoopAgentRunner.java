package io.herald.core.agent;

import io.herald.core.execution.AgentRunner;
import io.herald.core.execution.ExecutionSession;
import io.herald.core.job.DeliverPolicy;
import io.herald.core.model.AgentResult;
import io.herald.core.model.ChatMessage;
import io.herald.core.model.ToolCall;
import io.herald.core.provider.LlmProvider;
import io.herald.core.provider.LlmResponse;
import io.herald.core.tool.Tool;
import io.herald.core.tool.ToolContext;
import io.herald.core.tool.ToolRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a job message through a model, executing the tool calls it asks for until it answers
 * without any or the iteration limit is reached.
 */
public final class ToolLoopAgentRunner implements AgentRunner {
    private static final Logger LOG = LoggerFactory.getLogger(ToolLoopAgentRunner.class);
    static final String ITERATION_LIMIT_MESSAGE = "Stopped after max tool iterations";

    private final LlmProvider provider;
    private final ToolRegistry toolRegistry;
    private final Map<String, Object> toolServices;
    private final AgentSettings settings;

    public ToolLoopAgentRunner(
        LlmProvider provider,
        ToolRegistry toolRegistry,
        Map<String, Object> toolServices,
        AgentSettings settings
    ) {
        this.provider = provider;
        this.toolRegistry = toolRegistry;
        this.toolServices = toolServices == null ? Map.of() : Map.copyOf(toolServices);
        this.settings = settings == null ? AgentSettings.defaults() : settings;
    }

    @Override
    public AgentResult run(ExecutionSession session) {
        List<ChatMessage> transcript = new ArrayList<>();
        transcript.add(ChatMessage.system(buildSystemPrompt(session)));
        transcript.add(ChatMessage.user(session.message()));
        ToolContext toolContext = new ToolContext(session, toolServices);
        LOG.debug("Session {} using provider {} with model {}", session.id(), provider.name(), settings.model());

        Map<String, Object> usage = Map.of();
        for (int i = 0; i < settings.maxToolIterations(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                LOG.debug("Session {} interrupted after {} iterations", session.id(), i);
                break;
            }
            LlmResponse response = provider.chat(settings.model(), transcript, toolRegistry.definitions());
            usage = response.usage();

            if (response.toolCalls().isEmpty()) {
                String content = response.content() == null ? "" : response.content();
                transcript.add(ChatMessage.assistant(content));
                return new AgentResult(content, transcript, usage);
            }

            transcript.add(ChatMessage.assistantWithToolCalls(response.content(), response.toolCalls()));
            for (ToolCall call : response.toolCalls()) {
                transcript.add(ChatMessage.tool(executeTool(call, toolContext), call.id()));
            }
        }

        transcript.add(ChatMessage.assistant(ITERATION_LIMIT_MESSAGE));
        return new AgentResult(ITERATION_LIMIT_MESSAGE, transcript, usage);
    }

    private String executeTool(ToolCall call, ToolContext context) {
        return toolRegistry.find(call.name())
            .map(tool -> safelyExecute(tool, call.arguments(), context))
            .orElse("Error: Tool '" + call.name() + "' not found");
    }

    private String safelyExecute(Tool tool, Map<String, Object> input, ToolContext context) {
        try {
            return tool.execute(input, context);
        } catch (RuntimeException ex) {
            LOG.warn("Tool {} failed", tool.name(), ex);
            return "Error executing tool '" + tool.name() + "': " + ex.getMessage();
        }
    }

    private String buildSystemPrompt(ExecutionSession session) {
        StringBuilder prompt = new StringBuilder(settings.systemPrompt());
        prompt.append("\n\n## Scheduled job\n")
            .append("- id: ").append(session.job().id()).append('\n')
            .append("- name: ").append(session.job().name()).append('\n')
            .append("- deliver: ").append(session.deliverPolicy().value()).append('\n');
        if (session.deliverPolicy() == DeliverPolicy.AUTO) {
            prompt.append("\nThis job uses deliver=auto: only notify the user when the alert condition in the "
                + "job message is met. The message tool asks for confirmation first; confirm with "
                + "confirm_send=true only when the condition holds.");
        } else if (session.deliverPolicy() == DeliverPolicy.NEVER) {
            prompt.append("\nThis job uses deliver=never: nothing you send will reach the user.");
        }
        return prompt.toString();
    }
}
