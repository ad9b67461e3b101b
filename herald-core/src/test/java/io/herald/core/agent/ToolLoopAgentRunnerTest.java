package io.herald.core.agent;

import static org.assertj.core.api.Assertions.assertThat;

import io.herald.core.delivery.DeliveryArbiter;
import io.herald.core.delivery.Notification;
import io.herald.core.delivery.RecordingChannel;
import io.herald.core.execution.ExecutionSession;
import io.herald.core.job.DeliverPolicy;
import io.herald.core.job.Job;
import io.herald.core.job.JobSchedule;
import io.herald.core.model.AgentResult;
import io.herald.core.model.ChatMessage;
import io.herald.core.model.MessageRole;
import io.herald.core.model.ToolCall;
import io.herald.core.provider.LlmProvider;
import io.herald.core.provider.LlmResponse;
import io.herald.core.tool.ToolRegistry;
import io.herald.core.tool.impl.MessageTool;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolLoopAgentRunnerTest {
    private final RecordingChannel channel = new RecordingChannel("console");

    @Test
    void shouldConfirmAndSendAlertThroughMessageTool() {
        ScriptedProvider provider = new ScriptedProvider(
            toolCall("message", Map.of("content", "Disk usage at 97%")),
            toolCall("message", Map.of("content", "Disk usage at 97%", "confirm_send", true)),
            new LlmResponse("Alert sent.", List.of(), Map.of("total_tokens", 42))
        );
        ToolLoopAgentRunner runner = runner(provider, 5);

        AgentResult result = runner.run(session(DeliverPolicy.AUTO));

        assertThat(result.content()).isEqualTo("Alert sent.");
        assertThat(result.usage()).containsEntry("total_tokens", 42);
        assertThat(channel.delivered()).extracting(Notification::content).containsExactly("Disk usage at 97%");
        assertThat(result.transcript()).filteredOn(message -> message.role() == MessageRole.TOOL)
            .extracting(ChatMessage::content)
            .satisfiesExactly(
                first -> assertThat(first).startsWith("[CONFIRM_NEEDED]"),
                second -> assertThat(second).startsWith("Message sent to"));
    }

    @Test
    void shouldDescribeDeliverPolicyInSystemPrompt() {
        ScriptedProvider provider = new ScriptedProvider(new LlmResponse("nothing to report", List.of(), Map.of()));

        AgentResult result = runner(provider, 5).run(session(DeliverPolicy.AUTO));

        ChatMessage system = result.transcript().get(0);
        assertThat(system.role()).isEqualTo(MessageRole.SYSTEM);
        assertThat(system.content()).contains("deliver=auto");
        assertThat(result.transcript().get(1).content()).isEqualTo("check disk usage");
        assertThat(channel.delivered()).isEmpty();
    }

    @Test
    void shouldReportUnknownTools() {
        ScriptedProvider provider = new ScriptedProvider(
            toolCall("teleport", Map.of()),
            new LlmResponse("done", List.of(), Map.of())
        );

        AgentResult result = runner(provider, 5).run(session(DeliverPolicy.ALWAYS));

        assertThat(result.transcript()).extracting(ChatMessage::content)
            .contains("Error: Tool 'teleport' not found");
    }

    @Test
    void shouldStopAfterMaxIterations() {
        ScriptedProvider provider = new ScriptedProvider(
            toolCall("message", Map.of("content", "a")),
            toolCall("message", Map.of("content", "b")),
            toolCall("message", Map.of("content", "c"))
        );

        AgentResult result = runner(provider, 2).run(session(DeliverPolicy.NEVER));

        assertThat(result.content()).isEqualTo("Stopped after max tool iterations");
        assertThat(provider.calls).isEqualTo(2);
    }

    private ToolLoopAgentRunner runner(LlmProvider provider, int maxIterations) {
        ToolRegistry tools = new ToolRegistry().register(new MessageTool());
        return new ToolLoopAgentRunner(provider, tools, Map.of(), new AgentSettings("system", "test-model", maxIterations));
    }

    private ExecutionSession session(DeliverPolicy policy) {
        Job job = new Job("a1b2c3d4", "disk", "check disk usage", JobSchedule.every(300), policy, "console", "ops",
            true, Instant.EPOCH, null);
        DeliveryArbiter arbiter = new DeliveryArbiter(policy, channel, "console", "ops", job.id(), "s1");
        return new ExecutionSession("s1", job, Instant.EPOCH, Instant.EPOCH.plusSeconds(60), arbiter);
    }

    private static LlmResponse toolCall(String name, Map<String, Object> arguments) {
        return new LlmResponse("", List.of(new ToolCall("call-" + name, name, arguments)), Map.of());
    }

    private static final class ScriptedProvider implements LlmProvider {
        private final Deque<LlmResponse> responses;
        private int calls;

        private ScriptedProvider(LlmResponse... responses) {
            this.responses = new ArrayDeque<>(List.of(responses));
        }

        @Override
        public String name() {
            return "scripted";
        }

        @Override
        public LlmResponse chat(String model, List<ChatMessage> messages, List<Map<String, Object>> tools) {
            calls++;
            return responses.isEmpty() ? new LlmResponse("", List.of(), Map.of()) : responses.poll();
        }
    }
}
