package io.herald.core.tool.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.herald.core.delivery.DeliveryArbiter;
import io.herald.core.delivery.RecordingChannel;
import io.herald.core.execution.ExecutionSession;
import io.herald.core.job.DeliverPolicy;
import io.herald.core.job.Job;
import io.herald.core.job.JobSchedule;
import io.herald.core.tool.ToolContext;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MessageToolTest {
    private final RecordingChannel channel = new RecordingChannel("console");
    private final MessageTool tool = new MessageTool();

    @Test
    void shouldRequireActiveSession() {
        String result = tool.execute(Map.of("content", "hello"), new ToolContext(null, Map.of()));

        assertThat(result).startsWith("Error:");
    }

    @Test
    void shouldRequireContent() {
        String result = tool.execute(Map.of(), context(DeliverPolicy.ALWAYS));

        assertThat(result).isEqualTo("Error: content is required");
    }

    @Test
    void shouldWalkConfirmationHandshakeUnderAuto() {
        ToolContext context = context(DeliverPolicy.AUTO);

        String first = tool.execute(Map.of("content", "Price dropped below 100"), context);
        String second = tool.execute(
            Map.of("content", "Price dropped below 100", "confirm_send", "true"),
            context
        );

        assertThat(first).startsWith("[CONFIRM_NEEDED]");
        assertThat(second).isEqualTo("Message sent to console:ops");
        assertThat(channel.delivered()).hasSize(1);
    }

    @Test
    void shouldRouteToOverriddenDestination() {
        String result = tool.execute(
            Map.of("content", "hi", "channel", "webhook", "chat_id", "team"),
            context(DeliverPolicy.ALWAYS)
        );

        assertThat(result).isEqualTo("Message sent to webhook:team");
        assertThat(channel.delivered().get(0).to()).isEqualTo("team");
    }

    @Test
    void shouldAcknowledgeWithoutSendingUnderNever() {
        String result = tool.execute(Map.of("content", "hi", "confirm_send", true), context(DeliverPolicy.NEVER));

        assertThat(result).contains("deliver=never");
        assertThat(channel.delivered()).isEmpty();
    }

    private ToolContext context(DeliverPolicy policy) {
        Job job = new Job("a1b2c3d4", "watch", "watch price", JobSchedule.every(60), policy, "console", "ops",
            true, Instant.EPOCH, null);
        DeliveryArbiter arbiter = new DeliveryArbiter(policy, channel, "console", "ops", job.id(), "s1");
        ExecutionSession session = new ExecutionSession("s1", job, Instant.EPOCH, Instant.EPOCH.plusSeconds(60), arbiter);
        return new ToolContext(session, Map.of());
    }
}
