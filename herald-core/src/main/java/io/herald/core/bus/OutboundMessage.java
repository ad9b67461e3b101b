package io.herald.core.bus;

import java.time.Instant;

public record OutboundMessage(
    String channel,
    String to,
    String content,
    String jobId,
    String sessionId,
    Instant createdAt
) {
}
