package io.herald.core.execution;

import io.herald.core.delivery.DeliveryState;
import io.herald.core.job.DeliverPolicy;
import java.time.Instant;

public record SessionOutcome(
    String sessionId,
    String jobId,
    DeliverPolicy deliverPolicy,
    DeliveryState deliveryState,
    boolean confirmed,
    String content,
    String error,
    Instant startedAt,
    Instant endedAt
) {

    public boolean succeeded() {
        return error == null;
    }
}
