package io.herald.core.execution;

import io.herald.core.delivery.DeliveryArbiter;
import io.herald.core.delivery.DeliveryOutcome;
import io.herald.core.delivery.DeliveryState;
import io.herald.core.job.DeliverPolicy;
import io.herald.core.job.Job;
import java.time.Instant;

/**
 * Context of a single job firing. The deliver policy and the arbiter belong to the session and
 * stop accepting notification attempts once the session is closed.
 */
public final class ExecutionSession {
    private final String id;
    private final Job job;
    private final Instant startedAt;
    private final Instant deadline;
    private final DeliveryArbiter arbiter;

    public ExecutionSession(String id, Job job, Instant startedAt, Instant deadline, DeliveryArbiter arbiter) {
        this.id = id;
        this.job = job;
        this.startedAt = startedAt;
        this.deadline = deadline;
        this.arbiter = arbiter;
    }

    public String id() {
        return id;
    }

    public Job job() {
        return job;
    }

    public String message() {
        return job.message();
    }

    public DeliverPolicy deliverPolicy() {
        return arbiter.policy();
    }

    public String channel() {
        return job.channel();
    }

    public String to() {
        return job.to();
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant deadline() {
        return deadline;
    }

    public DeliveryArbiter arbiter() {
        return arbiter;
    }

    public DeliveryOutcome send(String content, boolean confirm) {
        return arbiter.attempt(content, confirm);
    }

    public DeliveryState deliveryState() {
        return arbiter.state();
    }

    public boolean confirmed() {
        return arbiter.confirmed();
    }

    public boolean closed() {
        return arbiter.closed();
    }

    void close() {
        arbiter.close();
    }
}
