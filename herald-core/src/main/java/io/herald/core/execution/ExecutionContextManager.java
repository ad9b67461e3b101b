package io.herald.core.execution;

import io.herald.core.delivery.DeliveryArbiter;
import io.herald.core.delivery.DeliveryOutcome;
import io.herald.core.delivery.DeliveryState;
import io.herald.core.delivery.NotificationChannel;
import io.herald.core.job.DeliverPolicy;
import io.herald.core.job.Job;
import io.herald.core.model.AgentResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ExecutionContextManager implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionContextManager.class);

    private final AgentRunner runner;
    private final NotificationChannel channel;
    private final Clock clock;
    private final Duration timeout;
    private final ExecutorService sessions;

    public ExecutionContextManager(AgentRunner runner, NotificationChannel channel, Clock clock, Duration timeout) {
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? Duration.ofMinutes(5) : timeout;
        AtomicInteger counter = new AtomicInteger();
        this.sessions = Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, "herald-session-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public ExecutionSession open(Job job) {
        String sessionId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        DeliveryArbiter arbiter = new DeliveryArbiter(
            job.deliver(),
            channel,
            job.channel(),
            job.to(),
            job.id(),
            sessionId
        );
        return new ExecutionSession(sessionId, job, startedAt, startedAt.plus(timeout), arbiter);
    }

    public SessionOutcome execute(Job job) {
        ExecutionSession session = open(job);
        LOG.debug("Opened session {} for job {} (deliver={})", session.id(), job.id(), job.deliver().value());
        Future<AgentResult> future = sessions.submit(() -> runner.run(session));
        try {
            AgentResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            String content = result == null ? "" : result.content();
            deliverFinalResponse(session, content);
            session.close();
            return outcome(session, content, null);
        } catch (TimeoutException e) {
            future.cancel(true);
            session.close();
            LOG.warn("Session {} for job {} timed out after {}", session.id(), job.id(), timeout);
            throw failure(session, "session timed out after " + timeout.toSeconds() + "s", e);
        } catch (ExecutionException e) {
            session.close();
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw failure(session, "agent run failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            session.close();
            Thread.currentThread().interrupt();
            throw failure(session, "interrupted while waiting for the agent run", e);
        }
    }

    @Override
    public void close() {
        sessions.shutdownNow();
    }

    private void deliverFinalResponse(ExecutionSession session, String content) {
        if (session.deliverPolicy() != DeliverPolicy.ALWAYS
            || session.deliveryState() != DeliveryState.NOT_ATTEMPTED
            || content == null
            || content.isBlank()) {
            return;
        }
        DeliveryOutcome delivered = session.send(content, false);
        LOG.debug("Final response of session {}: {}", session.id(), delivered.status());
    }

    private JobExecutionException failure(ExecutionSession session, String message, Throwable cause) {
        SessionOutcome outcome = outcome(session, "", message);
        return new JobExecutionException("Job " + session.job().id() + ": " + message, outcome, cause);
    }

    private SessionOutcome outcome(ExecutionSession session, String content, String error) {
        return new SessionOutcome(
            session.id(),
            session.job().id(),
            session.deliverPolicy(),
            session.deliveryState(),
            session.confirmed(),
            content,
            error,
            session.startedAt(),
            clock.instant()
        );
    }
}
