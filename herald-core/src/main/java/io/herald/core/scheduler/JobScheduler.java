package io.herald.core.scheduler;

import io.herald.core.job.Job;
import io.herald.core.job.JobService;
import io.herald.core.schedule.ScheduleEvaluator;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fires enabled jobs when their next fire time passes.
 *
 * <p>A job has at most one firing in flight. An occurrence that comes due while the job is still
 * firing is deferred until that firing completes, and several such occurrences collapse into one.
 * {@code last_fired_at} records the trigger time and is written after the firing completes.
 */
public final class JobScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);

    private final JobService jobService;
    private final ScheduleEvaluator evaluator;
    private final FiringHandler handler;
    private final Executor firingExecutor;
    private final Clock clock;
    private final Duration maxIdle;

    private final Map<String, JobRuntime> runtimes = new HashMap<>();
    private final ReentrantLock wakeLock = new ReentrantLock();
    private final Condition wakeCondition = wakeLock.newCondition();
    private boolean wakeRequested;

    private volatile boolean running;
    private Thread loopThread;

    public JobScheduler(
        JobService jobService,
        ScheduleEvaluator evaluator,
        FiringHandler handler,
        Executor firingExecutor,
        Clock clock,
        Duration maxIdle
    ) {
        this.jobService = Objects.requireNonNull(jobService, "jobService must not be null");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
        this.firingExecutor = Objects.requireNonNull(firingExecutor, "firingExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxIdle = maxIdle == null || maxIdle.isNegative() || maxIdle.isZero() ? Duration.ofSeconds(60) : maxIdle;
        jobService.addListener(this::wake);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread = new Thread(this::loop, "herald-scheduler");
        loopThread.setDaemon(true);
        loopThread.start();
    }

    public boolean running() {
        return running;
    }

    /**
     * Runs one scheduling cycle and returns how many firings were dispatched.
     */
    public int runDue() {
        Instant now = clock.instant();
        List<Job> snapshot;
        try {
            snapshot = jobService.list(true);
        } catch (IOException e) {
            LOG.error("Failed to load jobs for scheduling", e);
            return 0;
        }

        List<Job> due = new ArrayList<>();
        synchronized (runtimes) {
            refresh(snapshot, now);
            runtimes.values().stream()
                .filter(runtime -> runtime.state != JobState.FIRING && runtime.job.enabled())
                .filter(runtime -> runtime.nextFireAt != null && !runtime.nextFireAt.isAfter(now))
                .sorted(Comparator.comparing((JobRuntime runtime) -> runtime.nextFireAt))
                .forEach(runtime -> {
                    runtime.state = JobState.FIRING;
                    due.add(runtime.job);
                });
        }

        for (Job job : due) {
            dispatch(job, now);
        }
        return due.size();
    }

    public void wake() {
        wakeLock.lock();
        try {
            wakeRequested = true;
            wakeCondition.signalAll();
        } finally {
            wakeLock.unlock();
        }
    }

    public List<JobStatus> status() {
        synchronized (runtimes) {
            return runtimes.values().stream()
                .map(this::toStatus)
                .sorted(Comparator.comparing(JobStatus::jobId))
                .toList();
        }
    }

    public Optional<JobStatus> status(String jobId) {
        synchronized (runtimes) {
            return Optional.ofNullable(runtimes.get(jobId)).map(this::toStatus);
        }
    }

    public Optional<Instant> nextFireTime(String jobId) {
        return status(jobId).map(JobStatus::nextFireAt);
    }

    @Override
    public void close() {
        Thread thread;
        synchronized (this) {
            running = false;
            thread = loopThread;
            loopThread = null;
        }
        wake();
        if (thread != null) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (firingExecutor instanceof ExecutorService service) {
            service.shutdown();
            try {
                if (!service.awaitTermination(30, TimeUnit.SECONDS)) {
                    LOG.warn("Firings still running after shutdown timeout");
                    service.shutdownNow();
                }
            } catch (InterruptedException e) {
                service.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Scheduler stopped");
    }

    private void loop() {
        LOG.info("Scheduler started");
        while (running) {
            try {
                runDue();
            } catch (RuntimeException e) {
                LOG.error("Scheduling cycle failed", e);
            }
            awaitNextWake();
        }
    }

    private void awaitNextWake() {
        Duration wait = maxIdle;
        Instant next = earliestNextFire();
        if (next != null) {
            Duration untilNext = Duration.between(clock.instant(), next);
            if (untilNext.isNegative()) {
                untilNext = Duration.ZERO;
            }
            if (untilNext.compareTo(wait) < 0) {
                wait = untilNext;
            }
        }

        wakeLock.lock();
        try {
            if (!wakeRequested && running && !wait.isZero()) {
                wakeCondition.await(wait.toMillis(), TimeUnit.MILLISECONDS);
            }
            wakeRequested = false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        } finally {
            wakeLock.unlock();
        }
    }

    private Instant earliestNextFire() {
        synchronized (runtimes) {
            return runtimes.values().stream()
                .filter(runtime -> runtime.state != JobState.FIRING && runtime.job.enabled())
                .map(runtime -> runtime.nextFireAt)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);
        }
    }

    private void refresh(List<Job> snapshot, Instant now) {
        Set<String> present = new HashSet<>();
        for (Job job : snapshot) {
            present.add(job.id());
            JobRuntime runtime = runtimes.get(job.id());
            if (runtime == null) {
                runtime = new JobRuntime(job);
                runtimes.put(job.id(), runtime);
                recompute(runtime, job.lastFiredAt(), now);
            } else if (runtime.state == JobState.FIRING) {
                runtime.job = job;
            } else if (!runtime.job.equals(job)) {
                runtime.job = job;
                recompute(runtime, job.lastFiredAt(), now);
            } else if (runtime.state == JobState.IDLE && runtime.nextFireAt != null && !runtime.nextFireAt.isAfter(now)) {
                runtime.state = JobState.DUE;
            }
        }
        runtimes.entrySet().removeIf(entry ->
            !present.contains(entry.getKey()) && entry.getValue().state != JobState.FIRING);
    }

    private void recompute(JobRuntime runtime, Instant lastFiredAt, Instant now) {
        Job job = runtime.job;
        if (!job.enabled()) {
            runtime.nextFireAt = null;
            runtime.state = JobState.IDLE;
            return;
        }
        Optional<Instant> next;
        try {
            next = evaluator.nextFireTime(job.schedule(), lastFiredAt, now);
        } catch (RuntimeException e) {
            LOG.warn("Cannot evaluate schedule of job {}: {}", job.id(), e.getMessage());
            next = Optional.empty();
        }
        if (next.isEmpty()) {
            runtime.nextFireAt = null;
            runtime.state = JobState.EXHAUSTED;
            return;
        }
        runtime.nextFireAt = next.get();
        runtime.state = runtime.nextFireAt.isAfter(now) ? JobState.IDLE : JobState.DUE;
    }

    private void dispatch(Job job, Instant triggeredAt) {
        try {
            firingExecutor.execute(() -> fire(job, triggeredAt));
        } catch (RejectedExecutionException e) {
            LOG.warn("Firing of job {} rejected: {}", job.id(), e.getMessage());
            synchronized (runtimes) {
                JobRuntime runtime = runtimes.get(job.id());
                if (runtime != null) {
                    runtime.state = JobState.DUE;
                }
            }
        }
    }

    private void fire(Job job, Instant triggeredAt) {
        LOG.info("Firing job {} ({}) scheduled {}", job.id(), job.name(), job.schedule().describe());
        try {
            handler.fire(job);
        } catch (Exception e) {
            LOG.warn("Firing of job {} failed", job.id(), e);
        } finally {
            complete(job, triggeredAt);
        }
    }

    private void complete(Job fired, Instant triggeredAt) {
        Optional<Job> latest;
        try {
            latest = jobService.markFired(fired.id(), fired.schedule(), triggeredAt);
        } catch (IOException e) {
            LOG.error("Failed to record firing of job {}", fired.id(), e);
            latest = Optional.of(fired.withLastFiredAt(triggeredAt));
        }

        synchronized (runtimes) {
            JobRuntime runtime = runtimes.get(fired.id());
            if (latest.isEmpty()) {
                LOG.debug("Job {} was removed while firing", fired.id());
                runtimes.remove(fired.id());
            } else if (runtime != null) {
                runtime.job = latest.get();
                recompute(runtime, latest.get().lastFiredAt(), triggeredAt);
            }
        }
        wake();
    }

    private JobStatus toStatus(JobRuntime runtime) {
        return new JobStatus(runtime.job.id(), runtime.job.enabled(), runtime.state, runtime.nextFireAt);
    }

    private static final class JobRuntime {
        private Job job;
        private Instant nextFireAt;
        private JobState state = JobState.IDLE;

        private JobRuntime(Job job) {
            this.job = job;
        }
    }
}
