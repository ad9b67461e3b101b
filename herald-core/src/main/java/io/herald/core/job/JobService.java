package io.herald.core.job;

import io.herald.core.job.bulk.BulkMapper;
import io.herald.core.job.bulk.JobEntry;
import io.herald.core.job.bulk.JobsDocument;
import io.herald.core.schedule.ScheduleFactory;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable collection of jobs. Every operation reads the store afresh, so changes written by another
 * process (the management CLI next to a running scheduler) are seen by the next call and never
 * overwritten by a stale copy. Within one process reads share a lock and writes are exclusive.
 */
public final class JobService {
    private static final Logger LOG = LoggerFactory.getLogger(JobService.class);
    private static final int DEFAULT_NAME_LENGTH = 30;

    private final JobStore store;
    private final Clock clock;
    private final ScheduleFactory schedules;
    private final BulkMapper bulkMapper;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public JobService(JobStore store, Clock clock, ScheduleFactory schedules) {
        this.store = store;
        this.clock = clock;
        this.schedules = schedules;
        this.bulkMapper = new BulkMapper(schedules);
    }

    public ScheduleFactory schedules() {
        return schedules;
    }

    public void addListener(Runnable listener) {
        listeners.add(listener);
    }

    public Job add(JobDraft draft) throws IOException {
        validate(draft, null);
        lock.writeLock().lock();
        try {
            Map<String, Job> next = loaded();
            Job job = create(draft, next.keySet());
            next.put(job.id(), job);
            commit(next);
            LOG.info("Added job {} ({}, deliver={})", job.id(), job.schedule().describe(), job.deliver().value());
            return job;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Job get(String id) throws IOException {
        return find(id).orElseThrow(() -> new JobNotFoundException(id));
    }

    public Optional<Job> find(String id) throws IOException {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(loaded().get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Job> list(boolean includeDisabled) throws IOException {
        lock.readLock().lock();
        try {
            return loaded().values().stream()
                .filter(job -> includeDisabled || job.enabled())
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Job update(String id, JobPatch patch) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, Job> next = loaded();
            Job current = Optional.ofNullable(next.get(id)).orElseThrow(() -> new JobNotFoundException(id));
            Job updated = apply(current, patch);
            validate(new JobDraft(
                updated.name(), updated.message(), updated.schedule(), updated.deliver(),
                updated.channel(), updated.to(), updated.enabled()), null);
            if (updated.equals(current)) {
                return current;
            }
            next.put(id, updated);
            commit(next);
            LOG.info("Updated job {}", id);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Job setEnabled(String id, boolean enabled) throws IOException {
        return update(id, JobPatch.empty().withEnabled(enabled));
    }

    public void remove(String id) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, Job> next = loaded();
            if (next.remove(id) == null) {
                throw new JobNotFoundException(id);
            }
            commit(next);
            LOG.info("Removed job {}", id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records that the job fired at {@code firedAt} under {@code firedSchedule}. A one-shot that was
     * re-armed with a different time while the firing ran keeps its cleared {@code last_fired_at}.
     *
     * @return the stored job after the update, or empty when the job was removed meanwhile
     */
    public Optional<Job> markFired(String id, JobSchedule firedSchedule, Instant firedAt) throws IOException {
        lock.writeLock().lock();
        try {
            Map<String, Job> next = loaded();
            Job current = next.get(id);
            if (current == null) {
                return Optional.empty();
            }
            if (current.schedule().oneShot() && !current.schedule().equals(firedSchedule)) {
                LOG.debug("Job {} was re-armed while firing; keeping it pending", id);
                return Optional.of(current);
            }
            Job fired = current.withLastFiredAt(firedAt);
            next.put(id, fired);
            commit(next);
            return Optional.of(fired);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public JobsDocument export(Set<String> ids, boolean includeDisabled) throws IOException {
        lock.readLock().lock();
        try {
            Map<String, Job> current = loaded();
            List<JobEntry> entries = new ArrayList<>();
            if (ids != null && !ids.isEmpty()) {
                for (String id : ids) {
                    Job job = current.get(id);
                    if (job == null) {
                        throw new JobNotFoundException(id);
                    }
                    entries.add(bulkMapper.toEntry(job));
                }
            } else {
                current.values().stream()
                    .filter(job -> includeDisabled || job.enabled())
                    .map(bulkMapper::toEntry)
                    .forEach(entries::add);
            }
            return new JobsDocument(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> importJobs(JobsDocument document) throws IOException {
        List<JobEntry> entries = document == null || document.jobs() == null ? List.of() : document.jobs();
        List<JobDraft> drafts = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            String label = "jobs[" + i + "]";
            JobDraft draft = bulkMapper.toDraft(entries.get(i), label);
            validate(draft, label);
            drafts.add(draft);
        }

        lock.writeLock().lock();
        try {
            Map<String, Job> next = loaded();
            List<String> ids = new ArrayList<>();
            for (JobDraft draft : drafts) {
                Job job = create(draft, next.keySet());
                next.put(job.id(), job);
                ids.add(job.id());
            }
            if (!ids.isEmpty()) {
                commit(next);
            }
            LOG.info("Imported {} jobs", ids.size());
            return List.copyOf(ids);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Job create(JobDraft draft, Collection<String> takenIds) {
        String name = draft.name() == null || draft.name().isBlank()
            ? defaultName(draft.message())
            : draft.name().trim();
        return new Job(
            newId(takenIds),
            name,
            draft.message().trim(),
            draft.schedule(),
            draft.deliver(),
            draft.channel(),
            draft.to(),
            draft.enabled(),
            clock.instant(),
            null
        );
    }

    private Job apply(Job current, JobPatch patch) {
        if (patch == null || patch.isEmpty()) {
            return current;
        }
        JobSchedule schedule = patch.schedule() != null ? patch.schedule() : current.schedule();
        Instant lastFiredAt = current.lastFiredAt();
        if (patch.schedule() != null && patch.schedule().oneShot() && !patch.schedule().equals(current.schedule())) {
            lastFiredAt = null;
        }
        return new Job(
            current.id(),
            patch.name() != null ? patch.name().trim() : current.name(),
            patch.message() != null ? patch.message().trim() : current.message(),
            schedule,
            patch.deliver() != null ? patch.deliver() : current.deliver(),
            patch.channel() != null ? patch.channel() : current.channel(),
            patch.to() != null ? patch.to() : current.to(),
            patch.enabled() != null ? patch.enabled() : current.enabled(),
            current.createdAt(),
            lastFiredAt
        );
    }

    private void validate(JobDraft draft, String entry) {
        try {
            if (draft.message() == null || draft.message().isBlank()) {
                throw new JobValidationException("message is required and must be non-empty");
            }
            if (draft.deliver() == null) {
                throw new JobValidationException("deliver is required");
            }
            schedules.validate(draft.schedule());
        } catch (JobValidationException e) {
            if (entry == null || e.entry() != null) {
                throw e;
            }
            throw new JobValidationException(entry, e.getMessage());
        }
    }

    private Map<String, Job> loaded() throws IOException {
        Map<String, Job> current = new LinkedHashMap<>();
        for (Job job : store.load()) {
            current.put(job.id(), job);
        }
        return current;
    }

    private void commit(Map<String, Job> next) throws IOException {
        try {
            store.save(List.copyOf(next.values()));
        } catch (IOException e) {
            LOG.error("Failed to persist job store", e);
            throw e;
        }
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                LOG.warn("Job change listener failed", e);
            }
        }
    }

    private static String newId(Collection<String> takenIds) {
        String id;
        do {
            id = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        } while (takenIds.contains(id));
        return id;
    }

    private static String defaultName(String message) {
        String trimmed = message.trim();
        return trimmed.length() <= DEFAULT_NAME_LENGTH ? trimmed : trimmed.substring(0, DEFAULT_NAME_LENGTH);
    }
}
