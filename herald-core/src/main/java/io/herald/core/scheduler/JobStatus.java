package io.herald.core.scheduler;

import java.time.Instant;

public record JobStatus(String jobId, boolean enabled, JobState state, Instant nextFireAt) {
}
