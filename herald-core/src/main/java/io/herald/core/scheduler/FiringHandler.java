package io.herald.core.scheduler;

import io.herald.core.job.Job;

@FunctionalInterface
public interface FiringHandler {
    void fire(Job job) throws Exception;
}
