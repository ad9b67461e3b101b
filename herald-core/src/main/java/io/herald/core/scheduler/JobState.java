package io.herald.core.scheduler;

public enum JobState {
    IDLE,
    DUE,
    FIRING,
    EXHAUSTED
}
