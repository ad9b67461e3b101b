package io.herald.core.execution;

public class JobExecutionException extends RuntimeException {
    private final transient SessionOutcome outcome;

    public JobExecutionException(String message, SessionOutcome outcome, Throwable cause) {
        super(message, cause);
        this.outcome = outcome;
    }

    public SessionOutcome outcome() {
        return outcome;
    }
}
