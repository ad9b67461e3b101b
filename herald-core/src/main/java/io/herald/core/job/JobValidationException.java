package io.herald.core.job;

public class JobValidationException extends IllegalArgumentException {
    private final String entry;

    public JobValidationException(String message) {
        this(null, message);
    }

    public JobValidationException(String entry, String message) {
        super(entry == null ? message : entry + ": " + message);
        this.entry = entry;
    }

    public String entry() {
        return entry;
    }
}
