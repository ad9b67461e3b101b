package io.herald.core.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DeliverPolicy {
    ALWAYS("always"),
    AUTO("auto"),
    NEVER("never");

    private final String value;

    DeliverPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static DeliverPolicy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALWAYS;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DeliverPolicy policy : values()) {
            if (policy.value.equals(normalized)) {
                return policy;
            }
        }
        throw new JobValidationException("deliver must be one of: always, auto, never (got '" + raw + "')");
    }
}
