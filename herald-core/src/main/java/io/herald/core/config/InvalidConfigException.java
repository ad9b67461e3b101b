package io.herald.core.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * A config file that parses but holds values the scheduler cannot run with.
 */
public class InvalidConfigException extends IOException {
    private final List<String> problems;

    public InvalidConfigException(Path configPath, List<String> problems) {
        super("Invalid config " + configPath + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
