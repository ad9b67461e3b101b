package io.herald.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path home() {
        return Path.of(System.getProperty("user.home"), ".herald");
    }

    public static Path defaultConfigPath() {
        return home().resolve("config.json");
    }

    public static Path defaultStorePath() {
        return home().resolve("jobs.json");
    }

    public static Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return defaultStorePath();
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
