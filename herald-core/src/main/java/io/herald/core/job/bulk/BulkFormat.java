package io.herald.core.job.bulk;

import java.nio.file.Path;
import java.util.Locale;

public enum BulkFormat {
    JSON,
    YAML;

    public static BulkFormat of(String raw) {
        if (raw == null || raw.isBlank()) {
            return JSON;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "json" -> JSON;
            case "yaml", "yml" -> YAML;
            default -> throw new IllegalArgumentException("unsupported format: " + raw);
        };
    }

    public static BulkFormat forPath(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml") ? YAML : JSON;
    }
}
