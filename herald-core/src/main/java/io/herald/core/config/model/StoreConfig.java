package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StoreConfig(String path) {

    public StoreConfig {
        path = path == null || path.isBlank() ? "~/.herald/jobs.json" : path;
    }

    public static StoreConfig defaults() {
        return new StoreConfig("~/.herald/jobs.json");
    }
}
