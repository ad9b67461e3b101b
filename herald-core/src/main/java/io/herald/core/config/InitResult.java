package io.herald.core.config;

import java.nio.file.Path;

public record InitResult(Path configPath, Path storePath, boolean createdConfig, boolean overwrittenConfig) {
}
