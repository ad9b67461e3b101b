package io.herald.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.herald.core.config.model.ChannelsConfig;
import io.herald.core.config.model.HeraldConfig;
import io.herald.core.config.model.SchedulerConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads and writes the Herald config file. The file may be partial: it is merged over
 * {@link HeraldConfig#defaults()}, with explicit JSON nulls falling back to the default too.
 */
public final class ConfigService {
    private static final Set<String> BUILT_IN_CHANNELS = Set.of("console", "webhook");

    private final ObjectMapper mapper = new ObjectMapper();

    public HeraldConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return HeraldConfig.defaults();
        }

        String content = Files.readString(configPath);
        HeraldConfig config;
        if (content.isBlank()) {
            config = HeraldConfig.defaults();
        } else {
            JsonNode fileNode = mapper.readTree(content);
            if (!fileNode.isObject()) {
                throw new InvalidConfigException(configPath, List.of("top level must be a JSON object"));
            }
            ObjectNode merged = mapper.valueToTree(HeraldConfig.defaults());
            overlay(merged, (ObjectNode) fileNode);
            config = mapper.treeToValue(merged, HeraldConfig.class);
        }
        requireValid(configPath, config);
        return config;
    }

    public void save(Path configPath, HeraldConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        requireValid(configPath, config);
        Path parent = configPath.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, configPath.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, toPrettyJson(config) + System.lineSeparator());
            Files.move(temp, configPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Writes the config file. An existing file keeps its values and gains any new defaults unless
     * {@code overwrite} is set.
     */
    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean exists = Files.exists(configPath);
        HeraldConfig config = exists && !overwrite ? load(configPath) : HeraldConfig.defaults();
        save(configPath, config);
        return new InitResult(configPath, ConfigPaths.resolve(config.store().path()), !exists, exists && overwrite);
    }

    public String toPrettyJson(HeraldConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    /**
     * Problems that would stop the scheduler from running with this config; empty when it is usable.
     */
    public List<String> problems(HeraldConfig config) {
        List<String> problems = new ArrayList<>();
        SchedulerConfig scheduler = config.scheduler();
        if (scheduler.maxIdleSeconds() < 1) {
            problems.add("scheduler.maxIdleSeconds must be at least 1");
        }
        if (scheduler.firingThreads() < 1) {
            problems.add("scheduler.firingThreads must be at least 1");
        }
        if (scheduler.sessionTimeoutSeconds() < 1) {
            problems.add("scheduler.sessionTimeoutSeconds must be at least 1");
        }
        if (!scheduler.defaultTimezone().isBlank()) {
            try {
                ZoneId.of(scheduler.defaultTimezone());
            } catch (DateTimeException e) {
                problems.add("scheduler.defaultTimezone is not a valid zone: " + scheduler.defaultTimezone());
            }
        }

        ChannelsConfig channels = config.channels();
        String url = channels.webhook().url();
        if (!url.isBlank()) {
            String lower = url.toLowerCase(Locale.ROOT);
            if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
                problems.add("channels.webhook.url must be an http(s) URL");
            }
        }
        if (!BUILT_IN_CHANNELS.contains(channels.defaultChannel())) {
            problems.add("channels.defaultChannel must be one of " + String.join(", ", BUILT_IN_CHANNELS.stream().sorted().toList()));
        } else if ("webhook".equals(channels.defaultChannel()) && !channels.webhook().enabled()) {
            problems.add("channels.defaultChannel is webhook but channels.webhook.url is not set");
        }
        return problems;
    }

    private void requireValid(Path configPath, HeraldConfig config) throws InvalidConfigException {
        List<String> problems = problems(config);
        if (!problems.isEmpty()) {
            throw new InvalidConfigException(configPath, problems);
        }
    }

    private static void overlay(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            JsonNode current = target.get(field.getKey());
            if (current instanceof ObjectNode currentObject && value instanceof ObjectNode valueObject
                && !"headers".equals(field.getKey())) {
                overlay(currentObject, valueObject);
            } else {
                target.set(field.getKey(), value);
            }
        }
    }
}
