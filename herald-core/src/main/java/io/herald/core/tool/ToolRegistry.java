package io.herald.core.tool;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

public final class ToolRegistry {
    private final Map<String, Tool> tools = new ConcurrentSkipListMap<>();

    public ToolRegistry register(Tool tool) {
        tools.put(tool.name(), tool);
        return this;
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return tools.values();
    }

    public List<Map<String, Object>> definitions() {
        return tools.values().stream()
            .map(tool -> Map.<String, Object>of(
                "type", "function",
                "function", Map.of(
                    "name", tool.name(),
                    "description", tool.description(),
                    "parameters", tool.schema())))
            .toList();
    }
}
