package io.herald.core.tool;

import io.herald.core.execution.ExecutionSession;
import java.util.Map;

/**
 * What a tool sees while it runs: the execution session it was called from (absent outside a
 * job firing) and the shared services keyed by name.
 */
public record ToolContext(ExecutionSession session, Map<String, Object> services) {

    public ToolContext {
        services = services == null ? Map.of() : Map.copyOf(services);
    }

    public <T> T service(String key, Class<T> type) {
        Object service = services.get(key);
        if (service == null) {
            return null;
        }
        if (!type.isInstance(service)) {
            throw new IllegalArgumentException("Service '" + key + "' is not of type " + type.getSimpleName());
        }
        return type.cast(service);
    }
}
