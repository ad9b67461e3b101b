package io.herald.core.model;

import java.util.List;
import java.util.Map;

public record AgentResult(String content, List<ChatMessage> transcript, Map<String, Object> usage) {

    public AgentResult {
        content = content == null ? "" : content;
        transcript = transcript == null ? List.of() : List.copyOf(transcript);
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static AgentResult of(String content) {
        return new AgentResult(content, List.of(), Map.of());
    }
}
