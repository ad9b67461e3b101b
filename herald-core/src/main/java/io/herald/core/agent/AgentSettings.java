package io.herald.core.agent;

public record AgentSettings(
    String systemPrompt,
    String model,
    int maxToolIterations
) {
    public static final String DEFAULT_SYSTEM_PROMPT = "You are Herald, an assistant that runs scheduled jobs. "
        + "Carry out the job message. Use the message tool to notify the user.";

    public AgentSettings {
        maxToolIterations = Math.max(1, maxToolIterations);
        model = model == null ? "" : model.trim();
        systemPrompt = systemPrompt == null || systemPrompt.isBlank() ? DEFAULT_SYSTEM_PROMPT : systemPrompt;
    }

    public static AgentSettings defaults() {
        return new AgentSettings(null, null, 20);
    }
}
