package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChannelsConfig(String defaultChannel, WebhookConfig webhook) {

    public ChannelsConfig {
        defaultChannel = defaultChannel == null || defaultChannel.isBlank() ? "console" : defaultChannel.trim();
        webhook = webhook == null ? WebhookConfig.defaults() : webhook;
    }

    public static ChannelsConfig defaults() {
        return new ChannelsConfig("console", WebhookConfig.defaults());
    }
}
