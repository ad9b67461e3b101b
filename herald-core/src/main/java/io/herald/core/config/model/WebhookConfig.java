package io.herald.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookConfig(String url, Map<String, String> headers) {

    public WebhookConfig {
        url = url == null ? "" : url.trim();
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static WebhookConfig defaults() {
        return new WebhookConfig("", Map.of());
    }

    @JsonIgnore
    public boolean enabled() {
        return !url.isBlank();
    }
}
