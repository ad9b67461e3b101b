package io.herald.core.delivery;

public record Notification(String channel, String to, String content, String jobId, String sessionId) {

    public Notification {
        channel = channel == null ? "" : channel;
        to = to == null ? "" : to;
        content = content == null ? "" : content;
    }
}
