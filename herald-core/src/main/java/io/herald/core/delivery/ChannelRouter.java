package io.herald.core.delivery;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public final class ChannelRouter implements NotificationChannel {
    private final Map<String, NotificationChannel> channels = new ConcurrentHashMap<>();
    private final String defaultChannel;

    public ChannelRouter(String defaultChannel) {
        this.defaultChannel = defaultChannel == null ? "" : defaultChannel;
    }

    public ChannelRouter register(NotificationChannel channel) {
        channels.put(channel.name(), channel);
        return this;
    }

    public Set<String> names() {
        return Set.copyOf(channels.keySet());
    }

    @Override
    public String name() {
        return "router";
    }

    @Override
    public void deliver(Notification notification) throws ChannelException {
        NotificationChannel target = channels.get(notification.channel());
        if (target == null) {
            target = channels.get(defaultChannel);
        }
        if (target == null) {
            throw new ChannelException("No channel registered for '" + notification.channel() + "'");
        }
        target.deliver(notification);
    }
}
