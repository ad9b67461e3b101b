package io.herald.core.delivery;

public interface NotificationChannel {
    String name();

    void deliver(Notification notification) throws ChannelException;
}
