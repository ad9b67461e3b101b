package io.herald.core.delivery;

import io.herald.core.bus.MessageBus;
import io.herald.core.bus.OutboundMessage;
import java.time.Clock;

public final class BusNotificationChannel implements NotificationChannel {
    private final String name;
    private final MessageBus messageBus;
    private final Clock clock;

    public BusNotificationChannel(String name, MessageBus messageBus, Clock clock) {
        this.name = name;
        this.messageBus = messageBus;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void deliver(Notification notification) {
        messageBus.publish(new OutboundMessage(
            notification.channel().isBlank() ? name : notification.channel(),
            notification.to(),
            notification.content(),
            notification.jobId(),
            notification.sessionId(),
            clock.instant()
        ));
    }
}
