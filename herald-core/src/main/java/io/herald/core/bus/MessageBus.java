package io.herald.core.bus;

import java.util.Optional;

public interface MessageBus {
    void publish(OutboundMessage message);

    Optional<OutboundMessage> poll();
}
