package io.herald.core.bus;

import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;

public final class InMemoryMessageBus implements MessageBus {
    private final ConcurrentLinkedQueue<OutboundMessage> queue = new ConcurrentLinkedQueue<>();

    @Override
    public void publish(OutboundMessage message) {
        queue.offer(message);
    }

    @Override
    public Optional<OutboundMessage> poll() {
        return Optional.ofNullable(queue.poll());
    }
}
