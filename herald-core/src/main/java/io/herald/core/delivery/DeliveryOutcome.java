package io.herald.core.delivery;

public record DeliveryOutcome(DeliveryStatus status, DeliveryState state, String message) {

    public boolean sent() {
        return status == DeliveryStatus.SENT;
    }
}
