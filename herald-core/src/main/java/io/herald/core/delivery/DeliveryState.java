package io.herald.core.delivery;

public enum DeliveryState {
    NOT_ATTEMPTED,
    AWAITING_CONFIRMATION,
    SENT
}
