package io.herald.core.delivery;

public enum DeliveryStatus {
    SENT,
    SUPPRESSED,
    CONFIRMATION_REQUIRED,
    FAILED,
    REJECTED
}
