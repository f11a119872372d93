package com.flagship.sales_order.payment;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a {@link Payment}.
 *
 * PENDING -> AUTHORIZED | REFUSED. Both targets are terminal.
 */
public enum PaymentStatus {
    /**
     * Initial state; waiting for the gateway outcome.
     */
    PENDING,

    /**
     * Payment was confirmed. Terminal.
     */
    AUTHORIZED,

    /**
     * Payment was declined. Terminal.
     */
    REFUSED,

    /**
     * Reserved for refunds of authorized payments. No transition leads here yet.
     */
    REFUNDED,

    /**
     * Reserved for cancellation before completion. No transition leads here yet.
     */
    CANCELLED;

    @JsonValue
    public String getCode() {
        return switch (this) {
            case PENDING -> "pending";
            case AUTHORIZED -> "authorized";
            case REFUSED -> "refused";
            case REFUNDED -> "refunded";
            case CANCELLED -> "cancelled";
        };
    }

    @Override
    public String toString() {
        return getCode();
    }
}
