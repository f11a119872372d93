package com.flagship.sales_order.payment.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for payment events.
 *
 * Events are immutable facts about a transition that already happened.
 * They are built by the {@link com.flagship.sales_order.payment.Payment}
 * entity and handed to a {@link PaymentEventDispatcher} by the caller.
 */
public interface PaymentEvent {

    /**
     * Unique identifier for this event instance.
     * Used for deduplication in consumers.
     */
    UUID getEventId();

    /**
     * The payment this event is about.
     */
    String getPaymentId();

    /**
     * The order the payment belongs to.
     */
    String getOrderId();

    /**
     * Payment amount at the time of the transition.
     */
    BigDecimal getAmount();

    /**
     * Gateway transaction code of the payment.
     */
    String getTransactionCode();

    /**
     * When the transition happened.
     */
    Instant getOccurredAt();

    /**
     * Event type name for routing/filtering.
     */
    String getEventType();
}
