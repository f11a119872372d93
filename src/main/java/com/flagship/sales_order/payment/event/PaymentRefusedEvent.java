package com.flagship.sales_order.payment.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.sales_order.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event raised when a payment transitions from PENDING to REFUSED.
 *
 * Consumers typically release the order's reservation on this event.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentRefusedEvent implements PaymentEvent {
    UUID eventId;
    String paymentId;
    String orderId;
    BigDecimal amount;
    String transactionCode;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentRefused";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentRefusedEvent fromPayment(Payment payment, Instant occurredAt) {
        return new PaymentRefusedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getOrderId(),
            payment.getAmount(),
            payment.getTransactionCode().orElse(null),
            occurredAt
        );
    }
}
