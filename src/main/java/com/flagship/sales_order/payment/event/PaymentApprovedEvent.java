package com.flagship.sales_order.payment.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flagship.sales_order.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Event raised when a payment transitions from PENDING to AUTHORIZED.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PaymentApprovedEvent implements PaymentEvent {
    UUID eventId;
    String paymentId;
    String orderId;
    BigDecimal amount;
    String transactionCode;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentApproved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    /**
     * Snapshots an authorized payment.
     */
    public static PaymentApprovedEvent fromPayment(Payment payment, Instant occurredAt) {
        return new PaymentApprovedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getOrderId(),
            payment.getAmount(),
            payment.getTransactionCode().orElse(null),
            occurredAt
        );
    }
}
