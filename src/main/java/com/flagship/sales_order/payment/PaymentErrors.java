package com.flagship.sales_order.payment;

import com.flagship.sales_order.kernel.error.DomainError;

/**
 * Failures reported by the {@link Payment} entity.
 *
 * Callers should test for these by code, e.g. {@code PaymentErrors.NOT_PENDING.matches(e)},
 * never by message text.
 */
public final class PaymentErrors {

    // Input validation
    public static final DomainError INVALID_ORDER_ID =
        DomainError.of("PAYMENT.INVALID_ORDER_ID", "order ID cannot be null or whitespace");
    public static final DomainError INVALID_AMOUNT =
        DomainError.of("PAYMENT.INVALID_AMOUNT", "payment amount must be greater than zero");
    public static final DomainError INVALID_METHOD =
        DomainError.of("PAYMENT.INVALID_METHOD", "invalid payment method");
    public static final DomainError INVALID_TRANSACTION_CODE =
        DomainError.of("PAYMENT.INVALID_TRANSACTION_CODE", "transaction code cannot be null or whitespace");

    // State preconditions
    public static final DomainError NOT_PENDING =
        DomainError.of("PAYMENT.NOT_PENDING", "payment is not in pending status");
    public static final DomainError TRANSACTION_CODE_NOT_DEFINED =
        DomainError.of("PAYMENT.TRANSACTION_CODE_NOT_DEFINED", "transaction code has not been defined yet");
    public static final DomainError TRANSACTION_CODE_AFTER_COMPLETION =
        DomainError.of("PAYMENT.TRANSACTION_CODE_AFTER_COMPLETION",
            "transaction code cannot be defined after payment has been confirmed or refused");
    public static final DomainError TRANSACTION_CODE_ALREADY_DEFINED =
        DomainError.of("PAYMENT.TRANSACTION_CODE_ALREADY_DEFINED", "transaction code has already been defined");

    private PaymentErrors() {
        // Constants only
    }
}
