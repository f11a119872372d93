package com.flagship.sales_order.payment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flagship.sales_order.kernel.error.DomainViolationException;

import java.util.List;

/**
 * Payment channel chosen by the customer.
 */
public enum PaymentMethod {
    CREDIT_CARD,
    DEBIT_CARD,
    CASH,
    PIX,           // Brazilian instant transfer
    BANK_TRANSFER, // TED/DOC
    BANK_SLIP;     // boleto bancario

    @JsonValue
    public String getCode() {
        return switch (this) {
            case CREDIT_CARD -> "credit_card";
            case DEBIT_CARD -> "debit_card";
            case CASH -> "cash";
            case PIX -> "pix";
            case BANK_TRANSFER -> "bank_transfer";
            case BANK_SLIP -> "bank_slip";
        };
    }

    /**
     * Resolves a method from its wire code.
     *
     * @throws DomainViolationException with {@link PaymentErrors#INVALID_METHOD} for an unknown code
     */
    @JsonCreator
    public static PaymentMethod fromCode(String code) {
        for (PaymentMethod method : values()) {
            if (method.getCode().equals(code)) {
                return method;
            }
        }
        throw new DomainViolationException(List.of(
            PaymentErrors.INVALID_METHOD.wrap(new IllegalArgumentException("Unknown payment method: " + code))
        ));
    }

    @Override
    public String toString() {
        return getCode();
    }
}
