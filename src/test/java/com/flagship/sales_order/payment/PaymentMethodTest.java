package com.flagship.sales_order.payment;

import com.flagship.sales_order.kernel.error.DomainViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class PaymentMethodTest {

    @ParameterizedTest
    @CsvSource({
        "CREDIT_CARD, credit_card",
        "DEBIT_CARD, debit_card",
        "CASH, cash",
        "PIX, pix",
        "BANK_TRANSFER, bank_transfer",
        "BANK_SLIP, bank_slip"
    })
    @DisplayName("Each method renders its wire code")
    void testCode(PaymentMethod method, String code) {
        assertEquals(code, method.getCode());
        assertEquals(code, method.toString());
    }

    @ParameterizedTest
    @EnumSource(PaymentMethod.class)
    void testFromCodeResolvesEveryMethod(PaymentMethod method) {
        assertSame(method, PaymentMethod.fromCode(method.getCode()));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"unknown", "CREDIT_CARD", "banc_slip", " pix"})
    @DisplayName("Unknown codes are rejected with INVALID_METHOD")
    void testFromCodeRejectsUnknown(String code) {
        DomainViolationException e = assertThrows(DomainViolationException.class, () -> PaymentMethod.fromCode(code));

        assertTrue(e.contains(PaymentErrors.INVALID_METHOD));
        assertInstanceOf(IllegalArgumentException.class, e.getErrors().get(0).getCause());
    }

    @Test
    void testMethodsAreDistinct() {
        assertNotEquals(PaymentMethod.CREDIT_CARD, PaymentMethod.DEBIT_CARD);
        assertEquals(6, PaymentMethod.values().length);
    }
}
