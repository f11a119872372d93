package com.flagship.sales_order.observability;

import com.flagship.sales_order.payment.PaymentMethod;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PaymentMetricsTest {

    private SimpleMeterRegistry registry;
    private PaymentMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PaymentMetrics(registry);
    }

    @Test
    void testCreatedIsTaggedByMethod() {
        metrics.recordPaymentCreated(PaymentMethod.PIX);
        metrics.recordPaymentCreated(PaymentMethod.PIX);
        metrics.recordPaymentCreated(PaymentMethod.CASH);

        assertEquals(2.0, registry.get("payment.created").tag("method", "pix").counter().count());
        assertEquals(1.0, registry.get("payment.created").tag("method", "cash").counter().count());
    }

    @Test
    void testTransitionCounters() {
        metrics.incrementPaymentsAuthorized();
        metrics.incrementPaymentsRefused();
        metrics.incrementPaymentsRefused();

        assertEquals(1.0, registry.get("payment.authorized").counter().count());
        assertEquals(2.0, registry.get("payment.refused").counter().count());
    }

    @Test
    void testRejectionsAreTaggedByOperationAndCode() {
        metrics.recordRejection("confirm", "PAYMENT.NOT_PENDING");

        assertEquals(1.0, registry.get("payment.rejected")
            .tag("operation", "confirm")
            .tag("code", "PAYMENT.NOT_PENDING")
            .counter().count());
    }

    @Test
    void testRejectionTagsAreSanitized() {
        metrics.recordRejection(null, "PAYMENT NOT/PENDING");

        assertEquals(1.0, registry.get("payment.rejected")
            .tag("operation", "unknown")
            .tag("code", "PAYMENT_NOT_PENDING")
            .counter().count());
    }
}
