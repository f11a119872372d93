package com.flagship.sales_order.observability;

import com.flagship.sales_order.payment.PaymentMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Centralized metrics for payment operations.
 *
 * Metrics exposed:
 * - payment.created: Counter of created payments, tagged by method
 * - payment.authorized: Counter of authorized payments
 * - payment.refused: Counter of refused payments
 * - payment.rejected: Counter of operations rejected by a domain rule,
 *   tagged by operation and error code
 */
@Component
public class PaymentMetrics {

    private final MeterRegistry registry;

    private final Counter paymentsAuthorized;
    private final Counter paymentsRefused;

    public PaymentMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.paymentsAuthorized = Counter.builder("payment.authorized")
                .description("Number of payments authorized")
                .register(registry);

        this.paymentsRefused = Counter.builder("payment.refused")
                .description("Number of payments refused")
                .register(registry);
    }

    public void recordPaymentCreated(PaymentMethod method) {
        Counter.builder("payment.created")
                .description("Number of payments created")
                .tag("method", method.getCode())
                .register(registry)
                .increment();
    }

    public void incrementPaymentsAuthorized() {
        paymentsAuthorized.increment();
    }

    public void incrementPaymentsRefused() {
        paymentsRefused.increment();
    }

    /**
     * Records an operation rejected by a domain rule. One increment per violated code.
     */
    public void recordRejection(String operation, String errorCode) {
        registry.counter("payment.rejected",
                "operation", sanitizeTag(operation),
                "code", sanitizeTag(errorCode)
        ).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
