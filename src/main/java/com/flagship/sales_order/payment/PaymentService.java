package com.flagship.sales_order.payment;

import com.flagship.sales_order.kernel.IdGenerator;
import com.flagship.sales_order.kernel.error.DomainViolationException;
import com.flagship.sales_order.observability.PaymentMetrics;
import com.flagship.sales_order.payment.event.PaymentEvent;
import com.flagship.sales_order.payment.event.PaymentEventDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;

/**
 * Drives payment state transitions on behalf of the Order aggregate.
 *
 * The rules live in {@link Payment}; this service supplies its collaborators
 * (ID source, clock), hands the events of successful transitions to the
 * {@link PaymentEventDispatcher}, and logs and counts every outcome.
 * Rejections are rethrown unchanged.
 *
 * Note: No persistence. Callers own the Payment instance.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final IdGenerator idGenerator;
    private final Clock clock;
    private final PaymentEventDispatcher eventDispatcher;
    private final PaymentMetrics metrics;

    @Value("${payment.local-transaction-code.prefix:LOCAL-}")
    private String localTransactionCodePrefix;

    /**
     * Creates a new payment in PENDING status.
     *
     * @param orderId Order the payment belongs to
     * @param amount Payment amount
     * @param method Payment channel
     * @return New Payment in PENDING status
     * @throws DomainViolationException if any argument is invalid
     */
    public Payment createPayment(String orderId, BigDecimal amount, PaymentMethod method) {
        Payment payment = guarded("create", () -> Payment.create(idGenerator, clock, orderId, amount, method));
        metrics.recordPaymentCreated(method);
        log.info("Created payment {} for order {}: amount={}, method={}",
            payment.getId(), orderId, amount, method);
        return payment;
    }

    /**
     * Records the gateway-issued transaction code.
     *
     * @throws DomainViolationException if the payment is completed, the code is blank,
     *         or a code was already recorded
     */
    public Payment defineTransactionCode(Payment payment, String transactionCode) {
        requirePayment(payment);
        guarded("define_transaction_code", () -> {
            payment.defineTransactionCode(transactionCode);
            return payment;
        });
        log.info("Defined transaction code for payment {}", payment.getId());
        return payment;
    }

    /**
     * Assigns a locally generated transaction code, for payments settled outside a gateway
     * (e.g. cash on delivery). Does nothing when a code is already defined.
     *
     * @throws DomainViolationException if the payment is no longer pending
     */
    public Payment defineLocalTransactionCode(Payment payment) {
        requirePayment(payment);
        if (payment.getTransactionCode().isPresent()) {
            log.debug("Payment {} already has a transaction code, keeping it", payment.getId());
            return payment;
        }
        return defineTransactionCode(payment, localTransactionCodePrefix + idGenerator.generate());
    }

    /**
     * Confirms a payment (transitions from PENDING to AUTHORIZED) and dispatches the approval event.
     *
     * @throws DomainViolationException if the payment is not pending or has no transaction code
     */
    public Payment confirmPayment(Payment payment) {
        requirePayment(payment);
        guarded("confirm", () -> {
            payment.confirmPayment();
            return payment;
        });
        metrics.incrementPaymentsAuthorized();
        log.info("Payment {} authorized for order {}", payment.getId(), payment.getOrderId());
        publishPendingEvents(payment);
        return payment;
    }

    /**
     * Refuses a payment (transitions from PENDING to REFUSED) and dispatches the refusal event.
     *
     * @throws DomainViolationException if the payment is not pending or has no transaction code
     */
    public Payment refusePayment(Payment payment) {
        requirePayment(payment);
        guarded("refuse", () -> {
            payment.refusePayment();
            return payment;
        });
        metrics.incrementPaymentsRefused();
        log.info("Payment {} refused for order {}", payment.getId(), payment.getOrderId());
        publishPendingEvents(payment);
        return payment;
    }

    /**
     * Dispatches the events still pending on the payment.
     *
     * The transition that recorded them has already happened, so a dispatch failure
     * does not fail the caller: it is logged and the events stay on the payment,
     * to be dispatched again by a later call.
     *
     * @return true if every pending event was dispatched
     */
    public boolean publishPendingEvents(Payment payment) {
        requirePayment(payment);
        List<PaymentEvent> events = payment.getDomainEvents();
        if (events.isEmpty()) {
            return true;
        }
        try {
            eventDispatcher.dispatchAll(events);
        } catch (RuntimeException e) {
            log.error("Failed to dispatch {} event(s) for payment {}, keeping them for retry",
                events.size(), payment.getId(), e);
            return false;
        }
        payment.markDispatched(events);
        return true;
    }

    private <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DomainViolationException e) {
            log.warn("Payment operation '{}' rejected: {}", operation, e.getCodes());
            e.getCodes().forEach(code -> metrics.recordRejection(operation, code));
            throw e;
        }
    }

    private static void requirePayment(Payment payment) {
        if (payment == null) {
            throw new IllegalArgumentException("Payment cannot be null");
        }
    }
}
