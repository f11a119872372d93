package com.flagship.sales_order.payment;

import com.flagship.sales_order.kernel.Guards;
import com.flagship.sales_order.kernel.IdGenerator;
import com.flagship.sales_order.kernel.UuidIdGenerator;
import com.flagship.sales_order.kernel.error.DomainError;
import com.flagship.sales_order.kernel.error.DomainViolationException;
import com.flagship.sales_order.payment.event.PaymentApprovedEvent;
import com.flagship.sales_order.payment.event.PaymentEvent;
import com.flagship.sales_order.payment.event.PaymentRefusedEvent;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Payment entity of the Order aggregate.
 *
 * A payment is created PENDING, receives the transaction code issued by the
 * gateway, and is then either confirmed (AUTHORIZED) or refused (REFUSED).
 * Both outcomes are terminal.
 *
 * Every operation validates all of its preconditions before touching state
 * and reports every violation at once through a {@link DomainViolationException}.
 * A rejected operation leaves the payment unchanged.
 *
 * Not thread-safe: the owning aggregate serializes access.
 */
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString
public class Payment {

    @EqualsAndHashCode.Include
    private final String id;
    private final String orderId;
    private final BigDecimal amount;
    private final PaymentMethod method;
    private PaymentStatus status;

    @Getter(AccessLevel.NONE)
    private Instant paidAt;
    @Getter(AccessLevel.NONE)
    private Instant updatedAt;
    @Getter(AccessLevel.NONE)
    private String transactionCode;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private final Clock clock;
    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private final List<PaymentEvent> domainEvents = new ArrayList<>();

    private Payment(String id, String orderId, BigDecimal amount, PaymentMethod method, Clock clock) {
        this.id = id;
        this.orderId = orderId;
        this.amount = amount;
        this.method = method;
        this.status = PaymentStatus.PENDING;
        this.clock = clock;
    }

    /**
     * Creates a PENDING payment with a random UUID and the UTC system clock.
     *
     * @throws DomainViolationException if the order ID is blank, the amount is not
     *         positive, or the method is missing
     */
    public static Payment create(String orderId, BigDecimal amount, PaymentMethod method) {
        return create(new UuidIdGenerator(), Clock.systemUTC(), orderId, amount, method);
    }

    /**
     * Creates a PENDING payment with no transaction code.
     *
     * @param idGenerator source of the payment ID
     * @param clock clock used for every timestamp of this payment
     * @throws DomainViolationException carrying every invalid argument
     */
    public static Payment create(IdGenerator idGenerator, Clock clock,
                                 String orderId, BigDecimal amount, PaymentMethod method) {
        Guards.enforce(
            Guards.notBlank(orderId, PaymentErrors.INVALID_ORDER_ID),
            Guards.positive(amount, PaymentErrors.INVALID_AMOUNT),
            Guards.notAbsent(method, PaymentErrors.INVALID_METHOD)
        );
        return new Payment(idGenerator.generate(), orderId, amount, method, clock);
    }

    /**
     * Records the transaction code issued by the payment gateway.
     *
     * @throws DomainViolationException with {@link PaymentErrors#TRANSACTION_CODE_AFTER_COMPLETION}
     *         if the payment is no longer pending, {@link PaymentErrors#INVALID_TRANSACTION_CODE}
     *         if the code is blank, and {@link PaymentErrors#TRANSACTION_CODE_ALREADY_DEFINED}
     *         if a code was already recorded
     */
    public void defineTransactionCode(String code) {
        Guards.enforce(
            checkStatus(PaymentStatus.PENDING, PaymentErrors.TRANSACTION_CODE_AFTER_COMPLETION),
            Guards.notBlank(code, PaymentErrors.INVALID_TRANSACTION_CODE),
            Guards.isAbsent(transactionCode, PaymentErrors.TRANSACTION_CODE_ALREADY_DEFINED)
        );

        this.transactionCode = code;
        this.updatedAt = clock.instant();
    }

    /**
     * Transitions PENDING to AUTHORIZED and records an approval event.
     *
     * @throws DomainViolationException with {@link PaymentErrors#NOT_PENDING} and/or
     *         {@link PaymentErrors#TRANSACTION_CODE_NOT_DEFINED}
     */
    public void confirmPayment() {
        checkReadyForOutcome();

        Instant now = clock.instant();
        this.paidAt = now;
        this.status = PaymentStatus.AUTHORIZED;
        this.updatedAt = now;
        domainEvents.add(PaymentApprovedEvent.fromPayment(this, now));
    }

    /**
     * Transitions PENDING to REFUSED and records a refusal event. PaidAt stays empty.
     *
     * @throws DomainViolationException with {@link PaymentErrors#NOT_PENDING} and/or
     *         {@link PaymentErrors#TRANSACTION_CODE_NOT_DEFINED}
     */
    public void refusePayment() {
        checkReadyForOutcome();

        Instant now = clock.instant();
        this.status = PaymentStatus.REFUSED;
        this.updatedAt = now;
        domainEvents.add(PaymentRefusedEvent.fromPayment(this, now));
    }

    public Optional<Instant> getPaidAt() {
        return Optional.ofNullable(paidAt);
    }

    public Optional<Instant> getUpdatedAt() {
        return Optional.ofNullable(updatedAt);
    }

    public Optional<String> getTransactionCode() {
        return Optional.ofNullable(transactionCode);
    }

    /**
     * Checks if the payment is in a terminal state (no further transitions allowed).
     */
    public boolean isTerminal() {
        return !canTransitionTo(PaymentStatus.AUTHORIZED) && !canTransitionTo(PaymentStatus.REFUSED);
    }

    /**
     * Checks if a transition from current status to target status is allowed.
     */
    public boolean canTransitionTo(PaymentStatus targetStatus) {
        return switch (this.status) {
            case PENDING -> targetStatus == PaymentStatus.AUTHORIZED || targetStatus == PaymentStatus.REFUSED;
            case AUTHORIZED, REFUSED, REFUNDED, CANCELLED -> false;
        };
    }

    /**
     * Events recorded and not yet pulled or marked dispatched, oldest first.
     */
    public List<PaymentEvent> getDomainEvents() {
        return List.copyOf(domainEvents);
    }

    /**
     * Returns the recorded events and forgets them.
     */
    public List<PaymentEvent> pullDomainEvents() {
        List<PaymentEvent> pulled = List.copyOf(domainEvents);
        domainEvents.clear();
        return pulled;
    }

    /**
     * Forgets the given events once they have been handed over. Events recorded
     * in the meantime are kept.
     */
    public void markDispatched(List<PaymentEvent> dispatched) {
        domainEvents.removeAll(dispatched);
    }

    private void checkReadyForOutcome() {
        Guards.enforce(
            checkStatus(PaymentStatus.PENDING, PaymentErrors.NOT_PENDING),
            Guards.notAbsent(transactionCode, PaymentErrors.TRANSACTION_CODE_NOT_DEFINED)
        );
    }

    private Optional<DomainError> checkStatus(PaymentStatus expected, DomainError error) {
        return status == expected ? Optional.empty() : Optional.of(error);
    }
}
