package com.flagship.sales_order.payment.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes payment events as in-process Spring application events.
 *
 * Listeners run synchronously on the caller's thread.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringPaymentEventDispatcher implements PaymentEventDispatcher {

    private final ApplicationEventPublisher publisher;

    @Override
    public void dispatch(PaymentEvent event) {
        log.debug("Dispatching {} for payment {}", event.getEventType(), event.getPaymentId());
        publisher.publishEvent(event);
    }
}
