package com.flagship.sales_order.payment.event;

import java.util.List;

/**
 * Hands payment events over to whoever routes them to subscribers.
 */
public interface PaymentEventDispatcher {

    void dispatch(PaymentEvent event);

    default void dispatchAll(List<? extends PaymentEvent> events) {
        events.forEach(this::dispatch);
    }
}
