package com.flagship.sales_order.payment.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes every dispatched payment event to the log as JSON.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentEventLogger {

    private final ObjectMapper objectMapper;

    @EventListener
    public void onPaymentEvent(PaymentEvent event) {
        try {
            log.info("{} {}", event.getEventType(), toJson(event));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize {} {} for payment {}",
                event.getEventType(), event.getEventId(), event.getPaymentId(), e);
        }
    }

    String toJson(PaymentEvent event) throws JsonProcessingException {
        return objectMapper.writeValueAsString(event);
    }
}
