package com.flagship.sales_order.payment.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.sales_order.config.JacksonConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the JSON form of payment events.
 */
class PaymentEventLoggerTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private final PaymentEventLogger logger = new PaymentEventLogger(objectMapper);

    @Test
    @DisplayName("Approved event is written with snake_case fields and ISO-8601 timestamp")
    void testApprovedEventJson() throws Exception {
        UUID eventId = UUID.randomUUID();
        PaymentApprovedEvent event = new PaymentApprovedEvent(eventId, "payment-1", "order-123",
            new BigDecimal("100.00"), "TXN-123", Instant.parse("2026-01-15T10:00:00Z"));

        JsonNode json = objectMapper.readTree(logger.toJson(event));

        assertEquals(eventId.toString(), json.get("event_id").asText());
        assertEquals("payment-1", json.get("payment_id").asText());
        assertEquals("order-123", json.get("order_id").asText());
        assertEquals(0, new BigDecimal("100.00").compareTo(json.get("amount").decimalValue()));
        assertEquals("TXN-123", json.get("transaction_code").asText());
        assertEquals("2026-01-15T10:00:00Z", json.get("occurred_at").asText());
        assertEquals("PaymentApproved", json.get("event_type").asText());
    }

    @Test
    void testRefusedEventJson() throws Exception {
        PaymentRefusedEvent event = new PaymentRefusedEvent(UUID.randomUUID(), "payment-2", "order-9",
            BigDecimal.TEN, "TXN-9", Instant.parse("2026-01-15T10:00:00Z"));

        JsonNode json = objectMapper.readTree(logger.toJson(event));

        assertEquals("PaymentRefused", json.get("event_type").asText());
        assertEquals("payment-2", json.get("payment_id").asText());
    }

    @Test
    void testListenerAcceptsEvents() {
        PaymentRefusedEvent event = new PaymentRefusedEvent(UUID.randomUUID(), "payment-2", "order-9",
            BigDecimal.TEN, "TXN-9", Instant.now());

        assertDoesNotThrow(() -> logger.onPaymentEvent(event));
    }

    @Test
    @DisplayName("Serialization failure is logged, not propagated to the dispatcher")
    void testSerializationFailureIsNotPropagated() throws Exception {
        ObjectMapper failingMapper = mock(ObjectMapper.class);
        when(failingMapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("cannot write") { });
        PaymentEventLogger failingLogger = new PaymentEventLogger(failingMapper);
        PaymentApprovedEvent event = new PaymentApprovedEvent(UUID.randomUUID(), "payment-1", "order-1",
            BigDecimal.ONE, "TXN-1", Instant.now());

        assertDoesNotThrow(() -> failingLogger.onPaymentEvent(event));
    }
}
