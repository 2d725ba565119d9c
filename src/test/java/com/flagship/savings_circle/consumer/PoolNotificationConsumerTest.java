package com.flagship.savings_circle.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.savings_circle.config.JacksonConfig;
import com.flagship.savings_circle.notification.NotificationDispatcher;
import com.flagship.savings_circle.notification.PayoutIssuedEvent;
import com.flagship.savings_circle.notification.PoolNotification;
import com.flagship.savings_circle.notification.RoundAdvancedEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PoolNotificationConsumerTest {

    private IdempotentEventProcessor eventProcessor;
    private NotificationDispatcher dispatcher;
    private Acknowledgment ack;
    private ObjectMapper objectMapper;
    private PoolNotificationConsumer consumer;

    @BeforeEach
    void setUp() {
        eventProcessor = mock(IdempotentEventProcessor.class);
        dispatcher = mock(NotificationDispatcher.class);
        ack = mock(Acknowledgment.class);
        objectMapper = new JacksonConfig().objectMapper();
        consumer = new PoolNotificationConsumer(eventProcessor, dispatcher, objectMapper);

        when(eventProcessor.processEvent(any(), anyString(), anyString(), any(), anyString(), any()))
                .thenAnswer(inv -> {
                    inv.getArgument(5, Runnable.class).run();
                    return true;
                });
    }

    private ConsumerRecord<String, String> record(PoolNotification event) throws Exception {
        return new ConsumerRecord<>("pool-notifications", 0, 42L,
                event.getPoolId().toString(), objectMapper.writeValueAsString(event));
    }

    @Test
    @DisplayName("PayoutIssued is dispatched with its payload and acknowledged")
    void payoutIssuedDispatched() throws Exception {
        UUID poolId = UUID.randomUUID();
        PayoutIssuedEvent event = new PayoutIssuedEvent(UUID.randomUUID(), poolId, UUID.randomUUID(), 1,
                UUID.randomUUID(), "Alice", new BigDecimal("40"), true, "Rent due", Instant.now());

        consumer.consume(record(event), ack);

        ArgumentCaptor<PayoutIssuedEvent> captor = ArgumentCaptor.forClass(PayoutIssuedEvent.class);
        verify(dispatcher).onPayoutIssued(captor.capture());
        assertEquals(event.getEventId(), captor.getValue().getEventId());
        assertEquals("Alice", captor.getValue().getRecipientName());
        assertTrue(captor.getValue().isEarlyPayout());
        verify(eventProcessor).processEvent(eq(event.getEventId()), eq(PayoutIssuedEvent.EVENT_TYPE),
                eq(PoolNotification.AGGREGATE_TYPE), eq(poolId), eq(PoolNotificationConsumer.CONSUMER_GROUP), any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("RoundAdvanced is dispatched")
    void roundAdvancedDispatched() throws Exception {
        RoundAdvancedEvent event = new RoundAdvancedEvent(UUID.randomUUID(), UUID.randomUUID(), 1, 2, false,
                UUID.randomUUID(), "Bob", LocalDate.of(2026, 2, 1), Instant.now());

        consumer.consume(record(event), ack);

        ArgumentCaptor<RoundAdvancedEvent> captor = ArgumentCaptor.forClass(RoundAdvancedEvent.class);
        verify(dispatcher).onRoundAdvanced(captor.capture());
        assertEquals(2, captor.getValue().getCurrentRound());
        assertEquals(LocalDate.of(2026, 2, 1), captor.getValue().getNextScheduledDate());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unknown event types are skipped, not dispatched")
    void unknownTypeSkipped() {
        UUID eventId = UUID.randomUUID();
        UUID poolId = UUID.randomUUID();
        String json = String.format("{\"eventId\":\"%s\",\"poolId\":\"%s\",\"eventType\":\"MemberInvited\"}",
                eventId, poolId);

        consumer.consume(new ConsumerRecord<>("pool-notifications", 0, 7L, poolId.toString(), json), ack);

        verify(eventProcessor).skipEvent(eventId, "MemberInvited", PoolNotification.AGGREGATE_TYPE, poolId,
                PoolNotificationConsumer.CONSUMER_GROUP, "Unknown event type");
        verifyNoInteractions(dispatcher);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unparseable messages are acknowledged and dropped")
    void malformedMessageDropped() {
        consumer.consume(new ConsumerRecord<>("pool-notifications", 0, 8L, "key", "not json"), ack);
        consumer.consume(new ConsumerRecord<>("pool-notifications", 0, 9L, "key", "{\"eventType\":\"PayoutIssued\"}"), ack);

        verifyNoInteractions(eventProcessor, dispatcher);
        verify(ack, times(2)).acknowledge();
    }

    @Test
    @DisplayName("Handler failure propagates and the offset is not acknowledged")
    void handlerFailureNotAcknowledged() throws Exception {
        RoundAdvancedEvent event = new RoundAdvancedEvent(UUID.randomUUID(), UUID.randomUUID(), 3, 4, true,
                null, null, null, Instant.now());
        doThrow(new IllegalStateException("gateway down")).when(dispatcher).onRoundAdvanced(any());

        assertThrows(IllegalStateException.class, () -> consumer.consume(record(event), ack));

        verify(ack, never()).acknowledge();
    }
}
