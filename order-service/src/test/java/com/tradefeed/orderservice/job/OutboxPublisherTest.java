package com.tradefeed.orderservice.job;

import com.tradefeed.orderservice.config.AmqpConfig;
import com.tradefeed.orderservice.model.OutboxEvent;
import com.tradefeed.orderservice.repository.OutboxRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxPublisher Unit Tests")
class OutboxPublisherTest {

    @Mock
    private OutboxRepository outboxRepository;
    @Mock
    private RabbitTemplate rabbitTemplate;

    private OutboxPublisher outboxPublisher;

    private OutboxEvent createdEvent;
    private OutboxEvent statusEvent;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-24T03:00:00Z"), ZoneOffset.UTC);
        outboxPublisher = new OutboxPublisher(outboxRepository, rabbitTemplate, clock);

        createdEvent = OutboxEvent.builder()
                .id(UUID.randomUUID())
                .aggregateType(OutboxEvent.AGGREGATE_ORDER)
                .aggregateId(UUID.randomUUID().toString())
                .type(AmqpConfig.ROUTING_KEY_ORDER_CREATED)
                .payload("{\"orderNumber\":\"TF-20260224-ABCD\"}")
                .createdAt(LocalDateTime.of(2026, 2, 24, 2, 55))
                .processed(false)
                .build();

        statusEvent = OutboxEvent.builder()
                .id(UUID.randomUUID())
                .aggregateType(OutboxEvent.AGGREGATE_ORDER)
                .aggregateId(UUID.randomUUID().toString())
                .type(AmqpConfig.ROUTING_KEY_ORDER_STATUS_CHANGED)
                .payload("{\"newStatus\":\"CONFIRMED\"}")
                .createdAt(LocalDateTime.of(2026, 2, 24, 2, 57))
                .processed(false)
                .build();
    }

    @Nested
    @DisplayName("Publishing")
    class Publishing {

        @Test
        @DisplayName("should send raw JSON to the order exchange with the event type as routing key")
        void shouldSendRawJsonWithRoutingKey() {
            when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc()).thenReturn(List.of(createdEvent));

            outboxPublisher.publishOutboxEvents();

            ArgumentCaptor<Message> message = ArgumentCaptor.forClass(Message.class);
            verify(rabbitTemplate).send(eq(AmqpConfig.ORDER_EXCHANGE), eq(AmqpConfig.ROUTING_KEY_ORDER_CREATED),
                    message.capture());
            assertThat(new String(message.getValue().getBody(), StandardCharsets.UTF_8))
                    .isEqualTo("{\"orderNumber\":\"TF-20260224-ABCD\"}");
            assertThat(message.getValue().getMessageProperties().getContentType())
                    .isEqualTo(MessageProperties.CONTENT_TYPE_JSON);
            assertThat(createdEvent.isProcessed()).isTrue();
            assertThat(createdEvent.getPublishedAt()).isEqualTo(LocalDateTime.of(2026, 2, 24, 3, 0));
            assertThat(createdEvent.getPublishAttempts()).isEqualTo(1);
            verify(outboxRepository).save(createdEvent);
        }

        @Test
        @DisplayName("should not publish when no events found")
        void shouldNotPublishWhenNoEventsFound() {
            when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc()).thenReturn(List.of());

            outboxPublisher.publishOutboxEvents();

            verifyNoInteractions(rabbitTemplate);
            verify(outboxRepository, never()).save(any());
        }

        @Test
        @DisplayName("should leave a failed event unprocessed, count the attempt and keep going")
        void shouldContinueAfterBrokerFailure() {
            when(outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc())
                    .thenReturn(List.of(createdEvent, statusEvent));
            doThrow(new AmqpConnectException(new ConnectException("refused")))
                    .when(rabbitTemplate).send(anyString(), eq(AmqpConfig.ROUTING_KEY_ORDER_CREATED), any(Message.class));

            outboxPublisher.publishOutboxEvents();

            assertThat(createdEvent.isProcessed()).isFalse();
            assertThat(createdEvent.getPublishedAt()).isNull();
            assertThat(createdEvent.getPublishAttempts()).isEqualTo(1);
            assertThat(statusEvent.isProcessed()).isTrue();
            verify(outboxRepository).save(createdEvent);
            verify(outboxRepository).save(statusEvent);
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class Cleanup {

        @Test
        @DisplayName("should delete events published more than one day ago in batches")
        void shouldDeleteInBatches() {
            LocalDateTime cutoff = LocalDateTime.of(2026, 2, 23, 3, 0);
            createdEvent.markPublished(LocalDateTime.of(2026, 2, 22, 9, 0));
            when(outboxRepository.findTop1000ByProcessedTrueAndPublishedAtBefore(cutoff))
                    .thenReturn(List.of(createdEvent), List.of());

            outboxPublisher.cleanupProcessedEvents();

            verify(outboxRepository).deleteAll(List.of(createdEvent));
            verify(outboxRepository, times(2)).findTop1000ByProcessedTrueAndPublishedAtBefore(cutoff);
        }
    }
}
