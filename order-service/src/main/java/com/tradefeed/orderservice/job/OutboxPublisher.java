package com.tradefeed.orderservice.job;

import com.tradefeed.orderservice.config.AmqpConfig;
import com.tradefeed.orderservice.model.OutboxEvent;
import com.tradefeed.orderservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Relays committed order events to the order exchange and purges the ones
 * already sent. Delivery is at-least-once: an event is marked processed only
 * after the broker accepted it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxRepository outboxRepository;
    private final RabbitTemplate rabbitTemplate;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${tradefeed.outbox.publish-delay-ms:2000}")
    @Transactional
    public void publishOutboxEvents() {
        List<OutboxEvent> events = outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc();

        if (events.isEmpty()) {
            return;
        }

        log.debug("Found {} outbox events to publish", events.size());

        for (OutboxEvent event : events) {
            try {
                // payload is already JSON; no __TypeId__ header, listeners bind by parameter type
                MessageProperties props = new MessageProperties();
                props.setContentType(MessageProperties.CONTENT_TYPE_JSON);
                props.setMessageId(event.getId().toString());

                Message message = new Message(event.getPayload().getBytes(StandardCharsets.UTF_8), props);
                rabbitTemplate.send(AmqpConfig.ORDER_EXCHANGE, event.getType(), message);

                event.markPublished(LocalDateTime.now(clock));
                outboxRepository.save(event);

                log.info("Published outbox event: id={}, type={}, aggregateId={}",
                        event.getId(), event.getType(), event.getAggregateId());
            } catch (AmqpException e) {
                // left unprocessed, retried on the next run
                event.recordFailedAttempt();
                outboxRepository.save(event);
                log.error("Failed to publish outbox event: id={}, type={}, attempts={}",
                        event.getId(), event.getType(), event.getPublishAttempts(), e);
            }
        }
    }

    @Scheduled(cron = "${tradefeed.outbox.cleanup-cron:0 0 3 * * *}")
    @Transactional
    public void cleanupProcessedEvents() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(1);
        log.info("Starting cleanup of outbox events published before {}", cutoff);

        int totalDeleted = 0;
        while (true) {
            List<OutboxEvent> batch = outboxRepository.findTop1000ByProcessedTrueAndPublishedAtBefore(cutoff);
            if (batch.isEmpty()) {
                break;
            }
            outboxRepository.deleteAll(batch);
            totalDeleted += batch.size();
            log.debug("Deleted batch of {} processed events", batch.size());
        }

        log.info("Cleanup completed. Total deleted: {}", totalDeleted);
    }
}
