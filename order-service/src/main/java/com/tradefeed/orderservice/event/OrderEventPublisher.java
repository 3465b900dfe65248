package com.tradefeed.orderservice.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradefeed.common.contracts.OrderPlacedContract;
import com.tradefeed.common.contracts.OrderStatusChangeContract;
import com.tradefeed.orderservice.config.AmqpConfig;
import com.tradefeed.orderservice.mapper.OrderMapper;
import com.tradefeed.orderservice.model.Order;
import com.tradefeed.orderservice.model.OrderStatus;
import com.tradefeed.orderservice.model.OutboxEvent;
import com.tradefeed.orderservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Writes domain events to the outbox inside the caller's transaction.
 * {@link com.tradefeed.orderservice.job.OutboxPublisher} relays them to RabbitMQ
 * after commit, so an event exists if and only if its order change committed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderEventPublisher {

    private final OutboxRepository outboxRepository;
    private final OrderMapper orderMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public void orderPlaced(Order order) {
        OrderPlacedContract contract = orderMapper.toOrderPlacedContract(order);
        saveOutboxEvent(order.getId(), AmqpConfig.ROUTING_KEY_ORDER_CREATED, contract);
        log.info("'{}' event saved to Outbox. orderNumber={}", AmqpConfig.ROUTING_KEY_ORDER_CREATED,
                order.getOrderNumber());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void statusChanged(Order order, OrderStatus oldStatus, UUID changedBy) {
        OrderStatusChangeContract contract = OrderStatusChangeContract.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .tenantId(order.getTenantId())
                .oldStatus(oldStatus.name())
                .newStatus(order.getStatus().name())
                .changedBy(changedBy)
                .changedAt(Instant.now(clock))
                .build();
        saveOutboxEvent(order.getId(), AmqpConfig.ROUTING_KEY_ORDER_STATUS_CHANGED, contract);
        log.info("'{}' event saved to Outbox. orderId={}, {} -> {}", AmqpConfig.ROUTING_KEY_ORDER_STATUS_CHANGED,
                order.getId(), oldStatus, order.getStatus());
    }

    private void saveOutboxEvent(UUID aggregateId, String type, Object payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            // rolls the order change back with it
            throw new IllegalStateException("Failed to serialize outbox payload: type=" + type, e);
        }

        OutboxEvent event = OutboxEvent.builder()
                .aggregateType(OutboxEvent.AGGREGATE_ORDER)
                .aggregateId(aggregateId.toString())
                .type(type)
                .payload(json)
                .createdAt(LocalDateTime.now(clock))
                .processed(false)
                .build();

        outboxRepository.save(event);
    }
}
