package com.tradefeed.orderservice.service;

import com.tradefeed.common.exception.ResourceNotFoundException;
import com.tradefeed.orderservice.dto.OrderResponse;
import com.tradefeed.orderservice.event.OrderEventPublisher;
import com.tradefeed.orderservice.exception.IllegalStatusTransitionException;
import com.tradefeed.orderservice.mapper.OrderMapper;
import com.tradefeed.orderservice.model.Order;
import com.tradefeed.orderservice.model.OrderStatus;
import com.tradefeed.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderStatusService {

    private final OrderRepository orderRepository;
    private final OrderEventPublisher orderEventPublisher;
    private final OrderMapper orderMapper;

    /**
     * Moves a tenant's order to {@code targetStatus} if its current status allows it.
     * Cancelling does not put stock back.
     *
     * @throws ResourceNotFoundException if the order does not exist for this tenant
     * @throws IllegalStatusTransitionException if the move is not allowed; nothing is written
     */
    @Transactional
    public OrderResponse transition(UUID orderId, UUID tenantId, OrderStatus targetStatus, UUID changedBy) {
        Order order = orderRepository.findByIdAndTenantId(orderId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId));

        OrderStatus currentStatus = order.getStatus();
        if (!currentStatus.canTransitionTo(targetStatus)) {
            log.warn("Rejected status change: orderId={}, {} -> {}", orderId, currentStatus, targetStatus);
            throw new IllegalStatusTransitionException(currentStatus, targetStatus);
        }

        order.setStatus(targetStatus);
        // version check happens here: a concurrent change fails this write
        Order updatedOrder = orderRepository.saveAndFlush(order);
        log.info("Order status changed: orderId={}, {} -> {}, by={}", orderId, currentStatus, targetStatus, changedBy);

        orderEventPublisher.statusChanged(updatedOrder, currentStatus, changedBy);

        return orderMapper.toOrderResponse(updatedOrder);
    }
}
