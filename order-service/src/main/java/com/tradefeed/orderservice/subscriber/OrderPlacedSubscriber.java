package com.tradefeed.orderservice.subscriber;

import com.tradefeed.common.contracts.OrderPlacedContract;
import com.tradefeed.orderservice.collaborator.OrderChatComposer;
import com.tradefeed.orderservice.collaborator.OrderNotifier;
import com.tradefeed.orderservice.config.AmqpConfig;
import com.tradefeed.orderservice.service.LowStockAlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Post-commit side effects of a checkout. The order is already durable here:
 * each step is independent and a failing step is logged and dropped, never
 * requeued.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderPlacedSubscriber {

    private final OrderChatComposer orderChatComposer;
    private final OrderNotifier orderNotifier;
    private final LowStockAlertService lowStockAlertService;

    @RabbitListener(queues = AmqpConfig.Q_ORDER_NOTIFICATIONS)
    public void handleOrderPlaced(OrderPlacedContract contract) {
        log.info("Received '{}' event. orderNumber={}, tenantId={}", AmqpConfig.ROUTING_KEY_ORDER_CREATED,
                contract.getOrderNumber(), contract.getTenantId());

        String chatText = null;
        try {
            chatText = orderChatComposer.compose(contract);
        } catch (Exception e) {
            log.error("Failed to compose chat text. orderNumber={}", contract.getOrderNumber(), e);
        }

        try {
            orderNotifier.notifyNewOrder(contract, chatText);
        } catch (Exception e) {
            log.error("Failed to notify seller of new order. orderNumber={}", contract.getOrderNumber(), e);
        }

        try {
            lowStockAlertService.alertAfterOrder(contract);
        } catch (Exception e) {
            log.error("Failed to send low-stock alert. orderNumber={}", contract.getOrderNumber(), e);
        }
    }
}
