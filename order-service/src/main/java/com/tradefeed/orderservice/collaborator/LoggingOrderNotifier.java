package com.tradefeed.orderservice.collaborator;

import com.tradefeed.common.contracts.OrderPlacedContract;
import com.tradefeed.orderservice.dto.LowStockAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Default notifier until a delivery channel is wired in: writes what would
 * have been sent to the log.
 */
@Component
@Slf4j
public class LoggingOrderNotifier implements OrderNotifier {

    @Override
    public void notifyNewOrder(OrderPlacedContract order, String chatText) {
        log.info("New order notification: tenantId={}, orderNumber={}, totalCents={}, itemCount={}",
                order.getTenantId(), order.getOrderNumber(), order.getTotalCents(), order.getItemCount());
        log.debug("Chat text for order {}:\n{}", order.getOrderNumber(), chatText);
    }

    @Override
    public void notifyLowStock(UUID tenantId, List<LowStockAlert> alerts) {
        for (LowStockAlert alert : alerts) {
            log.info("Low stock notification: tenantId={}, variantId={}, product={}, stock={}, outOfStock={}",
                    tenantId, alert.getVariantId(), alert.getProductName(), alert.getCurrentStock(),
                    alert.isOutOfStock());
        }
    }
}
