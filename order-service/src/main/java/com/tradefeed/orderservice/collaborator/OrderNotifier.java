package com.tradefeed.orderservice.collaborator;

import com.tradefeed.common.contracts.OrderPlacedContract;
import com.tradefeed.orderservice.dto.LowStockAlert;

import java.util.List;
import java.util.UUID;

/**
 * Outbound seller notifications (email, push). Called after the order has
 * committed; implementations may throw and the caller drops the failure.
 */
public interface OrderNotifier {

    void notifyNewOrder(OrderPlacedContract order, String chatText);

    void notifyLowStock(UUID tenantId, List<LowStockAlert> alerts);
}
