package com.tradefeed.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Contract for order.status_changed events.
 * Statuses are the external names: PENDING, CONFIRMED, SHIPPED, DELIVERED, CANCELLED.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatusChangeContract {
    private UUID orderId;
    private String orderNumber;
    private UUID tenantId;
    private String oldStatus;
    private String newStatus;
    private UUID changedBy;
    private Instant changedAt;
}
