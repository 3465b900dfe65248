package com.tradefeed.orderservice.dto;

import com.tradefeed.orderservice.model.DeliveryAddress;
import com.tradefeed.orderservice.model.OrderStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Public tracking view. Anyone holding the order number can read it, so the
 * buyer phone is masked to its last 4 digits.
 */
@Data
@Builder
public class TrackedOrderResponse {
    private UUID id;
    private String orderNumber;
    private UUID tenantId;
    private OrderStatus status;
    private String buyerName;
    private String buyerPhone; // ***1234
    private String buyerNote;
    private DeliveryAddress deliveryAddress;
    private long totalCents;
    private int itemCount;
    private List<OrderItemResponse> items;
    private Instant createdAt;
    private Instant updatedAt;
}
