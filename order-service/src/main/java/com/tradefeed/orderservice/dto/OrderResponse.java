package com.tradefeed.orderservice.dto;

import com.tradefeed.orderservice.model.DeliveryAddress;
import com.tradefeed.orderservice.model.OrderStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Data
@Builder
public class OrderResponse {
    private UUID id;
    private String orderNumber;
    private UUID tenantId;
    private String buyerName;
    private String buyerPhone;
    private String buyerNote;
    private DeliveryAddress deliveryAddress;
    private long totalCents;
    private int itemCount;
    private String chatMessage;
    private OrderStatus status;
    // statuses the seller may move this order to next
    private Set<OrderStatus> allowedTransitions;
    private List<OrderItemResponse> items;
    private Instant createdAt;
    private Instant updatedAt;
}
