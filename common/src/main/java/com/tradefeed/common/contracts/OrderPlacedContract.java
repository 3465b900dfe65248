package com.tradefeed.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Event contract for order.created.
 *
 * Written to the outbox in the same transaction as the order and relayed after
 * commit. Consumers (chat composition, seller notification, low-stock alert)
 * must never be able to fail the checkout that produced it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderPlacedContract {
    private UUID orderId;
    private String orderNumber;
    private UUID tenantId;
    private String buyerName;
    private String buyerPhone;
    private String buyerNote;
    // flattened delivery address, all null for collection orders
    private String deliveryAddress;
    private String deliveryCity;
    private String deliveryProvince;
    private String deliveryPostalCode;
    private long totalCents;
    private int itemCount;
    private String chatMessage;
    private List<OrderLineContract> items;
    private Instant createdAt;
}
