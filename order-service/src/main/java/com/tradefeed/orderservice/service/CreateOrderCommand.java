package com.tradefeed.orderservice.service;

import com.tradefeed.orderservice.model.DeliveryAddress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

/**
 * Create Order Command: a validated, priced cart ready for the transaction engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderCommand {
    private UUID tenantId;
    private String buyerName;
    private String buyerPhone;
    private String buyerNote;
    private DeliveryAddress deliveryAddress;
    private String chatMessage;
    private List<CartLine> lines;
}
