package com.tradefeed.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class OrderItemResponse {
    private UUID id;
    private UUID productId;
    private UUID variantId;
    private String productName;
    private String option1Label;
    private String option1Value;
    private String option2Label;
    private String option2Value;
    private long unitPriceCents; // price at time of purchase
    private int quantity;
    private long lineTotalCents;
}
