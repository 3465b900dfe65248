package com.tradefeed.orderservice.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * One priced cart line. Price and labels come from the catalog, never from the buyer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartLine {
    private UUID productId;
    private UUID variantId;
    private String productName;
    private String option1Label;
    private String option1Value;
    private String option2Label;
    private String option2Value;
    private long unitPriceCents;
    private int quantity;
}
