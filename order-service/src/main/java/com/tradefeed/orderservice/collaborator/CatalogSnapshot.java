package com.tradefeed.orderservice.collaborator;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * What the order core needs to know about one active variant at checkout:
 * owner, current price and stock, and the labels copied into the line item.
 */
@Value
@Builder
public class CatalogSnapshot {
    UUID variantId;
    UUID productId;
    UUID tenantId;
    String productName;
    String option1Label;
    String option1Value;
    String option2Label;
    String option2Value;
    long priceCents;
    int stock;
    String sku;
}
