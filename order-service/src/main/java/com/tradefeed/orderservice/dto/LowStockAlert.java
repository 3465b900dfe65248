package com.tradefeed.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class LowStockAlert {
    private UUID variantId;
    private String productName;
    private String option1Label;
    private String option1Value;
    private String option2Label;
    private String option2Value;
    private String sku;
    private int currentStock;

    public boolean isOutOfStock() {
        return currentStock <= 0;
    }
}
