package com.tradefeed.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineContract {
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
