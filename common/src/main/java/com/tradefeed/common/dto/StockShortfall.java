package com.tradefeed.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * One cart line that asks for more units than are available.
 * A variant that no longer exists or is inactive reports available = 0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockShortfall {
    private UUID variantId;
    private String productName;
    private int requested;
    private int available;
}
