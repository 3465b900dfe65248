package com.tradefeed.orderservice.dto;

import com.tradefeed.common.dto.StockShortfall;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockValidationResult {
    private boolean valid;
    // one entry per insufficient line, none for sufficient ones
    private List<StockShortfall> shortfalls;
}
