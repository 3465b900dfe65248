package com.tradefeed.orderservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OrderStatsResponse {
    private long total;
    private long pending;
    private long confirmed;
    private long shipped;
    private long delivered;
    private long cancelled;
    // every order except CANCELLED
    private long revenueCents;
}
