package com.tradefeed.orderservice.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class OrderPageResponse {
    private List<OrderResponse> orders;
    // id of the last order on this page; null when there are no more pages
    private String nextCursor;
}
