package com.tradefeed.orderservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class StockCheckRequest {
    @NotEmpty(message = "Items list cannot be empty")
    @Valid
    private List<CheckoutItemRequest> items;
}
