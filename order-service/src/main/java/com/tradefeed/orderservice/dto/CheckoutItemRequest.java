package com.tradefeed.orderservice.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutItemRequest {
    @NotNull(message = "Variant ID cannot be null")
    private UUID variantId;

    // Name shown in the buyer's cart; used to describe a variant that no longer exists
    @Size(max = 200, message = "Product name is too long")
    private String productName;

    @NotNull(message = "Quantity cannot be null")
    @Min(value = 1, message = "Quantity must be at least 1")
    @Max(value = 9999, message = "Quantity must be at most 9999")
    private Integer quantity;
}
