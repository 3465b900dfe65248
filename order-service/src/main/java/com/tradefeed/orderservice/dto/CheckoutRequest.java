package com.tradefeed.orderservice.dto;

import com.tradefeed.orderservice.model.DeliveryAddress;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class CheckoutRequest {

    @Size(max = 100, message = "Buyer name is too long")
    private String buyerName;

    @Size(max = 32, message = "Buyer phone is too long")
    private String buyerPhone;

    @Size(max = 1000, message = "Buyer note is too long")
    private String buyerNote;

    // optional; buyers collecting in person leave it out
    @Valid
    private DeliveryAddress deliveryAddress;

    // free-text payload for the chat channel, stored with the order
    @Size(max = 4000, message = "Chat message is too long")
    private String chatMessage;

    @NotEmpty(message = "Order must contain at least one item")
    @Valid
    private List<CheckoutItemRequest> items;
}
