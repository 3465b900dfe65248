package com.tradefeed.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Where the buyer wants the order delivered. Bound straight from the checkout
 * body, so the size limits here match the column lengths.
 */
@Data
@Embeddable
public class DeliveryAddress {

    @Size(max = 255, message = "Delivery address is too long")
    @Column(name = "delivery_address", length = 255)
    private String address;

    @Size(max = 100, message = "City is too long")
    @Column(name = "delivery_city", length = 100)
    private String city;

    @Size(max = 100, message = "Province is too long")
    @Column(name = "delivery_province", length = 100)
    private String province;

    @Size(max = 16, message = "Postal code is too long")
    @Column(name = "delivery_postal_code", length = 16)
    private String postalCode;
}
