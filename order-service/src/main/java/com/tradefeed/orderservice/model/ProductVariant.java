package com.tradefeed.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.UUID;

/**
 * Sellable unit. The catalog owns this row; the order core reads it and
 * changes {@code stock} only through the decrement queries in
 * {@link com.tradefeed.orderservice.repository.ProductVariantRepository}.
 * It has no setters.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "product_variants")
public class ProductVariant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    // option1 value, e.g. "M"
    @Column(nullable = false)
    private String size;

    // option2 value, optional
    private String color;

    @Column(name = "price_in_cents", nullable = false)
    private long priceInCents;

    @Builder.Default
    @Column(nullable = false)
    @ToString.Include
    private Integer stock = 0;

    private String sku;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;
}
