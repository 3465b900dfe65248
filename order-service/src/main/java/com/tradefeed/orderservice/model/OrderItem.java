package com.tradefeed.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.UUID;

/**
 * Purchase-time receipt line. Product name and option values are copied from
 * the catalog so the order stays readable after the catalog changes; no column
 * is updatable once written.
 */
@Entity
@Table(name = "order_items", indexes = @Index(name = "idx_order_items_order", columnList = "order_id"))
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class OrderItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    private Order order;

    @Column(nullable = false, updatable = false)
    private int lineNumber;

    // Weak references into the catalog: the product may later be deleted
    @Column(nullable = false, updatable = false)
    private UUID productId;

    @Column(nullable = false, updatable = false)
    @ToString.Include
    private UUID variantId;

    @Column(nullable = false, updatable = false)
    @ToString.Include
    private String productName;

    @Column(updatable = false)
    private String option1Label;

    @Column(updatable = false)
    private String option1Value;

    @Column(updatable = false)
    private String option2Label;

    @Column(updatable = false)
    private String option2Value;

    @Column(name = "unit_price_cents", nullable = false, updatable = false)
    private long unitPriceCents;

    @Column(nullable = false, updatable = false)
    @ToString.Include
    private int quantity;

    public long getLineTotalCents() {
        return Math.multiplyExact(unitPriceCents, (long) quantity);
    }
}
