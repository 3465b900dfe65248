package com.tradefeed.orderservice.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "orders", uniqueConstraints = {
        @UniqueConstraint(name = Order.ORDER_NUMBER_CONSTRAINT, columnNames = "order_number")
}, indexes = {
        @Index(name = "idx_orders_tenant_created", columnList = "tenant_id, created_at"),
        @Index(name = "idx_orders_tenant_status", columnList = "tenant_id, status")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
public class Order {

    public static final String ORDER_NUMBER_CONSTRAINT = "uk_orders_order_number";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    // Public tracking number, e.g. TF-20260224-A1B2
    @Column(name = "order_number", nullable = false, updatable = false, length = 32)
    @ToString.Include
    private String orderNumber;

    // Seller (shop) that owns this order
    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    // Buyers are not logged in, so every buyer field is optional
    @Column(length = 100)
    private String buyerName;

    @Column(length = 32)
    private String buyerPhone;

    @Column(length = 1000)
    private String buyerNote;

    @Embedded
    private DeliveryAddress deliveryAddress;

    // Sum of line totals at creation time; only addItem() changes it
    @Setter(AccessLevel.NONE)
    @Column(name = "total_cents", nullable = false, updatable = false)
    private long totalCents;

    @Setter(AccessLevel.NONE)
    @Column(name = "item_count", nullable = false, updatable = false)
    private int itemCount;

    // Text handed to the buyer's chat channel
    @Column(name = "chat_message", columnDefinition = "text")
    private String chatMessage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @ToString.Include
    private OrderStatus status;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber ASC")
    @Setter(AccessLevel.NONE)
    private List<OrderItem> items = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    // Two sellers changing the status at once: the second write fails instead of
    // silently overwriting the first
    @Version
    @Column(name = "version")
    private Long version;

    /**
     * Attaches a line item and folds it into the order totals.
     * Totals are never set directly, so they always equal the sum of the items.
     */
    public void addItem(OrderItem item) {
        item.setOrder(this);
        item.setLineNumber(items.size() + 1);
        items.add(item);
        totalCents = Math.addExact(totalCents, item.getLineTotalCents());
        itemCount = Math.addExact(itemCount, item.getQuantity());
    }
}
