package com.tradefeed.orderservice.repository;

import com.tradefeed.orderservice.model.Order;
import com.tradefeed.orderservice.model.OrderStatus;
import org.springframework.data.jpa.domain.Specification;

import java.util.UUID;

/**
 * Filters for the seller order list.
 */
public final class OrderSpecifications {

    private OrderSpecifications() {
    }

    public static Specification<Order> belongsTo(UUID tenantId) {
        return (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId);
    }

    public static Specification<Order> hasStatus(OrderStatus status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    // Keyset: strictly after the anchor in (createdAt DESC, id DESC) order
    public static Specification<Order> after(Order anchor) {
        return (root, query, cb) -> cb.or(
                cb.lessThan(root.get("createdAt"), anchor.getCreatedAt()),
                cb.and(
                        cb.equal(root.get("createdAt"), anchor.getCreatedAt()),
                        cb.lessThan(root.get("id"), anchor.getId())));
    }
}
