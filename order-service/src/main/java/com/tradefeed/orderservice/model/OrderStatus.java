package com.tradefeed.orderservice.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Order lifecycle. PENDING is the only initial state; DELIVERED and CANCELLED
 * are terminal.
 */
public enum OrderStatus {
    PENDING,
    CONFIRMED,
    SHIPPED,
    DELIVERED,
    CANCELLED;

    private static final Map<OrderStatus, Set<OrderStatus>> ALLOWED_TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        ALLOWED_TRANSITIONS.put(PENDING, Collections.unmodifiableSet(EnumSet.of(CONFIRMED, CANCELLED)));
        ALLOWED_TRANSITIONS.put(CONFIRMED, Collections.unmodifiableSet(EnumSet.of(SHIPPED, CANCELLED)));
        ALLOWED_TRANSITIONS.put(SHIPPED, Collections.unmodifiableSet(EnumSet.of(DELIVERED)));
        ALLOWED_TRANSITIONS.put(DELIVERED, Collections.unmodifiableSet(EnumSet.noneOf(OrderStatus.class)));
        ALLOWED_TRANSITIONS.put(CANCELLED, Collections.unmodifiableSet(EnumSet.noneOf(OrderStatus.class)));
    }

    public Set<OrderStatus> allowedTargets() {
        return ALLOWED_TRANSITIONS.get(this);
    }

    public boolean canTransitionTo(OrderStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }
}
