package com.tradefeed.orderservice.exception;

import com.tradefeed.orderservice.model.OrderStatus;

/**
 * Exception thrown when a status change is not allowed from the order's
 * current status, e.g. DELIVERED -> PENDING.
 * HTTP Status: 409 Conflict
 */
public class IllegalStatusTransitionException extends RuntimeException {

    private final OrderStatus currentStatus;
    private final OrderStatus targetStatus;

    public IllegalStatusTransitionException(OrderStatus currentStatus, OrderStatus targetStatus) {
        super("Cannot change from " + currentStatus + " to " + targetStatus + ".");
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    public OrderStatus getCurrentStatus() {
        return currentStatus;
    }

    public OrderStatus getTargetStatus() {
        return targetStatus;
    }
}
