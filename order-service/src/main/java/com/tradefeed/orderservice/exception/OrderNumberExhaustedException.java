package com.tradefeed.orderservice.exception;

/**
 * Exception thrown when every generated order number collided with an existing
 * one. Nothing was written; the caller may retry the whole checkout.
 * HTTP Status: 503 Service Unavailable
 */
public class OrderNumberExhaustedException extends RuntimeException {

    private final int attempts;

    public OrderNumberExhaustedException(int attempts) {
        super("Could not allocate a unique order number after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
