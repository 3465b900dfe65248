package com.tradefeed.orderservice.exception;

/**
 * Exception thrown for malformed checkout input (empty cart, bad quantities,
 * variants from another shop). Raised before any write.
 * HTTP Status: 400 Bad Request
 */
public class InvalidCartException extends RuntimeException {

    public InvalidCartException(String message) {
        super(message);
    }
}
