package com.tradefeed.common.exception;

/**
 * Exception thrown when the caller cannot be resolved to a tenant and role
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
