package com.tradefeed.common.exception;

/**
 * Exception thrown when a lookup finds nothing.
 * Also used instead of a "forbidden" answer for resources owned by another
 * tenant, so callers cannot probe which ids exist.
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
