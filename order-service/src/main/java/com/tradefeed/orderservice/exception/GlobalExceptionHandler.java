package com.tradefeed.orderservice.exception;

import com.tradefeed.common.dto.ErrorResponse;
import com.tradefeed.common.dto.ValidationErrorResponse;
import com.tradefeed.common.exception.AccessDeniedException;
import com.tradefeed.common.exception.InsufficientStockException;
import com.tradefeed.common.exception.ResourceNotFoundException;
import com.tradefeed.orderservice.service.OrderNumberGenerator;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private ErrorResponse.ErrorResponseBuilder baseResponse(HttpStatus status, String message,
                                                            String errorCode, HttpServletRequest request) {
        return ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(errorCode)
                .correlationId(generateCorrelationId());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.NOT_FOUND, ex.getMessage(),
                "RESOURCE_NOT_FOUND", request).build();

        return new ResponseEntity<>(errorResponse, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.FORBIDDEN, ex.getMessage(),
                "ACCESS_DENIED", request).build();

        return new ResponseEntity<>(errorResponse, HttpStatus.FORBIDDEN);
    }

    @ExceptionHandler(InvalidCartException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCartException(
            InvalidCartException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.BAD_REQUEST, ex.getMessage(),
                "VALIDATION_FAILED", request).build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientStockException(
            InsufficientStockException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(),
                "INSUFFICIENT_STOCK", request)
                .shortfalls(ex.getShortfalls())
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(IllegalStatusTransitionException.class)
    public ResponseEntity<ErrorResponse> handleIllegalStatusTransitionException(
            IllegalStatusTransitionException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.CONFLICT, ex.getMessage(),
                "ILLEGAL_TRANSITION", request)
                .currentStatus(ex.getCurrentStatus().name())
                .targetStatus(ex.getTargetStatus().name())
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(OrderNumberExhaustedException.class)
    public ResponseEntity<ErrorResponse> handleOrderNumberExhaustedException(
            OrderNumberExhaustedException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.SERVICE_UNAVAILABLE,
                "Failed to place order. Please try again.", "ORDER_NUMBER_EXHAUSTED", request).build();
        log.error("[{}] Order number allocation exhausted after {} attempts - Path: {}",
                errorResponse.getCorrelationId(), ex.getAttempts(), request.getRequestURI());

        return new ResponseEntity<>(errorResponse, HttpStatus.SERVICE_UNAVAILABLE);
    }

    /**
     * A lost race for an order number is retry-safe and answered like an
     * exhausted allocation. Any other integrity violation is unexpected.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolationException(
            DataIntegrityViolationException ex,
            HttpServletRequest request) {

        if (!OrderNumberGenerator.isNumberCollision(ex)) {
            return handleGlobalException(ex, request);
        }

        ErrorResponse errorResponse = baseResponse(HttpStatus.SERVICE_UNAVAILABLE,
                "Failed to place order. Please try again.", "ORDER_NUMBER_EXHAUSTED", request).build();
        log.warn("[{}] Order number collided with a concurrent checkout - Path: {}",
                errorResponse.getCorrelationId(), request.getRequestURI());

        return new ResponseEntity<>(errorResponse, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        Map<String, String> validationErrors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach(error -> {
            if (error instanceof FieldError fieldError) {
                validationErrors.put(fieldError.getField(), error.getDefaultMessage());
            }
        });

        String correlationId = generateCorrelationId();
        log.debug("[{}] Validation failed - Path: {} - Errors: {}", correlationId, request.getRequestURI(), validationErrors);

        ValidationErrorResponse errorResponse = ValidationErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message("Validation failed")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .validationErrors(validationErrors)
                .errorCode("VALIDATION_FAILED")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    // Unreadable JSON, or a status value that is not one of the five names
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.BAD_REQUEST, "Malformed request",
                "VALIDATION_FAILED", request).build();
        log.debug("[{}] Malformed request - Path: {} - {}", errorResponse.getCorrelationId(),
                request.getRequestURI(), ex.getMessage());

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.BAD_REQUEST, ex.getMessage(),
                "INVALID_ARGUMENT", request).build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    /**
     * Handles optimistic locking failures (two sellers changing the same order).
     * The caller should refresh and retry.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailureException(
            OptimisticLockingFailureException ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.CONFLICT,
                "The order was modified by another user. Please refresh and try again.",
                "CONCURRENT_MODIFICATION", request).build();
        log.warn("[{}] Optimistic locking conflict detected - Path: {} - User should retry",
                errorResponse.getCorrelationId(), request.getRequestURI());

        return new ResponseEntity<>(errorResponse, HttpStatus.CONFLICT);
    }

    /**
     * Store-level failures (connection loss, lock or statement timeouts). The
     * transaction was rolled back, so the request is safe to retry.
     */
    @ExceptionHandler({
            TransientDataAccessException.class,
            RecoverableDataAccessException.class,
            DataAccessResourceFailureException.class,
            CannotCreateTransactionException.class
    })
    public ResponseEntity<ErrorResponse> handleTransientStoreFailure(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.SERVICE_UNAVAILABLE,
                "Temporary failure. Please try again.", "TRANSIENT_FAILURE", request).build();
        log.error("[{}] Transient store failure - Path: {} - Exception: {}",
                errorResponse.getCorrelationId(), request.getRequestURI(), ex.getMessage(), ex);

        return new ResponseEntity<>(errorResponse, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        ErrorResponse errorResponse = baseResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact support if the problem persists.",
                "INTERNAL_SERVER_ERROR", request).build();
        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                errorResponse.getCorrelationId(),
                request.getRequestURI(),
                ex.getMessage(),
                ex);

        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
