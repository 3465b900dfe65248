package com.tradefeed.orderservice.controller;

import com.tradefeed.common.exception.ResourceNotFoundException;
import com.tradefeed.orderservice.dto.CheckoutRequest;
import com.tradefeed.orderservice.dto.OrderResponse;
import com.tradefeed.orderservice.dto.StockCheckRequest;
import com.tradefeed.orderservice.dto.StockValidationResult;
import com.tradefeed.orderservice.dto.TrackedOrderResponse;
import com.tradefeed.orderservice.service.CheckoutService;
import com.tradefeed.orderservice.service.OrderQueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Buyer-facing endpoints. Buyers are not logged in.
 */
@RestController
@RequestMapping("/api/v1/public")
@RequiredArgsConstructor
public class PublicOrderController {

    private final CheckoutService checkoutService;
    private final OrderQueryService orderQueryService;

    @PostMapping("/shops/{tenantId}/checkout")
    public ResponseEntity<OrderResponse> checkout(
            @PathVariable UUID tenantId,
            @Valid @RequestBody CheckoutRequest request) {
        OrderResponse response = checkoutService.checkout(tenantId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/shops/{tenantId}/stock-check")
    public ResponseEntity<StockValidationResult> checkStock(
            @PathVariable UUID tenantId,
            @Valid @RequestBody StockCheckRequest request) {
        return ResponseEntity.ok(checkoutService.checkStock(tenantId, request));
    }

    @GetMapping("/orders/{orderNumber}")
    public ResponseEntity<TrackedOrderResponse> trackOrder(@PathVariable String orderNumber) {
        TrackedOrderResponse response = orderQueryService.findByOrderNumber(orderNumber)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderNumber));
        return ResponseEntity.ok(response);
    }
}
