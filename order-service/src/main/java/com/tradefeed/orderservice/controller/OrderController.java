package com.tradefeed.orderservice.controller;

import com.tradefeed.orderservice.dto.OrderCountResponse;
import com.tradefeed.orderservice.dto.OrderPageResponse;
import com.tradefeed.orderservice.dto.OrderResponse;
import com.tradefeed.orderservice.dto.OrderStatsResponse;
import com.tradefeed.orderservice.dto.StatusUpdateRequest;
import com.tradefeed.orderservice.model.OrderStatus;
import com.tradefeed.orderservice.security.TenantAccess;
import com.tradefeed.orderservice.security.TenantAccessResolver;
import com.tradefeed.orderservice.service.OrderQueryService;
import com.tradefeed.orderservice.service.OrderStatusService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Seller dashboard endpoints. Every read and write is scoped to the caller's shop.
 */
@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderQueryService orderQueryService;
    private final OrderStatusService orderStatusService;
    private final TenantAccessResolver tenantAccessResolver;

    @GetMapping
    public ResponseEntity<OrderPageResponse> listOrders(
            @RequestParam(required = false) OrderStatus status,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) Integer limit,
            @AuthenticationPrincipal Jwt jwt) {
        TenantAccess access = tenantAccessResolver.resolve(jwt);
        return ResponseEntity.ok(orderQueryService.listOrders(access.getTenantId(), status, cursor, limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<OrderStatsResponse> getStats(@AuthenticationPrincipal Jwt jwt) {
        TenantAccess access = tenantAccessResolver.resolve(jwt);
        return ResponseEntity.ok(orderQueryService.getStats(access.getTenantId()));
    }

    @GetMapping("/count")
    public ResponseEntity<OrderCountResponse> countOrders(@AuthenticationPrincipal Jwt jwt) {
        TenantAccess access = tenantAccessResolver.resolve(jwt);
        return ResponseEntity.ok(orderQueryService.countOrders(access.getTenantId()));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        TenantAccess access = tenantAccessResolver.resolve(jwt);
        return ResponseEntity.ok(orderQueryService.getOrder(orderId, access.getTenantId()));
    }

    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> updateStatus(
            @PathVariable UUID orderId,
            @Valid @RequestBody StatusUpdateRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        TenantAccess access = tenantAccessResolver.resolve(jwt);
        OrderResponse response = orderStatusService.transition(
                orderId, access.getTenantId(), request.getStatus(), access.getCallerId());
        return ResponseEntity.ok(response);
    }
}
