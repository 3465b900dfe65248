package com.tradefeed.orderservice.service;

import com.tradefeed.common.exception.ResourceNotFoundException;
import com.tradefeed.orderservice.config.OrderProperties;
import com.tradefeed.orderservice.dto.OrderCountResponse;
import com.tradefeed.orderservice.dto.OrderPageResponse;
import com.tradefeed.orderservice.dto.OrderResponse;
import com.tradefeed.orderservice.dto.OrderStatsResponse;
import com.tradefeed.orderservice.dto.TrackedOrderResponse;
import com.tradefeed.orderservice.mapper.OrderMapper;
import com.tradefeed.orderservice.model.Order;
import com.tradefeed.orderservice.model.OrderStatus;
import com.tradefeed.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.tradefeed.orderservice.repository.OrderSpecifications.after;
import static com.tradefeed.orderservice.repository.OrderSpecifications.belongsTo;
import static com.tradefeed.orderservice.repository.OrderSpecifications.hasStatus;

/**
 * Tenant-scoped order reads for sellers, plus the unscoped public tracking read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class OrderQueryService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt")
            .and(Sort.by(Sort.Direction.DESC, "id"));

    private final OrderRepository orderRepository;
    private final OrderMapper orderMapper;
    private final OrderProperties orderProperties;

    /**
     * Newest-first page of a tenant's orders. {@code cursor} is the
     * {@code nextCursor} of the previous page.
     *
     * @throws IllegalArgumentException if the cursor is not an order of this tenant
     */
    public OrderPageResponse listOrders(UUID tenantId, OrderStatus status, String cursor, Integer limit) {
        int pageSize = resolvePageSize(limit);

        Specification<Order> spec = belongsTo(tenantId);
        if (status != null) {
            spec = spec.and(hasStatus(status));
        }
        if (cursor != null && !cursor.isBlank()) {
            spec = spec.and(after(resolveCursor(tenantId, cursor)));
        }

        // one extra row tells whether another page exists
        List<Order> rows = orderRepository.findAll(spec, PageRequest.of(0, pageSize + 1, NEWEST_FIRST)).getContent();
        boolean hasMore = rows.size() > pageSize;
        List<Order> page = hasMore ? rows.subList(0, pageSize) : rows;

        return OrderPageResponse.builder()
                .orders(page.stream().map(orderMapper::toOrderResponse).collect(Collectors.toList()))
                .nextCursor(hasMore ? page.get(page.size() - 1).getId().toString() : null)
                .build();
    }

    public OrderResponse getOrder(UUID orderId, UUID tenantId) {
        return orderRepository.findByIdAndTenantId(orderId, tenantId)
                .map(orderMapper::toOrderResponse)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderId));
    }

    /**
     * Public tracking lookup. Not tenant-scoped; the buyer phone comes back
     * masked to its last 4 digits.
     */
    public Optional<TrackedOrderResponse> findByOrderNumber(String orderNumber) {
        if (orderNumber == null || orderNumber.isBlank()) {
            return Optional.empty();
        }
        String normalized = orderNumber.trim().toUpperCase(Locale.ROOT);

        return orderRepository.findByOrderNumber(normalized)
                .map(order -> {
                    TrackedOrderResponse response = orderMapper.toTrackedOrderResponse(order);
                    response.setBuyerPhone(maskPhone(order.getBuyerPhone()));
                    return response;
                });
    }

    public OrderStatsResponse getStats(UUID tenantId) {
        Map<OrderStatus, Long> counts = new EnumMap<>(OrderStatus.class);
        for (OrderRepository.StatusCount row : orderRepository.countByStatus(tenantId)) {
            counts.put(row.getStatus(), row.getTotal());
        }

        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        long revenue = orderRepository.sumTotalCentsExcludingStatus(tenantId, OrderStatus.CANCELLED);

        return OrderStatsResponse.builder()
                .total(total)
                .pending(counts.getOrDefault(OrderStatus.PENDING, 0L))
                .confirmed(counts.getOrDefault(OrderStatus.CONFIRMED, 0L))
                .shipped(counts.getOrDefault(OrderStatus.SHIPPED, 0L))
                .delivered(counts.getOrDefault(OrderStatus.DELIVERED, 0L))
                .cancelled(counts.getOrDefault(OrderStatus.CANCELLED, 0L))
                .revenueCents(revenue)
                .build();
    }

    public OrderCountResponse countOrders(UUID tenantId) {
        return new OrderCountResponse(orderRepository.countByTenantId(tenantId));
    }

    /**
     * "0821234567" becomes "***4567". Phones of 4 characters or fewer are
     * fully hidden behind the prefix.
     */
    public static String maskPhone(String phone) {
        if (phone == null) {
            return null;
        }
        String trimmed = phone.trim();
        if (trimmed.length() <= 4) {
            return "***";
        }
        return "***" + trimmed.substring(trimmed.length() - 4);
    }

    private int resolvePageSize(Integer limit) {
        if (limit == null) {
            return orderProperties.getDefaultPageSize();
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1");
        }
        return Math.min(limit, orderProperties.getMaxPageSize());
    }

    private Order resolveCursor(UUID tenantId, String cursor) {
        UUID anchorId;
        try {
            anchorId = UUID.fromString(cursor.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cursor: " + cursor, e);
        }
        return orderRepository.findByIdAndTenantId(anchorId, tenantId)
                .orElseThrow(() -> new IllegalArgumentException("Invalid cursor: " + cursor));
    }
}
