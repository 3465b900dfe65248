package com.tradefeed.orderservice.service;

import com.tradefeed.common.exception.InsufficientStockException;
import com.tradefeed.orderservice.collaborator.CatalogSnapshot;
import com.tradefeed.orderservice.collaborator.CatalogSnapshotReader;
import com.tradefeed.orderservice.dto.CheckoutItemRequest;
import com.tradefeed.orderservice.dto.CheckoutRequest;
import com.tradefeed.orderservice.dto.OrderResponse;
import com.tradefeed.orderservice.dto.StockCheckRequest;
import com.tradefeed.orderservice.dto.StockValidationResult;
import com.tradefeed.orderservice.exception.InvalidCartException;
import com.tradefeed.orderservice.mapper.OrderMapper;
import com.tradefeed.orderservice.model.DeliveryAddress;
import com.tradefeed.orderservice.model.Order;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Buyer checkout: validate the cart, pre-check stock, then hand a priced cart
 * to {@link OrderTransactionService}. Chat text, seller notification and
 * low-stock alerts follow from the order.created event after commit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckoutService {

    private final CatalogSnapshotReader catalogSnapshotReader;
    private final StockValidator stockValidator;
    private final OrderTransactionService orderTransactionService;
    private final OrderMapper orderMapper;

    public OrderResponse checkout(UUID tenantId, CheckoutRequest request) {
        log.info("Checkout started. tenantId={}", tenantId);
        List<CheckoutItemRequest> items = validateCart(request);

        List<UUID> variantIds = items.stream().map(CheckoutItemRequest::getVariantId).collect(Collectors.toList());
        Map<UUID, CatalogSnapshot> catalog = catalogSnapshotReader.readActiveVariants(variantIds);

        for (CatalogSnapshot snapshot : catalog.values()) {
            if (!snapshot.getTenantId().equals(tenantId)) {
                log.warn("Variant belongs to another shop: variantId={}, expectedTenantId={}, actualTenantId={}",
                        snapshot.getVariantId(), tenantId, snapshot.getTenantId());
                throw new InvalidCartException("Item " + snapshot.getVariantId() + " does not belong to this shop");
            }
        }

        StockValidationResult stock = stockValidator.validate(tenantId, items, catalog);
        if (!stock.isValid()) {
            throw new InsufficientStockException(stock.getShortfalls());
        }

        List<CartLine> lines = new ArrayList<>(items.size());
        for (CheckoutItemRequest item : items) {
            CatalogSnapshot snapshot = catalog.get(item.getVariantId());
            lines.add(CartLine.builder()
                    .productId(snapshot.getProductId())
                    .variantId(snapshot.getVariantId())
                    .productName(snapshot.getProductName())
                    .option1Label(snapshot.getOption1Label())
                    .option1Value(snapshot.getOption1Value())
                    .option2Label(snapshot.getOption2Label())
                    .option2Value(snapshot.getOption2Value())
                    .unitPriceCents(snapshot.getPriceCents())
                    .quantity(item.getQuantity())
                    .build());
        }

        CreateOrderCommand command = CreateOrderCommand.builder()
                .tenantId(tenantId)
                .buyerName(clean(request.getBuyerName()))
                .buyerPhone(clean(request.getBuyerPhone()))
                .buyerNote(clean(request.getBuyerNote()))
                .deliveryAddress(cleanAddress(request.getDeliveryAddress()))
                .chatMessage(request.getChatMessage())
                .lines(lines)
                .build();

        Order order = placeOrder(command);
        log.info("Checkout completed. orderNumber={}, tenantId={}", order.getOrderNumber(), tenantId);

        return orderMapper.toOrderResponse(order);
    }

    /**
     * Runs the order transaction, retrying once when a concurrent checkout took
     * the same order number. The failed attempt rolled back before anything was
     * decremented, so the retry starts clean. A second collision propagates and
     * is answered as ORDER_NUMBER_EXHAUSTED.
     */
    private Order placeOrder(CreateOrderCommand command) {
        try {
            return orderTransactionService.createOrder(command);
        } catch (DataIntegrityViolationException e) {
            if (!OrderNumberGenerator.isNumberCollision(e)) {
                throw e;
            }
            log.warn("Order number taken by a concurrent checkout, retrying once. tenantId={}", command.getTenantId());
            return orderTransactionService.createOrder(command);
        }
    }

    /**
     * Read-only stock check for the cart page. Never writes.
     */
    public StockValidationResult checkStock(UUID tenantId, StockCheckRequest request) {
        List<CheckoutItemRequest> items = validateCart(request.getItems());
        return stockValidator.validate(tenantId, items);
    }

    private List<CheckoutItemRequest> validateCart(CheckoutRequest request) {
        if (request == null) {
            throw new InvalidCartException("Checkout request is required");
        }
        return validateCart(request.getItems());
    }

    private List<CheckoutItemRequest> validateCart(List<CheckoutItemRequest> items) {
        if (items == null || items.isEmpty()) {
            throw new InvalidCartException("Order must contain at least one item");
        }

        Set<UUID> seen = new HashSet<>();
        for (CheckoutItemRequest item : items) {
            if (item == null || item.getVariantId() == null) {
                throw new InvalidCartException("Every item needs a variant id");
            }
            if (item.getQuantity() == null || item.getQuantity() < 1) {
                throw new InvalidCartException("Quantity must be at least 1 for variant " + item.getVariantId());
            }
            if (!seen.add(item.getVariantId())) {
                throw new InvalidCartException("Variant " + item.getVariantId() + " appears more than once");
            }
        }
        return items;
    }

    private static String clean(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static DeliveryAddress cleanAddress(DeliveryAddress address) {
        if (address == null || clean(address.getAddress()) == null) {
            return null;
        }
        DeliveryAddress cleaned = new DeliveryAddress();
        cleaned.setAddress(clean(address.getAddress()));
        cleaned.setCity(clean(address.getCity()));
        cleaned.setProvince(clean(address.getProvince()));
        cleaned.setPostalCode(clean(address.getPostalCode()));
        return cleaned;
    }
}
