package com.tradefeed.orderservice.service;

import com.tradefeed.common.dto.StockShortfall;
import com.tradefeed.orderservice.collaborator.CatalogSnapshot;
import com.tradefeed.orderservice.collaborator.CatalogSnapshotReader;
import com.tradefeed.orderservice.dto.CheckoutItemRequest;
import com.tradefeed.orderservice.dto.StockValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Advisory stock pre-check. Reads only; stock may still change before the
 * order transaction decrements it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StockValidator {

    private final CatalogSnapshotReader catalogSnapshotReader;

    public StockValidationResult validate(UUID tenantId, List<CheckoutItemRequest> items) {
        List<UUID> variantIds = items.stream()
                .map(CheckoutItemRequest::getVariantId)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());
        return validate(tenantId, items, catalogSnapshotReader.readActiveVariants(variantIds));
    }

    /**
     * Checks each requested line against an already-read catalog. A variant
     * that is missing, inactive or owned by another shop counts as 0 available.
     */
    public StockValidationResult validate(UUID tenantId, List<CheckoutItemRequest> items,
                                          Map<UUID, CatalogSnapshot> catalog) {
        List<StockShortfall> shortfalls = new ArrayList<>();

        for (CheckoutItemRequest item : items) {
            CatalogSnapshot snapshot = item.getVariantId() == null ? null : catalog.get(item.getVariantId());
            boolean sellable = snapshot != null && snapshot.getTenantId().equals(tenantId);
            int available = sellable ? Math.max(snapshot.getStock(), 0) : 0;
            int requested = item.getQuantity() == null ? 0 : item.getQuantity();

            if (requested > available) {
                shortfalls.add(StockShortfall.builder()
                        .variantId(item.getVariantId())
                        .productName(displayName(item, sellable ? snapshot : null))
                        .requested(requested)
                        .available(available)
                        .build());
            }
        }

        if (!shortfalls.isEmpty()) {
            log.info("Stock check failed: tenantId={}, shortfalls={}", tenantId, shortfalls.size());
        }

        return StockValidationResult.builder()
                .valid(shortfalls.isEmpty())
                .shortfalls(shortfalls)
                .build();
    }

    private static String displayName(CheckoutItemRequest item, CatalogSnapshot snapshot) {
        if (snapshot != null) {
            return snapshot.getProductName();
        }
        if (item.getProductName() != null && !item.getProductName().isBlank()) {
            return item.getProductName();
        }
        return "Unavailable item";
    }
}
