package com.tradefeed.orderservice.service;

import com.tradefeed.common.contracts.OrderLineContract;
import com.tradefeed.common.contracts.OrderPlacedContract;
import com.tradefeed.orderservice.collaborator.OrderNotifier;
import com.tradefeed.orderservice.config.OrderProperties;
import com.tradefeed.orderservice.dto.LowStockAlert;
import com.tradefeed.orderservice.model.Product;
import com.tradefeed.orderservice.model.ProductVariant;
import com.tradefeed.orderservice.repository.ProductVariantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Tells the seller which of the variants just sold are at or below the
 * low-stock threshold.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LowStockAlertService {

    private final ProductVariantRepository productVariantRepository;
    private final OrderNotifier orderNotifier;
    private final OrderProperties orderProperties;

    @Transactional(readOnly = true)
    public List<LowStockAlert> findLowStock(UUID tenantId, Collection<UUID> variantIds) {
        if (variantIds.isEmpty()) {
            return List.of();
        }
        return productVariantRepository
                .findLowStock(tenantId, variantIds, orderProperties.getLowStockThreshold())
                .stream()
                .map(LowStockAlertService::toAlert)
                .collect(Collectors.toList());
    }

    /**
     * Runs outside any transaction: the low-stock read has committed and
     * released its connection before the notifier is called.
     */
    public void alertAfterOrder(OrderPlacedContract order) {
        if (order.getItems() == null || order.getItems().isEmpty()) {
            return;
        }
        Set<UUID> variantIds = order.getItems().stream()
                .map(OrderLineContract::getVariantId)
                .collect(Collectors.toSet());

        List<LowStockAlert> alerts = findLowStock(order.getTenantId(), variantIds);
        if (alerts.isEmpty()) {
            return;
        }

        log.info("Low stock after order {}: {} variant(s) at or below {}", order.getOrderNumber(), alerts.size(),
                orderProperties.getLowStockThreshold());
        orderNotifier.notifyLowStock(order.getTenantId(), alerts);
    }

    private static LowStockAlert toAlert(ProductVariant variant) {
        Product product = variant.getProduct();
        return LowStockAlert.builder()
                .variantId(variant.getId())
                .productName(product.getName())
                .option1Label(product.getOption1Label())
                .option1Value(variant.getSize())
                .option2Label(product.getOption2Label())
                .option2Value(variant.getColor())
                .sku(variant.getSku())
                .currentStock(variant.getStock() == null ? 0 : variant.getStock())
                .build();
    }
}
