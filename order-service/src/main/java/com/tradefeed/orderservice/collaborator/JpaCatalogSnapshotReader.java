package com.tradefeed.orderservice.collaborator;

import com.tradefeed.orderservice.model.Product;
import com.tradefeed.orderservice.model.ProductVariant;
import com.tradefeed.orderservice.repository.ProductVariantRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaCatalogSnapshotReader implements CatalogSnapshotReader {

    private final ProductVariantRepository productVariantRepository;

    @Override
    @Transactional(readOnly = true)
    public Map<UUID, CatalogSnapshot> readActiveVariants(Collection<UUID> variantIds) {
        if (variantIds.isEmpty()) {
            return Map.of();
        }

        // Single query with the product joined in, no N+1
        Map<UUID, CatalogSnapshot> snapshots = productVariantRepository.findActiveByIdIn(variantIds).stream()
                .filter(variant -> Boolean.TRUE.equals(variant.getProduct().getIsActive()))
                .map(JpaCatalogSnapshotReader::toSnapshot)
                .collect(Collectors.toMap(CatalogSnapshot::getVariantId, Function.identity()));

        log.debug("Read {} of {} requested variants from catalog", snapshots.size(), variantIds.size());
        return snapshots;
    }

    static CatalogSnapshot toSnapshot(ProductVariant variant) {
        Product product = variant.getProduct();
        return CatalogSnapshot.builder()
                .variantId(variant.getId())
                .productId(product.getId())
                .tenantId(product.getTenantId())
                .productName(product.getName())
                .option1Label(product.getOption1Label())
                .option1Value(variant.getSize())
                .option2Label(product.getOption2Label())
                .option2Value(variant.getColor())
                .priceCents(variant.getPriceInCents())
                .stock(variant.getStock() == null ? 0 : variant.getStock())
                .sku(variant.getSku())
                .build();
    }
}
