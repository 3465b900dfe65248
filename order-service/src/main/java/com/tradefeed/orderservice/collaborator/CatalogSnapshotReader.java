package com.tradefeed.orderservice.collaborator;

import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/**
 * Read side of the catalog. Variants that are missing or inactive are simply
 * absent from the result.
 */
public interface CatalogSnapshotReader {

    Map<UUID, CatalogSnapshot> readActiveVariants(Collection<UUID> variantIds);
}
