package com.tradefeed.orderservice.repository;

import com.tradefeed.orderservice.model.ProductVariant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The only code path that writes variant stock. Every writer goes through one of
 * the two decrement queries below.
 */
@Repository
public interface ProductVariantRepository extends JpaRepository<ProductVariant, UUID> {

    // active variants with their product, for stock checks and line-item snapshots
    @Query("SELECT v FROM ProductVariant v JOIN FETCH v.product WHERE v.id IN :ids AND v.isActive = true")
    List<ProductVariant> findActiveByIdIn(@Param("ids") Collection<UUID> ids);

    @Query("SELECT v.stock FROM ProductVariant v WHERE v.id = :id")
    Optional<Integer> findStockById(@Param("id") UUID id);

    // compare-and-set: 0 rows when the floor would be crossed
    @Modifying
    @Query("UPDATE ProductVariant v SET v.stock = v.stock - :quantity WHERE v.id = :id AND v.stock >= :quantity")
    int decrementStockIfAvailable(@Param("id") UUID id, @Param("quantity") int quantity);

    // no floor check, stock may go negative
    @Modifying
    @Query("UPDATE ProductVariant v SET v.stock = v.stock - :quantity WHERE v.id = :id")
    int decrementStock(@Param("id") UUID id, @Param("quantity") int quantity);

    @Query("SELECT v FROM ProductVariant v JOIN FETCH v.product p " +
            "WHERE v.id IN :ids AND p.tenantId = :tenantId AND v.stock <= :threshold")
    List<ProductVariant> findLowStock(@Param("tenantId") UUID tenantId,
                                      @Param("ids") Collection<UUID> ids,
                                      @Param("threshold") int threshold);
}
