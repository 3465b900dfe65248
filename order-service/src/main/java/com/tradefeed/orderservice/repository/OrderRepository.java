package com.tradefeed.orderservice.repository;

import com.tradefeed.orderservice.model.Order;
import com.tradefeed.orderservice.model.OrderStatus;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<Order, UUID>, JpaSpecificationExecutor<Order> {

    // collision check for generated order numbers
    boolean existsByOrderNumber(String orderNumber);

    // tenant ownership folded into the lookup: another tenant's order is simply "not found"
    @EntityGraph(attributePaths = "items")
    Optional<Order> findByIdAndTenantId(UUID id, UUID tenantId);

    // public tracking, no tenant scope
    @EntityGraph(attributePaths = "items")
    Optional<Order> findByOrderNumber(String orderNumber);

    long countByTenantId(UUID tenantId);

    @Query("SELECT o.status AS status, COUNT(o) AS total FROM Order o WHERE o.tenantId = :tenantId GROUP BY o.status")
    List<StatusCount> countByStatus(@Param("tenantId") UUID tenantId);

    @Query("SELECT COALESCE(SUM(o.totalCents), 0) FROM Order o WHERE o.tenantId = :tenantId AND o.status <> :excluded")
    long sumTotalCentsExcludingStatus(@Param("tenantId") UUID tenantId, @Param("excluded") OrderStatus excluded);

    interface StatusCount {
        OrderStatus getStatus();

        long getTotal();
    }
}
