package com.tradefeed.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.UUID;

/**
 * Catalog product, owned by the catalog. Read here only for the line-item
 * snapshot (name and option labels) and the owning tenant.
 */
@Getter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "products")
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private UUID tenantId;

    @Column(nullable = false)
    @ToString.Include
    private String name;

    @Builder.Default
    @Column(nullable = false)
    private String option1Label = "Size";

    @Builder.Default
    @Column(nullable = false)
    private String option2Label = "Color";

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;
}
