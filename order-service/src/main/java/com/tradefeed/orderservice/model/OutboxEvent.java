package com.tradefeed.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * An order event waiting to be relayed to the order exchange. Written in the
 * same transaction as the order change it describes.
 */
@Entity
@Table(name = "outbox", indexes = {
        @Index(name = "idx_outbox_pending", columnList = "processed, created_at"),
        @Index(name = "idx_outbox_aggregate", columnList = "aggregate_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEvent {

    public static final String AGGREGATE_ORDER = "ORDER";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "aggregate_type", nullable = false, length = 32)
    private String aggregateType;

    // Order id
    @Column(name = "aggregate_id", nullable = false, length = 36)
    private String aggregateId;

    // Routing key: order.created or order.status_changed
    @Column(nullable = false, length = 64)
    private String type;

    @Column(columnDefinition = "jsonb", nullable = false)
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(nullable = false)
    private boolean processed;

    // when the broker accepted the event; the purge keys on it
    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Column(name = "publish_attempts", nullable = false)
    private int publishAttempts;

    public void markPublished(LocalDateTime at) {
        this.processed = true;
        this.publishedAt = at;
        this.publishAttempts++;
    }

    public void recordFailedAttempt() {
        this.publishAttempts++;
    }
}
