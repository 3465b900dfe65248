package com.tradefeed.orderservice.repository;

import com.tradefeed.orderservice.model.OutboxEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface OutboxRepository extends JpaRepository<OutboxEvent, UUID> {

    // oldest first, so events of one order leave in the order they were written
    List<OutboxEvent> findTop50ByProcessedFalseOrderByCreatedAtAsc();

    List<OutboxEvent> findTop1000ByProcessedTrueAndPublishedAtBefore(LocalDateTime cutoff);

    List<OutboxEvent> findByAggregateIdOrderByCreatedAtAsc(String aggregateId);
}
