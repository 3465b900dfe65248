package com.tradefeed.orderservice;

import com.tradefeed.orderservice.repository.OrderRepository;
import com.tradefeed.orderservice.repository.OutboxRepository;
import com.tradefeed.orderservice.service.OrderTransactionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The opt-in unconditional decrement: both racing checkouts commit and the
 * variant is oversold. This documents the known defect of that policy.
 */
@TestPropertySource(properties = "tradefeed.orders.stock-policy=UNCONDITIONAL")
public class UnconditionalStockPolicyIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private OrderTransactionService orderTransactionService;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OutboxRepository outboxRepository;

    @Autowired
    private TestCatalogService testCatalogService;

    @AfterEach
    void tearDown() {
        orderRepository.deleteAll();
        outboxRepository.deleteAll();
        testCatalogService.clear();
    }

    @Test
    void should_accept_both_checkouts_and_let_stock_go_negative() throws Exception {
        UUID tenantId = UUID.randomUUID();
        UUID variantId = testCatalogService.createVariant(tenantId, "Last Jacket", "M", 50000, 1);

        List<Throwable> outcomes = StockConcurrencyIntegrationTest.race(2,
                () -> orderTransactionService.createOrder(StockConcurrencyIntegrationTest.command(tenantId, variantId, 1)));

        assertTrue(outcomes.stream().allMatch(t -> t == null), "unconditional decrement rejects nothing");
        assertEquals(2, orderRepository.count());
        assertEquals(-1, testCatalogService.stockOf(variantId), "oversold by one unit");
    }
}
