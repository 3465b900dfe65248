package com.tradefeed.orderservice.config;

/**
 * How the order transaction decrements variant stock.
 */
public enum StockPolicy {

    /**
     * Decrement only if stock >= quantity; otherwise roll the whole order back
     * with InsufficientStockException. Stock never goes below zero.
     */
    CONDITIONAL,

    /**
     * Decrement unconditionally and rely on the earlier stock check alone.
     * Two racing checkouts can both win and drive stock negative; negative
     * results are logged for reconciliation.
     */
    UNCONDITIONAL
}
