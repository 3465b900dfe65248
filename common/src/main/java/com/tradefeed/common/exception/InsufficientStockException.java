package com.tradefeed.common.exception;

import com.tradefeed.common.dto.StockShortfall;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when one or more cart lines ask for more stock than is
 * available. Carries every shortfall, not only the first one.
 * HTTP Status: 422 Unprocessable Entity
 */
public class InsufficientStockException extends RuntimeException {

    private final List<StockShortfall> shortfalls;

    public InsufficientStockException(List<StockShortfall> shortfalls) {
        super(describe(shortfalls));
        this.shortfalls = List.copyOf(shortfalls);
    }

    public List<StockShortfall> getShortfalls() {
        return shortfalls;
    }

    private static String describe(List<StockShortfall> shortfalls) {
        return "Some items are out of stock: " + shortfalls.stream()
                .map(s -> String.format("%s: only %d left (you requested %d)",
                        s.getProductName(), s.getAvailable(), s.getRequested()))
                .collect(Collectors.joining("; "));
    }
}
