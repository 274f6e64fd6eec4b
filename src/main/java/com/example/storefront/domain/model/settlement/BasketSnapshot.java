package com.example.storefront.domain.model.settlement;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of the reserved items a purchase intent pays for.
 * Stored as JSON on the pending settlement record; {@code version} guards the wire shape.
 */
public record BasketSnapshot(int version, List<Item> items) {

    public static final int CURRENT_VERSION = 1;

    public BasketSnapshot {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static BasketSnapshot of(List<Item> items) {
        return new BasketSnapshot(CURRENT_VERSION, items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Sum of catalog prices, before any discount.
     */
    public BigDecimal catalogTotal() {
        return items.stream()
                .map(Item::catalogPrice)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }

    public record Item(Long productId, String category, BigDecimal catalogPrice, Instant reservedAt) {
    }
}
