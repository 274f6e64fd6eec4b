package com.example.storefront.application.dto;

import com.example.storefront.domain.model.discount.DiscountResolution;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Basket as shown to the buyer after lazy expiry.
 */
@Value
@Builder
public class BasketView {
    Long buyerId;
    List<Line> lines;
    int expiredRemoved;
    DiscountResolution pricing;

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    @Value
    @Builder
    public static class Line {
        Long productId;
        String name;
        String city;
        String district;
        String category;
        String variant;
        BigDecimal price;
        long remainingSeconds;
    }
}
