package com.example.storefront.domain.model.discount;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of resolving a general code against a basket total.
 */
@Value
public class DiscountResolution {
    String code;
    DiscountRejection rejection;
    BigDecimal originalTotal;
    BigDecimal discountAmount;
    BigDecimal finalTotal;

    public static DiscountResolution applied(String code, BigDecimal originalTotal, BigDecimal discountAmount, BigDecimal finalTotal) {
        return new DiscountResolution(code, null, originalTotal, discountAmount, finalTotal);
    }

    public static DiscountResolution rejected(String code, DiscountRejection rejection, BigDecimal originalTotal) {
        return new DiscountResolution(code, rejection, originalTotal, BigDecimal.ZERO.setScale(2), originalTotal);
    }

    public static DiscountResolution none(BigDecimal originalTotal) {
        return new DiscountResolution(null, null, originalTotal, BigDecimal.ZERO.setScale(2), originalTotal);
    }

    public boolean isApplied() {
        return code != null && rejection == null;
    }
}
