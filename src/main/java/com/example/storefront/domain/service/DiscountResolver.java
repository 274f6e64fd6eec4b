package com.example.storefront.domain.service;

import com.example.storefront.domain.model.discount.DiscountCode;
import com.example.storefront.domain.model.discount.DiscountRejection;
import com.example.storefront.domain.model.discount.DiscountResolution;
import com.example.storefront.domain.model.discount.DiscountType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Computes the payable basket total under an optional general discount code.
 * Side-effect free: callers look the code up and pass the current time.
 * Reseller pricing is not part of this calculation.
 */
@Component
public class DiscountResolver {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @param originalTotal current basket total, before discount
     * @param requestedCode code the buyer typed, may be blank
     * @param code          stored code matching {@code requestedCode}, or null when none exists
     */
    public DiscountResolution resolve(BigDecimal originalTotal, String requestedCode, DiscountCode code, Instant now) {
        BigDecimal total = money(originalTotal.max(BigDecimal.ZERO));
        if (requestedCode == null || requestedCode.isBlank()) {
            return DiscountResolution.none(total);
        }

        DiscountRejection rejection = validate(code, now);
        if (rejection != null) {
            return DiscountResolution.rejected(requestedCode, rejection, total);
        }

        BigDecimal discount = code.getType() == DiscountType.PERCENTAGE
                ? total.multiply(code.getValue()).divide(HUNDRED, 2, RoundingMode.HALF_UP)
                : money(code.getValue());
        discount = discount.max(BigDecimal.ZERO).min(total);
        BigDecimal finalTotal = money(total.subtract(discount).max(BigDecimal.ZERO));

        return DiscountResolution.applied(code.getCode(), total, money(discount), finalTotal);
    }

    /**
     * Existence, then active flag, then expiry, then usage cap.
     */
    public DiscountRejection validate(DiscountCode code, Instant now) {
        if (code == null) {
            return DiscountRejection.NOT_FOUND;
        }
        if (!code.isActive()) {
            return DiscountRejection.INACTIVE;
        }
        if (code.getExpiryDate() != null && now.isAfter(code.getExpiryDate())) {
            return DiscountRejection.EXPIRED;
        }
        if (code.getMaxUses() != null && code.getUsesCount() >= code.getMaxUses()) {
            return DiscountRejection.USAGE_LIMIT_REACHED;
        }
        return null;
    }

    private static BigDecimal money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
