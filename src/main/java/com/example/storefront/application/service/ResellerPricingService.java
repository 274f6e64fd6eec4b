package com.example.storefront.application.service;

import com.example.storefront.domain.model.buyer.Buyer;
import com.example.storefront.domain.model.discount.ResellerDiscount;
import com.example.storefront.domain.repository.ResellerDiscountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Per-category reseller percentages. They only change the price written to the purchase
 * record, never the amount the buyer is charged.
 */
@Service
@RequiredArgsConstructor
public class ResellerPricingService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ResellerDiscountRepository resellerDiscountRepository;

    public BigDecimal percentageFor(Buyer buyer, String category) {
        if (!buyer.isReseller()) {
            return BigDecimal.ZERO;
        }
        return resellerDiscountRepository.findByResellerIdAndCategory(buyer.getId(), category)
                .map(ResellerDiscount::getPercentage)
                .orElse(BigDecimal.ZERO);
    }

    public BigDecimal priceFor(Buyer buyer, String category, BigDecimal catalogPrice) {
        BigDecimal price = catalogPrice.setScale(2, RoundingMode.HALF_UP);
        BigDecimal percentage = percentageFor(buyer, category);
        if (percentage.signum() <= 0) {
            return price;
        }
        BigDecimal discount = price.multiply(percentage).divide(HUNDRED, 2, RoundingMode.HALF_UP);
        return price.subtract(discount).max(BigDecimal.ZERO);
    }
}
