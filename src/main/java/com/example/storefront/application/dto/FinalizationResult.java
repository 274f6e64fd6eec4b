package com.example.storefront.application.dto;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class FinalizationResult {
    Long buyerId;
    List<Long> productIds;
    // sum of recorded prices, after reseller pricing
    BigDecimal recordedTotal;

    public int getUnitCount() {
        return productIds.size();
    }
}
