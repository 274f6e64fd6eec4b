package com.example.storefront.application.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class BalanceCheckoutResult {
    boolean completed;
    BigDecimal charged;
    BigDecimal balance;
    // set when the balance does not cover the total
    BigDecimal shortfall;
    FinalizationResult finalization;

    public static BalanceCheckoutResult insufficient(BigDecimal balance, BigDecimal total) {
        return BalanceCheckoutResult.builder()
                .completed(false)
                .charged(BigDecimal.ZERO.setScale(2))
                .balance(balance)
                .shortfall(total.subtract(balance))
                .build();
    }
}
