package com.example.storefront.domain.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Wallet top-up credit for a settled payment.
 */
public final class SettlementCalculator {

    private SettlementCalculator() {
    }

    /**
     * {@code target * received / expected * feeAdjustment}, rounded down to cents.
     *
     * @throws IllegalArgumentException when {@code expected} is not positive
     */
    public static BigDecimal proportionalCredit(BigDecimal target, BigDecimal received, BigDecimal expected,
                                                BigDecimal feeAdjustment) {
        if (expected == null || expected.signum() <= 0) {
            throw new IllegalArgumentException("Expected asset amount must be positive: " + expected);
        }
        if (received.signum() <= 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return target.multiply(received)
                .multiply(feeAdjustment)
                .divide(expected, 2, RoundingMode.DOWN);
    }
}
