package com.example.storefront.application.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Deposit instructions returned to the buyer once a pending settlement record exists.
 */
@Value
@Builder
public class PaymentIntent {
    String paymentId;
    String orderReference;
    String payAddress;
    BigDecimal payAmount;
    String asset;
    BigDecimal targetAmount;
    String expiresAt;
    boolean purchase;
    boolean roundedUpToMinimum;
}
