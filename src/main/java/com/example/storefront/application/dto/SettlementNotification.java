package com.example.storefront.application.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Verified processor callback, reduced to the fields reconciliation reads.
 */
@Value
@Builder
public class SettlementNotification {
    String paymentId;
    String status;
    String payCurrency;
    BigDecimal actuallyPaid;
    String parentPaymentId;
}
