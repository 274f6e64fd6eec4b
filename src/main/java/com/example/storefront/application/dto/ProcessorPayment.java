package com.example.storefront.application.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Payment intent as accepted by the processor.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ProcessorPayment {
    private String paymentId;
    private String payAddress;
    private BigDecimal payAmount;
    private String payCurrency;
    // raw expiration_estimate_date from the processor
    private String expiresAt;
}
