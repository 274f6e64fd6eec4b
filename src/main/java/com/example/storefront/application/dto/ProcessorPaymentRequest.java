package com.example.storefront.application.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Payment intent creation request sent to the processor.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ProcessorPaymentRequest {
    private BigDecimal assetAmount;
    private String asset;
    private String orderReference;
    private String orderDescription;
    private String callbackUrl;
}
