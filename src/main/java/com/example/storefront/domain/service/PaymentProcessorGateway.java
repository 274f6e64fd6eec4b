package com.example.storefront.domain.service;

import com.example.storefront.application.dto.ProcessorPayment;
import com.example.storefront.application.dto.ProcessorPaymentRequest;

import java.math.BigDecimal;

/**
 * Port to the external crypto payment processor.
 * Implementations throw {@link com.example.storefront.domain.exception.PaymentProcessorException}
 * with the failing step's error kind.
 */
public interface PaymentProcessorGateway {

    /**
     * Asset amount the processor expects for {@code amount} of {@code fiatCurrency}.
     */
    BigDecimal estimate(BigDecimal amount, String fiatCurrency, String asset);

    /**
     * Smallest amount of {@code asset} the processor accepts for one payment.
     */
    BigDecimal minimumAmount(String asset);

    /**
     * Open a payment intent.
     */
    ProcessorPayment createPayment(ProcessorPaymentRequest request);

    /**
     * Processor name, for logs.
     */
    String getGatewayName();
}
