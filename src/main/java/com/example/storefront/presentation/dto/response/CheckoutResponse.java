package com.example.storefront.presentation.dto.response;

import com.example.storefront.application.dto.BalanceCheckoutResult;
import com.example.storefront.application.dto.PaymentIntent;
import com.example.storefront.presentation.dto.common.BaseResponse;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

/**
 * Result of a balance payment, a crypto checkout or a top-up.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class CheckoutResponse extends BaseResponse {

    private Long buyerId;

    // crypto intent
    private String paymentId;
    private String orderReference;
    private String payAddress;
    private BigDecimal payAmount;
    private String asset;
    private BigDecimal targetAmount;
    private String expiresAt;
    private Boolean roundedUpToMinimum;

    // balance payment
    private BigDecimal charged;
    private BigDecimal balance;
    private BigDecimal shortfall;
    private Integer unitCount;

    public static CheckoutResponse pending(Long buyerId, PaymentIntent intent) {
        return CheckoutResponse.builder()
                .status("PENDING")
                .message(intent.isRoundedUpToMinimum() ? "Amount raised to the processor minimum" : null)
                .buyerId(buyerId)
                .paymentId(intent.getPaymentId())
                .orderReference(intent.getOrderReference())
                .payAddress(intent.getPayAddress())
                .payAmount(intent.getPayAmount())
                .asset(intent.getAsset())
                .targetAmount(intent.getTargetAmount())
                .expiresAt(intent.getExpiresAt())
                .roundedUpToMinimum(intent.isRoundedUpToMinimum())
                .build();
    }

    public static CheckoutResponse fromBalance(Long buyerId, BalanceCheckoutResult result) {
        if (!result.isCompleted()) {
            return CheckoutResponse.builder()
                    .status("FAILED")
                    .errorCode("INSUFFICIENT_BALANCE")
                    .message("Balance does not cover the basket total")
                    .buyerId(buyerId)
                    .balance(result.getBalance())
                    .shortfall(result.getShortfall())
                    .build();
        }
        return CheckoutResponse.builder()
                .status("SUCCESS")
                .buyerId(buyerId)
                .charged(result.getCharged())
                .balance(result.getBalance())
                .unitCount(result.getFinalization().getUnitCount())
                .build();
    }

    public static CheckoutResponse failed(Long buyerId, String errorCode, String message) {
        return CheckoutResponse.builder()
                .status("FAILED")
                .buyerId(buyerId)
                .errorCode(errorCode)
                .message(message)
                .build();
    }
}
