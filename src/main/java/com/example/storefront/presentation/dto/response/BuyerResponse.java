package com.example.storefront.presentation.dto.response;

import com.example.storefront.application.session.BuyerSession;
import com.example.storefront.application.session.BuyerSessionState;
import com.example.storefront.domain.model.buyer.Buyer;
import com.example.storefront.domain.model.buyer.BuyerTier;
import com.example.storefront.presentation.dto.common.BaseResponse;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;

@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class BuyerResponse extends BaseResponse {

    private Long buyerId;
    private String username;
    private BigDecimal balance;
    private Integer totalPurchases;
    private Boolean reseller;
    private BuyerTier tier;
    private BuyerSessionState sessionState;
    private String appliedDiscountCode;

    public static BuyerResponse failed(Long buyerId, String errorCode, String message) {
        return BuyerResponse.builder()
                .status("FAILED")
                .buyerId(buyerId)
                .errorCode(errorCode)
                .message(message)
                .build();
    }

    public static BuyerResponse from(Buyer buyer, BuyerSession session) {
        return BuyerResponse.builder()
                .status("SUCCESS")
                .buyerId(buyer.getId())
                .username(buyer.getUsername())
                .balance(buyer.getBalance())
                .totalPurchases(buyer.getTotalPurchases())
                .reseller(buyer.isReseller())
                .tier(buyer.tier())
                .sessionState(session.getState())
                .appliedDiscountCode(session.getAppliedDiscountCode())
                .build();
    }
}
