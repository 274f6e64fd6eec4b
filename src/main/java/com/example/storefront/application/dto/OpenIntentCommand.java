package com.example.storefront.application.dto;

import com.example.storefront.domain.model.settlement.BasketSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class OpenIntentCommand {
    Long buyerId;
    BigDecimal targetAmount;
    String asset;
    boolean purchase;
    // purchase only
    BasketSnapshot snapshot;
    String discountCode;
}
