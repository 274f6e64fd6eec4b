package com.example.storefront.presentation.dto.response;

import com.example.storefront.application.dto.BasketView;
import com.example.storefront.domain.model.discount.DiscountResolution;
import com.example.storefront.presentation.dto.common.BaseResponse;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class BasketResponse extends BaseResponse {

    private Long buyerId;
    private List<BasketView.Line> items;
    private Integer expiredRemoved;
    private BigDecimal originalTotal;
    private String discountCode;
    private BigDecimal discountAmount;
    private BigDecimal finalTotal;
    private String currency;

    public static BasketResponse from(BasketView view, String currency) {
        DiscountResolution pricing = view.getPricing();
        return BasketResponse.builder()
                .status("SUCCESS")
                .message(view.isEmpty() ? "Basket is empty" : null)
                .buyerId(view.getBuyerId())
                .items(view.getLines())
                .expiredRemoved(view.getExpiredRemoved())
                .originalTotal(pricing.getOriginalTotal())
                .discountCode(pricing.isApplied() ? pricing.getCode() : null)
                .discountAmount(pricing.getDiscountAmount())
                .finalTotal(pricing.getFinalTotal())
                .currency(currency)
                .build();
    }
}
