package com.example.storefront.presentation.dto.response;

import com.example.storefront.domain.model.discount.ResellerDiscount;
import com.example.storefront.presentation.dto.common.BaseResponse;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class ResellerDiscountsResponse extends BaseResponse {

    private Long buyerId;
    private Boolean reseller;
    // category -> percentage, sorted by category
    private Map<String, BigDecimal> percentages;

    public static ResellerDiscountsResponse of(Long buyerId, Boolean reseller, List<ResellerDiscount> discounts) {
        Map<String, BigDecimal> percentages = new LinkedHashMap<>();
        for (ResellerDiscount discount : discounts) {
            percentages.put(discount.getCategory(), discount.getPercentage());
        }
        return ResellerDiscountsResponse.builder()
                .status("SUCCESS")
                .buyerId(buyerId)
                .reseller(reseller)
                .percentages(percentages)
                .build();
    }

    public static ResellerDiscountsResponse failed(Long buyerId, String errorCode, String message) {
        return ResellerDiscountsResponse.builder()
                .status("FAILED")
                .buyerId(buyerId)
                .errorCode(errorCode)
                .message(message)
                .build();
    }
}
