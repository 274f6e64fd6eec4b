package com.example.storefront.presentation.dto.response;

import com.example.storefront.domain.model.discount.DiscountResolution;
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
public class DiscountResponse extends BaseResponse {

    private String code;
    private BigDecimal originalTotal;
    private BigDecimal discountAmount;
    private BigDecimal finalTotal;

    public static DiscountResponse applied(DiscountResolution resolution) {
        return DiscountResponse.builder()
                .status("SUCCESS")
                .code(resolution.getCode())
                .originalTotal(resolution.getOriginalTotal())
                .discountAmount(resolution.getDiscountAmount())
                .finalTotal(resolution.getFinalTotal())
                .build();
    }
}
