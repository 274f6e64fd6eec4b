package com.example.storefront.presentation.dto.response;

import com.example.storefront.domain.model.discount.DiscountCode;
import com.example.storefront.domain.model.discount.DiscountType;
import com.example.storefront.presentation.dto.common.BaseResponse;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Value;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * One or more general discount codes as shown to an operator.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class DiscountCodeResponse extends BaseResponse {

    private List<Entry> codes;

    public static DiscountCodeResponse of(List<DiscountCode> codes) {
        return DiscountCodeResponse.builder()
                .status("SUCCESS")
                .codes(codes.stream().map(Entry::from).toList())
                .build();
    }

    public static DiscountCodeResponse failed(String errorCode, String message) {
        return DiscountCodeResponse.builder().status("FAILED").errorCode(errorCode).message(message).build();
    }

    @Value
    @Builder
    public static class Entry {
        String code;
        DiscountType type;
        BigDecimal value;
        boolean active;
        Integer maxUses;
        int usesCount;
        Instant expiryDate;
        Instant createdAt;

        static Entry from(DiscountCode code) {
            return Entry.builder()
                    .code(code.getCode())
                    .type(code.getType())
                    .value(code.getValue())
                    .active(code.isActive())
                    .maxUses(code.getMaxUses())
                    .usesCount(code.getUsesCount())
                    .expiryDate(code.getExpiryDate())
                    .createdAt(code.getCreatedAt())
                    .build();
        }
    }
}
