package com.example.storefront.presentation.dto.request;

import com.example.storefront.domain.model.discount.DiscountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateDiscountCodeRequest {

    @NotBlank(message = "code is required")
    @Size(max = 50, message = "code is at most 50 characters")
    private String code;

    @NotNull(message = "type is required")
    private DiscountType type;

    @NotNull(message = "value is required")
    @Positive(message = "value must be positive")
    private BigDecimal value;

    // null = unlimited
    @Positive(message = "maxUses must be positive")
    private Integer maxUses;

    // null = never expires
    private Instant expiryDate;
}
