package com.example.storefront.presentation.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResellerDiscountRequest {

    @NotNull(message = "percentage is required")
    @DecimalMin(value = "0", message = "percentage must be between 0 and 100")
    @DecimalMax(value = "100", message = "percentage must be between 0 and 100")
    private BigDecimal percentage;
}
