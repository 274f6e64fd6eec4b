package com.example.storefront.presentation.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TopUpRequest {

    // optional, falls back to the amount entered in the chat flow
    @Positive(message = "amount must be positive")
    private BigDecimal amount;

    @NotBlank(message = "asset is required")
    private String asset;
}
