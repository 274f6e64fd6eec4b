package com.example.storefront.presentation.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CryptoCheckoutRequest {

    // processor ticker, e.g. BTC
    @NotBlank(message = "asset is required")
    private String asset;
}
