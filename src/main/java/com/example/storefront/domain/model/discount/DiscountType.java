package com.example.storefront.domain.model.discount;

public enum DiscountType {
    PERCENTAGE,
    FIXED
}
