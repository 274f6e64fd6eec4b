package com.example.storefront.domain.model.discount;

/**
 * Why a general discount code cannot be used, in validation order.
 */
public enum DiscountRejection {
    NOT_FOUND,
    INACTIVE,
    EXPIRED,
    USAGE_LIMIT_REACHED
}
