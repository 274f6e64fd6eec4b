package com.example.storefront.application.session;

/**
 * What the next free-text message from a buyer means.
 */
public enum BuyerSessionState {
    BROWSING,
    AWAITING_BASKET_DISCOUNT_CODE,
    AWAITING_TOP_UP_AMOUNT
}
