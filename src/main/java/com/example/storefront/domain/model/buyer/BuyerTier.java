package com.example.storefront.domain.model.buyer;

/**
 * Loyalty label derived from the number of units bought.
 */
public enum BuyerTier {
    NEW,
    REGULAR,
    VIP;

    public static BuyerTier forPurchases(int totalPurchases) {
        if (totalPurchases >= 10) {
            return VIP;
        }
        if (totalPurchases >= 5) {
            return REGULAR;
        }
        return NEW;
    }
}
