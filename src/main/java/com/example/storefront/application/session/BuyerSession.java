package com.example.storefront.application.session;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;

/**
 * Conversation state of one buyer. Immutable; every change is saved as a new value through
 * {@link BuyerSessionStore}.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class BuyerSession {
    Long buyerId;
    @Builder.Default
    BuyerSessionState state = BuyerSessionState.BROWSING;
    String appliedDiscountCode;
    BigDecimal pendingTopUpAmount;

    public static BuyerSession browsing(Long buyerId) {
        return BuyerSession.builder().buyerId(buyerId).build();
    }
}
