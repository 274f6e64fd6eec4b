package com.example.storefront.application.session;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BuyerSessionStoreTest {

    private static final Long BUYER = 7L;

    private BuyerSessionStore store;

    @BeforeEach
    void setUp() {
        store = new BuyerSessionStore(new ConcurrentMapCacheManager());
    }

    @Test
    void loadingDoesNotStoreAnything() {
        BuyerSession session = store.load(BUYER);

        assertEquals(BuyerSessionState.BROWSING, session.getState());
        assertFalse(store.exists(BUYER));
    }

    @Test
    void savedChangesDoNotLeakIntoEarlierCopies() {
        BuyerSession before = store.transition(BUYER, BuyerSessionState.AWAITING_TOP_UP_AMOUNT);

        store.update(BUYER, session -> session.toBuilder()
                .pendingTopUpAmount(new BigDecimal("12.00"))
                .state(BuyerSessionState.BROWSING)
                .build());

        assertEquals(BuyerSessionState.AWAITING_TOP_UP_AMOUNT, before.getState());
        assertNull(before.getPendingTopUpAmount());
        assertEquals(BuyerSessionState.BROWSING, store.load(BUYER).getState());
        assertEquals(new BigDecimal("12.00"), store.load(BUYER).getPendingTopUpAmount());
    }

    @Test
    void clearForgetsTheSession() {
        store.save(BuyerSession.browsing(BUYER).withAppliedDiscountCode("FIVE"));

        store.clear(BUYER);

        assertFalse(store.exists(BUYER));
        assertNull(store.load(BUYER).getAppliedDiscountCode());
    }

    @Test
    void missingCacheReadsAsBrowsing() {
        CacheManager broken = mock(CacheManager.class);
        when(broken.getCache(BuyerSessionStore.CACHE_NAME)).thenReturn(null);
        BuyerSessionStore unavailable = new BuyerSessionStore(broken);

        unavailable.transition(BUYER, BuyerSessionState.AWAITING_BASKET_DISCOUNT_CODE);

        assertEquals(BuyerSessionState.BROWSING, unavailable.load(BUYER).getState());
    }
}
