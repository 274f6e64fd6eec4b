package com.example.storefront.application.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.function.UnaryOperator;

/**
 * Buyer sessions kept in the {@value #CACHE_NAME} cache (Redis with a TTL in production).
 * A missing or unreadable entry reads as a fresh browsing session; only callers that have
 * confirmed the buyer exists may save one.
 */
@Component
@Slf4j
public class BuyerSessionStore {

    public static final String CACHE_NAME = "buyer-sessions";

    private final CacheManager cacheManager;

    public BuyerSessionStore(CacheManager cacheManager) {
        this.cacheManager = cacheManager;
    }

    public BuyerSession load(Long buyerId) {
        try {
            BuyerSession cached = cache().get(buyerId.toString(), BuyerSession.class);
            if (cached != null) {
                return cached;
            }
        } catch (RuntimeException e) {
            log.error("Failed to read buyer session: buyerId={}", buyerId, e);
        }
        return BuyerSession.browsing(buyerId);
    }

    public BuyerSession save(BuyerSession session) {
        try {
            cache().put(session.getBuyerId().toString(), session);
            log.debug("Buyer session saved: buyerId={}, state={}", session.getBuyerId(), session.getState());
        } catch (RuntimeException e) {
            log.error("Failed to save buyer session: buyerId={}", session.getBuyerId(), e);
        }
        return session;
    }

    public BuyerSession update(Long buyerId, UnaryOperator<BuyerSession> change) {
        return save(change.apply(load(buyerId)));
    }

    public BuyerSession transition(Long buyerId, BuyerSessionState state) {
        return update(buyerId, session -> session.withState(state));
    }

    public void clear(Long buyerId) {
        try {
            cache().evict(buyerId.toString());
            log.debug("Buyer session cleared: buyerId={}", buyerId);
        } catch (RuntimeException e) {
            log.error("Failed to clear buyer session: buyerId={}", buyerId, e);
        }
    }

    public boolean exists(Long buyerId) {
        try {
            return cache().get(buyerId.toString()) != null;
        } catch (RuntimeException e) {
            log.error("Failed to check buyer session: buyerId={}", buyerId, e);
            return false;
        }
    }

    private Cache cache() {
        Cache cache = cacheManager.getCache(CACHE_NAME);
        if (cache == null) {
            throw new IllegalStateException("Cache not configured: " + CACHE_NAME);
        }
        return cache;
    }
}
