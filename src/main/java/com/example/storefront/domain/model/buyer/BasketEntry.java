package com.example.storefront.domain.model.buyer;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;

/**
 * A reserved unit sitting in a buyer's basket.
 */
@Value
public class BasketEntry {
    Long productId;
    Instant reservedAt;

    public boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(reservedAt.plus(ttl));
    }

    public long remainingSeconds(Instant now, Duration ttl) {
        long remaining = Duration.between(now, reservedAt.plus(ttl)).getSeconds();
        return Math.max(0, remaining);
    }

    /**
     * Removes the entry for {@code productId} from {@code entries}, preferring the one reserved at
     * {@code reservedAt}. Returns false when the buyer no longer holds that product.
     */
    public static boolean removeMatching(List<BasketEntry> entries, Long productId, Instant reservedAt) {
        if (reservedAt != null) {
            for (Iterator<BasketEntry> it = entries.iterator(); it.hasNext(); ) {
                BasketEntry entry = it.next();
                if (entry.getProductId().equals(productId) && entry.getReservedAt().equals(reservedAt)) {
                    it.remove();
                    return true;
                }
            }
        }
        for (Iterator<BasketEntry> it = entries.iterator(); it.hasNext(); ) {
            if (it.next().getProductId().equals(productId)) {
                it.remove();
                return true;
            }
        }
        return false;
    }
}
