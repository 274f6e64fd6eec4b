package com.example.storefront.infrastructure.util;

import java.time.Instant;
import java.util.UUID;

/**
 * Identifier helpers.
 */
public class IdGenerator {

    private IdGenerator() {
    }

    /**
     * Order reference handed to the processor.
     * Format: USER{buyerId}_{PURCHASE|DEPOSIT}_{epochSeconds}_{hex6}
     * e.g. USER42_PURCHASE_1718000000_a1b2c3
     */
    public static String generateOrderReference(Long buyerId, boolean purchase, Instant now) {
        return "USER" + buyerId
                + (purchase ? "_PURCHASE_" : "_DEPOSIT_")
                + now.getEpochSecond()
                + "_" + generateRandomHex(6);
    }

    private static String generateRandomHex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }
}
