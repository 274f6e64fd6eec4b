package com.example.storefront.domain.model.buyer;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Compact persisted form of a basket: {@code productId:epochSeconds} pairs joined by commas.
 */
@Slf4j
public final class BasketCodec {

    private static final String ENTRY_SEPARATOR = ",";
    private static final String FIELD_SEPARATOR = ":";

    private BasketCodec() {
    }

    public static List<BasketEntry> parse(String persisted) {
        List<BasketEntry> entries = new ArrayList<>();
        if (persisted == null || persisted.isBlank()) {
            return entries;
        }
        for (String token : persisted.split(ENTRY_SEPARATOR)) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] fields = trimmed.split(FIELD_SEPARATOR);
            if (fields.length != 2) {
                log.warn("Skipping malformed basket token: token={}", trimmed);
                continue;
            }
            try {
                entries.add(new BasketEntry(Long.parseLong(fields[0]), Instant.ofEpochSecond(Long.parseLong(fields[1]))));
            } catch (NumberFormatException e) {
                log.warn("Skipping malformed basket token: token={}", trimmed);
            }
        }
        return entries;
    }

    public static String format(List<BasketEntry> entries) {
        return entries.stream()
                .map(entry -> entry.getProductId() + FIELD_SEPARATOR + entry.getReservedAt().getEpochSecond())
                .collect(Collectors.joining(ENTRY_SEPARATOR));
    }
}
