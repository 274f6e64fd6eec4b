package com.example.storefront.domain.model.settlement;

import java.util.Arrays;
import java.util.Locale;

/**
 * payment_status values reported by the processor webhook.
 */
public enum ProcessorPaymentStatus {
    WAITING("waiting"),
    CONFIRMING("confirming"),
    CONFIRMED("confirmed"),
    SENDING("sending"),
    PARTIALLY_PAID("partially_paid"),
    FINISHED("finished"),
    FAILED("failed"),
    REFUNDED("refunded"),
    EXPIRED("expired"),
    UNKNOWN("unknown");

    private final String wireValue;

    ProcessorPaymentStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    public static ProcessorPaymentStatus fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(status -> status.wireValue.equals(normalized))
                .findFirst()
                .orElse(UNKNOWN);
    }

    /**
     * Money has arrived, fully or in part.
     */
    public boolean isPaid() {
        return this == FINISHED || this == CONFIRMED || this == PARTIALLY_PAID;
    }

    /**
     * The intent is dead and will never pay out.
     */
    public boolean isFailed() {
        return this == FAILED || this == EXPIRED || this == REFUNDED;
    }
}
