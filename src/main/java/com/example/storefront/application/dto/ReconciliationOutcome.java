package com.example.storefront.application.dto;

/**
 * What a settlement notification did. Only {@link #CURRENCY_MISMATCH} is reported back to the
 * processor as a rejection; every other outcome is acknowledged.
 */
public enum ReconciliationOutcome {
    FINALIZED,
    CREDITED,
    ZERO_CREDIT_CLOSED,
    UNDERPAID_RELEASED,
    FAILED_RELEASED,
    MANUAL_REVIEW_RAISED,
    HELD_FOR_REVIEW,
    NOTHING_PAID,
    STATUS_IGNORED,
    UNKNOWN_PAYMENT,
    CHILD_PAYMENT_IGNORED,
    CURRENCY_MISMATCH;

    public boolean isRejected() {
        return this == CURRENCY_MISMATCH;
    }
}
