package com.example.storefront.domain.model.settlement;

/**
 * Lifecycle of a pending settlement record.
 * OPEN and MANUAL_REVIEW are persisted; the other states are reached inside a
 * single reconciliation transaction that ends with the record deleted (CLOSED).
 */
public enum SettlementState {
    OPEN,
    FINALIZING,
    UNDERPAID,
    FAILED_EXPIRED,
    MANUAL_REVIEW,
    CLOSED;

    public boolean isPersisted() {
        return this == OPEN || this == MANUAL_REVIEW;
    }
}
