package com.example.storefront.domain.exception;

/**
 * Malformed or unverifiable settlement notification.
 */
public class SettlementException extends DomainException {

    public SettlementException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "INVALID_NOTIFICATION";
    }
}
