package com.example.storefront.domain.exception;

/**
 * Base type for business rule violations raised by the checkout engine.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }

    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable code returned to API callers.
     */
    public abstract String getErrorCode();
}
