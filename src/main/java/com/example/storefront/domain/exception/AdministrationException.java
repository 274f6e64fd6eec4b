package com.example.storefront.domain.exception;

import lombok.Getter;

/**
 * Operator edit refused: bad input, a duplicate, or a missing record.
 */
@Getter
public class AdministrationException extends DomainException {

    public enum Reason {
        INVALID,
        DUPLICATE,
        NOT_FOUND
    }

    private final Reason reason;

    public AdministrationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    @Override
    public String getErrorCode() {
        return "ADMIN_" + reason.name();
    }
}
