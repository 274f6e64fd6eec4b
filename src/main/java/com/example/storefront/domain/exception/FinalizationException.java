package com.example.storefront.domain.exception;

public class FinalizationException extends DomainException {

    public FinalizationException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "FINALIZATION_FAILED";
    }
}
