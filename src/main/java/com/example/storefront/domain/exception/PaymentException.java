package com.example.storefront.domain.exception;

public class PaymentException extends DomainException {

    public PaymentException(String message) {
        super(message);
    }

    public PaymentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getErrorCode() {
        return "PAYMENT_REJECTED";
    }
}
