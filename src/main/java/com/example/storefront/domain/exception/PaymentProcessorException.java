package com.example.storefront.domain.exception;

import lombok.Getter;

/**
 * Raised by the intent broker and the processor gateway. The message is for logs only,
 * buyers get a generic text.
 */
@Getter
public class PaymentProcessorException extends PaymentException {

    private final ProcessorErrorKind kind;
    private final boolean transientFailure;

    public PaymentProcessorException(ProcessorErrorKind kind, String message) {
        this(kind, message, false, null);
    }

    public PaymentProcessorException(ProcessorErrorKind kind, String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.transientFailure = transientFailure;
    }

    @Override
    public String getErrorCode() {
        return kind.name();
    }
}
