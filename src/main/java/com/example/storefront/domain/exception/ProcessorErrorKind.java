package com.example.storefront.domain.exception;

/**
 * Failure points of opening a payment intent with the external processor.
 */
public enum ProcessorErrorKind {
    API_MISCONFIGURED,
    ESTIMATE_FAILED,
    ESTIMATE_CURRENCY_NOT_FOUND,
    MIN_AMOUNT_FETCH_ERROR,
    AMOUNT_BELOW_MINIMUM,
    AMOUNT_TOO_LOW_API,
    API_KEY_INVALID,
    API_TIMEOUT,
    API_REQUEST_FAILED,
    INVALID_API_RESPONSE,
    ZERO_QUOTED_AMOUNT,
    PENDING_RECORD_ERROR
}
