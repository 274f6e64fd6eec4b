package com.example.storefront.domain.exception;

/**
 * Lost the race for the last matching unit, or nothing matched at all.
 */
public class OutOfStockException extends ReservationException {

    public OutOfStockException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "OUT_OF_STOCK";
    }
}
