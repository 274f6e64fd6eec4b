package com.example.storefront.domain.exception;

public class BasketEmptyException extends ReservationException {

    public BasketEmptyException(Long buyerId) {
        super("Basket is empty: buyerId=" + buyerId);
    }

    @Override
    public String getErrorCode() {
        return "BASKET_EMPTY";
    }
}
