package com.example.storefront.domain.exception;

public class BuyerNotFoundException extends DomainException {

    public BuyerNotFoundException(Long buyerId) {
        super("Buyer not found: buyerId=" + buyerId);
    }

    @Override
    public String getErrorCode() {
        return "BUYER_NOT_FOUND";
    }
}
