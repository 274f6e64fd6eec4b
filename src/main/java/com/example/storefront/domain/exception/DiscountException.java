package com.example.storefront.domain.exception;

import com.example.storefront.domain.model.discount.DiscountRejection;
import lombok.Getter;

@Getter
public class DiscountException extends DomainException {

    private final DiscountRejection rejection;

    public DiscountException(String code, DiscountRejection rejection) {
        super("Discount code rejected: code=" + code + ", reason=" + rejection);
        this.rejection = rejection;
    }

    @Override
    public String getErrorCode() {
        return "DISCOUNT_" + rejection.name();
    }
}
