package com.example.storefront.domain.model.outbox;

public enum OutboxChannel {
    BUYER,
    OPERATOR
}
