package com.example.storefront.domain.model.outbox;

public enum OutboxStatus {
    PENDING,
    SENT,
    FAILED
}
