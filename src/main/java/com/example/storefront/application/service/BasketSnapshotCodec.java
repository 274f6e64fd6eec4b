package com.example.storefront.application.service;

import com.example.storefront.domain.exception.SettlementException;
import com.example.storefront.domain.model.settlement.BasketSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * JSON form of {@link BasketSnapshot} as stored on a pending settlement.
 */
@Component
@RequiredArgsConstructor
public class BasketSnapshotCodec {

    private final ObjectMapper objectMapper;

    public String write(BasketSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Basket snapshot could not be serialized", e);
        }
    }

    public BasketSnapshot read(String json) {
        if (json == null || json.isBlank()) {
            return BasketSnapshot.of(List.of());
        }
        BasketSnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(json, BasketSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new SettlementException("Stored basket snapshot is unreadable: " + e.getOriginalMessage());
        }
        if (snapshot.version() != BasketSnapshot.CURRENT_VERSION) {
            throw new SettlementException("Unsupported basket snapshot version: " + snapshot.version());
        }
        return snapshot;
    }
}
