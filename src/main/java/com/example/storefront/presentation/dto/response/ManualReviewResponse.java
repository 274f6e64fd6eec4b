package com.example.storefront.presentation.dto.response;

import com.example.storefront.domain.model.settlement.PendingSettlement;
import com.example.storefront.presentation.dto.common.BaseResponse;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Value;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Settlements parked for an operator.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class ManualReviewResponse extends BaseResponse {

    private List<Entry> settlements;

    public static ManualReviewResponse from(List<PendingSettlement> records) {
        return ManualReviewResponse.builder()
                .status("SUCCESS")
                .settlements(records.stream().map(Entry::from).toList())
                .build();
    }

    @Value
    @Builder
    public static class Entry {
        String paymentId;
        Long buyerId;
        String asset;
        BigDecimal targetAmount;
        BigDecimal expectedAssetAmount;
        boolean purchase;
        String orderReference;
        String lastError;
        LocalDateTime updatedAt;

        static Entry from(PendingSettlement record) {
            return Entry.builder()
                    .paymentId(record.getPaymentId())
                    .buyerId(record.getBuyerId())
                    .asset(record.getSettlementAsset())
                    .targetAmount(record.getTargetAmount())
                    .expectedAssetAmount(record.getExpectedAssetAmount())
                    .purchase(record.isPurchase())
                    .orderReference(record.getOrderReference())
                    .lastError(record.getLastError())
                    .updatedAt(record.getUpdatedAt())
                    .build();
        }
    }
}
