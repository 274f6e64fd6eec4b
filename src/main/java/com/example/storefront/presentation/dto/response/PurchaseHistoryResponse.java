package com.example.storefront.presentation.dto.response;

import com.example.storefront.domain.model.purchase.PurchaseRecord;
import com.example.storefront.presentation.dto.common.BaseResponse;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.Value;
import lombok.experimental.SuperBuilder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Latest purchases of a buyer, newest first.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class PurchaseHistoryResponse extends BaseResponse {

    private Long buyerId;
    private String currency;
    private List<Item> purchases;

    public static PurchaseHistoryResponse from(Long buyerId, String currency, List<PurchaseRecord> records) {
        return PurchaseHistoryResponse.builder()
                .status("SUCCESS")
                .buyerId(buyerId)
                .currency(currency)
                .purchases(records.stream().map(Item::from).toList())
                .build();
    }

    public static PurchaseHistoryResponse failed(Long buyerId, String errorCode, String message) {
        return PurchaseHistoryResponse.builder()
                .status("FAILED")
                .buyerId(buyerId)
                .errorCode(errorCode)
                .message(message)
                .build();
    }

    @Value
    @Builder
    public static class Item {
        Long productId;
        String name;
        String category;
        String variant;
        BigDecimal pricePaid;
        String city;
        String district;
        Instant purchasedAt;

        static Item from(PurchaseRecord record) {
            return Item.builder()
                    .productId(record.getProductId())
                    .name(record.getProductName())
                    .category(record.getCategory())
                    .variant(record.getVariant())
                    .pricePaid(record.getPricePaid())
                    .city(record.getCity())
                    .district(record.getDistrict())
                    .purchasedAt(record.getPurchasedAt())
                    .build();
        }
    }
}
