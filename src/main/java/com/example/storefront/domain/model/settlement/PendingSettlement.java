package com.example.storefront.domain.model.settlement;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Links an external payment intent to the buyer action it completes.
 * Deleted on every terminal outcome except a failed finalization, which parks it in MANUAL_REVIEW.
 */
@Entity
@Table(name = "pending_settlements", indexes = {
        @Index(name = "idx_pending_buyer", columnList = "buyer_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingSettlement {

    @Id
    @Column(name = "payment_id")
    private String paymentId;

    @Column(name = "buyer_id", nullable = false)
    private Long buyerId;

    // lowercase processor ticker, e.g. "btc"
    @Column(name = "settlement_asset", nullable = false)
    private String settlementAsset;

    @Column(name = "target_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal targetAmount;

    @Column(name = "expected_asset_amount", nullable = false, precision = 30, scale = 12)
    private BigDecimal expectedAssetAmount;

    @Column(name = "is_purchase", nullable = false)
    private boolean purchase;

    @Column(name = "basket_snapshot", length = 8000)
    private String basketSnapshotJson;

    @Column(name = "discount_code_used")
    private String discountCodeUsed;

    @Column(name = "order_reference", nullable = false)
    private String orderReference;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SettlementState state = SettlementState.OPEN;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public void holdForManualReview(String reason) {
        this.state = SettlementState.MANUAL_REVIEW;
        this.lastError = reason != null && reason.length() > 1000 ? reason.substring(0, 1000) : reason;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
