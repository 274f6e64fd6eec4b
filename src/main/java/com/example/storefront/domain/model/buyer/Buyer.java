package com.example.storefront.domain.model.buyer;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Buyer account keyed by the chat platform user id.
 */
@Entity
@Table(name = "buyers")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Buyer {

    @Id
    private Long id;

    private String username;

    @Builder.Default
    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal balance = BigDecimal.ZERO;

    @Builder.Default
    @Column(name = "total_purchases", nullable = false)
    private int totalPurchases = 0;

    @Column(name = "is_reseller", nullable = false)
    private boolean reseller;

    // productId:epochSeconds list, see BasketCodec
    @Builder.Default
    @Column(length = 4000)
    private String basket = "";

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public List<BasketEntry> basketEntries() {
        return BasketCodec.parse(basket);
    }

    public void replaceBasket(List<BasketEntry> entries) {
        this.basket = BasketCodec.format(entries);
    }

    public BuyerTier tier() {
        return BuyerTier.forPurchases(totalPurchases);
    }

    public void credit(BigDecimal amount) {
        this.balance = balance.add(amount);
    }

    public void debit(BigDecimal amount) {
        if (balance.compareTo(amount) < 0) {
            throw new IllegalStateException("Balance would become negative: buyerId=" + id);
        }
        this.balance = balance.subtract(amount);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
