package com.example.storefront.domain.model.inventory;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One inventory row. Purchasable while {@code available > reserved}.
 * The counters are only changed through the guarded updates in
 * {@link com.example.storefront.domain.repository.ProductUnitRepository}.
 */
@Entity
@Table(name = "products", indexes = {
        @Index(name = "idx_products_lookup", columnList = "city, district, category, variant, price")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductUnit {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private String city;

    @Column(nullable = false)
    private String district;

    @Column(nullable = false)
    private String category;

    @Column(nullable = false)
    private String variant;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(nullable = false)
    private int available;

    @Column(nullable = false)
    private int reserved;

    @Column(name = "pickup_details", length = 2000)
    private String pickupDetails;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_updated_at")
    private LocalDateTime lastUpdatedAt;

    public boolean isPurchasable() {
        return available > reserved;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        lastUpdatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        lastUpdatedAt = LocalDateTime.now();
    }
}
