package com.example.storefront.domain.model.discount;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Per-reseller, per-category percentage taken off each item's catalog price.
 */
@Entity
@Table(name = "reseller_discounts", uniqueConstraints = {
        @UniqueConstraint(name = "uk_reseller_category", columnNames = {"reseller_id", "category"})
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResellerDiscount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "reseller_id", nullable = false)
    private Long resellerId;

    @Column(nullable = false)
    private String category;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal percentage;
}
