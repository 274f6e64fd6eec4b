package com.example.storefront.application.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Catalog attributes a buyer picks before reserving a unit.
 */
@Value
@Builder
public class ReservationCriteria {
    String city;
    String district;
    String category;
    String variant;
    BigDecimal price;
}
