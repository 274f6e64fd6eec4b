package com.example.storefront.domain.repository;

import com.example.storefront.domain.model.inventory.ProductUnit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

/**
 * Inventory store. Every counter change is a single guarded UPDATE so the row lock
 * taken by the database serializes concurrent buyers and the guard keeps
 * {@code 0 <= reserved <= available}.
 */
@Repository
public interface ProductUnitRepository extends JpaRepository<ProductUnit, Long> {

    /**
     * Candidate units for a reservation, lowest id first.
     */
    @Query("SELECT p.id FROM ProductUnit p WHERE p.city = :city AND p.district = :district " +
            "AND p.category = :category AND p.variant = :variant AND p.price = :price " +
            "AND p.available > p.reserved ORDER BY p.id")
    List<Long> findPurchasableIds(@Param("city") String city,
                                  @Param("district") String district,
                                  @Param("category") String category,
                                  @Param("variant") String variant,
                                  @Param("price") BigDecimal price);

    /**
     * Reserve one unit if one is still free.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE ProductUnit p SET p.reserved = p.reserved + 1 WHERE p.id = :id AND p.available > p.reserved")
    int reserveOne(@Param("id") Long id);

    /**
     * Release one reservation, floored at zero.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE ProductUnit p SET p.reserved = p.reserved - 1 WHERE p.id = :id AND p.reserved > 0")
    int releaseOne(@Param("id") Long id);

    /**
     * Turn one reservation into a sale.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE ProductUnit p SET p.available = p.available - 1, p.reserved = p.reserved - 1 " +
            "WHERE p.id = :id AND p.reserved > 0 AND p.available > 0")
    int consumeReservedUnit(@Param("id") Long id);

    /**
     * Sell a unit nobody holds. Used when the buyer's reservation was already swept.
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE ProductUnit p SET p.available = p.available - 1 WHERE p.id = :id AND p.available > p.reserved")
    int consumeFreeUnit(@Param("id") Long id);

    @Query("SELECT DISTINCT p.city AS city, p.district AS district FROM ProductUnit p")
    List<LocationView> findDistinctLocations();

    @Query("SELECT DISTINCT p.category FROM ProductUnit p")
    List<String> findDistinctCategories();

    interface LocationView {
        String getCity();

        String getDistrict();
    }
}
