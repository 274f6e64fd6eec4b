package com.example.storefront.domain.repository;

import com.example.storefront.domain.model.buyer.Buyer;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BuyerRepository extends JpaRepository<Buyer, Long> {

    /**
     * Exclusive lock on the buyer row. Every basket mutation, sweep and finalization takes it first.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Buyer b WHERE b.id = :id")
    Optional<Buyer> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT b.id FROM Buyer b WHERE b.basket IS NOT NULL AND b.basket <> ''")
    List<Long> findIdsWithNonEmptyBasket();
}
