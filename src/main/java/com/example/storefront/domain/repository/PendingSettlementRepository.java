package com.example.storefront.domain.repository;

import com.example.storefront.domain.model.settlement.PendingSettlement;
import com.example.storefront.domain.model.settlement.SettlementState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PendingSettlementRepository extends JpaRepository<PendingSettlement, String> {

    /**
     * Serializes concurrent deliveries of the same notification.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM PendingSettlement s WHERE s.paymentId = :paymentId")
    Optional<PendingSettlement> findByPaymentIdForUpdate(@Param("paymentId") String paymentId);

    List<PendingSettlement> findByStateOrderByCreatedAtAsc(SettlementState state);

    List<PendingSettlement> findByBuyerId(Long buyerId);
}
