package com.example.storefront.domain.repository;

import com.example.storefront.domain.model.purchase.PurchaseRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PurchaseRecordRepository extends JpaRepository<PurchaseRecord, Long> {

    List<PurchaseRecord> findByBuyerIdOrderByPurchasedAtDesc(Long buyerId);

    List<PurchaseRecord> findTop10ByBuyerIdOrderByPurchasedAtDescIdDesc(Long buyerId);

    long countByBuyerId(Long buyerId);
}
