package com.example.storefront.domain.repository;

import com.example.storefront.domain.model.discount.ResellerDiscount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ResellerDiscountRepository extends JpaRepository<ResellerDiscount, Long> {

    Optional<ResellerDiscount> findByResellerIdAndCategory(Long resellerId, String category);

    List<ResellerDiscount> findByResellerIdOrderByCategoryAsc(Long resellerId);
}
