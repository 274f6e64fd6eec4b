package com.example.storefront.domain.repository;

import com.example.storefront.domain.model.discount.DiscountCode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DiscountCodeRepository extends JpaRepository<DiscountCode, Long> {

    Optional<DiscountCode> findByCode(String code);

    boolean existsByCode(String code);

    List<DiscountCode> findAllByOrderByCreatedAtDescIdDesc();

    @Modifying(flushAutomatically = true)
    @Query("UPDATE DiscountCode d SET d.usesCount = d.usesCount + 1 WHERE d.code = :code")
    int incrementUses(@Param("code") String code);
}
