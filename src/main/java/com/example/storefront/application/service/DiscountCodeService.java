package com.example.storefront.application.service;

import com.example.storefront.domain.model.discount.DiscountCode;
import com.example.storefront.domain.model.discount.DiscountResolution;
import com.example.storefront.domain.repository.DiscountCodeRepository;
import com.example.storefront.domain.service.DiscountResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;

@Service
@RequiredArgsConstructor
public class DiscountCodeService {

    private final DiscountCodeRepository discountCodeRepository;
    private final DiscountResolver discountResolver;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DiscountResolution resolve(String requestedCode, BigDecimal total) {
        String code = requestedCode == null ? null : requestedCode.trim();
        DiscountCode stored = code == null || code.isEmpty()
                ? null
                : discountCodeRepository.findByCode(code).orElse(null);
        return discountResolver.resolve(total, code, stored, clock.instant());
    }
}
