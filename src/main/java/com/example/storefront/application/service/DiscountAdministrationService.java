package com.example.storefront.application.service;

import com.example.storefront.domain.exception.AdministrationException;
import com.example.storefront.domain.exception.AdministrationException.Reason;
import com.example.storefront.domain.exception.BuyerNotFoundException;
import com.example.storefront.domain.model.discount.DiscountCode;
import com.example.storefront.domain.model.discount.DiscountType;
import com.example.storefront.domain.model.discount.ResellerDiscount;
import com.example.storefront.domain.repository.BuyerRepository;
import com.example.storefront.domain.repository.DiscountCodeRepository;
import com.example.storefront.domain.repository.ResellerDiscountRepository;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Operator management of general discount codes and reseller percentages.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DiscountAdministrationService {

    static final int MAX_CODE_LENGTH = 50;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final DiscountCodeRepository discountCodeRepository;
    private final ResellerDiscountRepository resellerDiscountRepository;
    private final BuyerRepository buyerRepository;
    private final Clock clock;

    @Value
    @Builder
    public static class NewDiscountCode {
        String code;
        DiscountType type;
        BigDecimal value;
        Integer maxUses;
        Instant expiryDate;
    }

    /**
     * Creates an active code.
     *
     * @throws AdministrationException INVALID for a malformed definition, DUPLICATE when the code exists
     */
    @Transactional
    public DiscountCode createCode(NewDiscountCode definition) {
        String code = definition.getCode() == null ? "" : definition.getCode().trim();
        if (code.isEmpty() || code.length() > MAX_CODE_LENGTH) {
            throw new AdministrationException(Reason.INVALID,
                    "Code must be 1 to " + MAX_CODE_LENGTH + " characters");
        }
        if (definition.getType() == null) {
            throw new AdministrationException(Reason.INVALID, "Discount type is required");
        }
        BigDecimal value = definition.getValue();
        if (value == null || value.signum() <= 0) {
            throw new AdministrationException(Reason.INVALID, "Discount value must be positive");
        }
        if (definition.getType() == DiscountType.PERCENTAGE && value.compareTo(HUNDRED) > 0) {
            throw new AdministrationException(Reason.INVALID, "Percentage cannot exceed 100");
        }
        if (definition.getMaxUses() != null && definition.getMaxUses() <= 0) {
            throw new AdministrationException(Reason.INVALID, "Usage limit must be positive");
        }
        if (discountCodeRepository.existsByCode(code)) {
            throw new AdministrationException(Reason.DUPLICATE, "Code already exists: " + code);
        }

        DiscountCode created = discountCodeRepository.save(DiscountCode.builder()
                .code(code)
                .type(definition.getType())
                .value(value.setScale(2, RoundingMode.HALF_UP))
                .active(true)
                .maxUses(definition.getMaxUses())
                .expiryDate(definition.getExpiryDate())
                .createdAt(clock.instant())
                .build());
        log.info("Discount code created: code={}, type={}, value={}, maxUses={}, expiry={}",
                code, created.getType(), created.getValue(), created.getMaxUses(), created.getExpiryDate());
        return created;
    }

    @Transactional
    public DiscountCode toggleCode(String code) {
        DiscountCode stored = requireCode(code);
        stored.setActive(!stored.isActive());
        log.info("Discount code toggled: code={}, active={}", stored.getCode(), stored.isActive());
        return stored;
    }

    /**
     * Deleting a code does not touch settlements already priced with it; they keep their recorded total.
     */
    @Transactional
    public void deleteCode(String code) {
        DiscountCode stored = requireCode(code);
        discountCodeRepository.delete(stored);
        log.info("Discount code deleted: code={}", stored.getCode());
    }

    @Transactional(readOnly = true)
    public List<DiscountCode> listCodes() {
        return discountCodeRepository.findAllByOrderByCreatedAtDescIdDesc();
    }

    @Transactional(readOnly = true)
    public List<ResellerDiscount> resellerDiscounts(Long resellerId) {
        requireBuyer(resellerId);
        return resellerDiscountRepository.findByResellerIdOrderByCategoryAsc(resellerId);
    }

    /**
     * Adds or replaces the reseller's percentage for {@code category}.
     *
     * @throws AdministrationException INVALID when the percentage is outside 0 to 100
     */
    @Transactional
    public ResellerDiscount setResellerDiscount(Long resellerId, String category, BigDecimal percentage) {
        requireBuyer(resellerId);
        String trimmed = category == null ? "" : category.trim();
        if (trimmed.isEmpty()) {
            throw new AdministrationException(Reason.INVALID, "Category is required");
        }
        if (percentage == null || percentage.signum() < 0 || percentage.compareTo(HUNDRED) > 0) {
            throw new AdministrationException(Reason.INVALID, "Percentage must be between 0 and 100");
        }

        BigDecimal scaled = percentage.setScale(2, RoundingMode.HALF_UP);
        ResellerDiscount discount = resellerDiscountRepository.findByResellerIdAndCategory(resellerId, trimmed)
                .orElseGet(() -> ResellerDiscount.builder().resellerId(resellerId).category(trimmed).build());
        discount.setPercentage(scaled);
        ResellerDiscount saved = resellerDiscountRepository.save(discount);
        log.info("Reseller discount set: resellerId={}, category={}, percentage={}", resellerId, trimmed, scaled);
        return saved;
    }

    @Transactional
    public void deleteResellerDiscount(Long resellerId, String category) {
        ResellerDiscount discount = resellerDiscountRepository.findByResellerIdAndCategory(resellerId, category)
                .orElseThrow(() -> new AdministrationException(Reason.NOT_FOUND,
                        "No reseller discount: resellerId=" + resellerId + ", category=" + category));
        resellerDiscountRepository.delete(discount);
        log.info("Reseller discount deleted: resellerId={}, category={}", resellerId, category);
    }

    private DiscountCode requireCode(String code) {
        return discountCodeRepository.findByCode(code)
                .orElseThrow(() -> new AdministrationException(Reason.NOT_FOUND, "Discount code not found: " + code));
    }

    private void requireBuyer(Long buyerId) {
        if (!buyerRepository.existsById(buyerId)) {
            throw new BuyerNotFoundException(buyerId);
        }
    }
}
