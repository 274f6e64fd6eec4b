package com.example.storefront.presentation.controller;

import com.example.storefront.application.service.BuyerAccountService;
import com.example.storefront.application.service.DiscountAdministrationService;
import com.example.storefront.domain.exception.AdministrationException;
import com.example.storefront.domain.exception.BuyerNotFoundException;
import com.example.storefront.domain.exception.DomainException;
import com.example.storefront.domain.model.discount.DiscountCode;
import com.example.storefront.domain.model.settlement.SettlementState;
import com.example.storefront.domain.repository.PendingSettlementRepository;
import com.example.storefront.infrastructure.cache.CatalogCache;
import com.example.storefront.presentation.dto.common.OperationResponse;
import com.example.storefront.presentation.dto.request.CreateDiscountCodeRequest;
import com.example.storefront.presentation.dto.request.ResellerDiscountRequest;
import com.example.storefront.presentation.dto.response.DiscountCodeResponse;
import com.example.storefront.presentation.dto.response.ManualReviewResponse;
import com.example.storefront.presentation.dto.response.ResellerDiscountsResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Operator tools. Expected to sit behind the operator network only.
 */
@RestController
@RequestMapping("/api/operator")
@RequiredArgsConstructor
@Slf4j
@Validated
public class OperatorController {

    private final CatalogCache catalogCache;
    private final PendingSettlementRepository pendingSettlementRepository;
    private final DiscountAdministrationService discountAdministrationService;
    private final BuyerAccountService buyerAccountService;

    @PostMapping("/catalog/invalidate")
    public ResponseEntity<OperationResponse> invalidateCatalog() {
        catalogCache.invalidate();
        log.info("Catalog cache invalidated by operator");
        return ResponseEntity.ok(OperationResponse.success("Catalog cache invalidated"));
    }

    @GetMapping("/settlements/manual-review")
    public ResponseEntity<ManualReviewResponse> manualReview() {
        return ResponseEntity.ok(ManualReviewResponse.from(
                pendingSettlementRepository.findByStateOrderByCreatedAtAsc(SettlementState.MANUAL_REVIEW)));
    }

    // ==================== discount codes ====================

    @GetMapping("/discount-codes")
    public ResponseEntity<DiscountCodeResponse> listCodes() {
        return ResponseEntity.ok(DiscountCodeResponse.of(discountAdministrationService.listCodes()));
    }

    @PostMapping("/discount-codes")
    public ResponseEntity<DiscountCodeResponse> createCode(@Valid @RequestBody CreateDiscountCodeRequest request) {
        try {
            DiscountCode created = discountAdministrationService.createCode(
                    DiscountAdministrationService.NewDiscountCode.builder()
                            .code(request.getCode())
                            .type(request.getType())
                            .value(request.getValue())
                            .maxUses(request.getMaxUses())
                            .expiryDate(request.getExpiryDate())
                            .build());
            return ResponseEntity.status(HttpStatus.CREATED).body(DiscountCodeResponse.of(List.of(created)));
        } catch (AdministrationException e) {
            return ResponseEntity.status(statusOf(e)).body(DiscountCodeResponse.failed(e.getErrorCode(), e.getMessage()));
        }
    }

    @PostMapping("/discount-codes/{code}/toggle")
    public ResponseEntity<DiscountCodeResponse> toggleCode(@PathVariable String code) {
        try {
            return ResponseEntity.ok(DiscountCodeResponse.of(List.of(discountAdministrationService.toggleCode(code))));
        } catch (AdministrationException e) {
            return ResponseEntity.status(statusOf(e)).body(DiscountCodeResponse.failed(e.getErrorCode(), e.getMessage()));
        }
    }

    @DeleteMapping("/discount-codes/{code}")
    public ResponseEntity<OperationResponse> deleteCode(@PathVariable String code) {
        try {
            discountAdministrationService.deleteCode(code);
            return ResponseEntity.ok(OperationResponse.success("Discount code deleted: " + code));
        } catch (AdministrationException e) {
            return ResponseEntity.status(statusOf(e)).body(OperationResponse.failed(e.getErrorCode(), e.getMessage()));
        }
    }

    // ==================== resellers ====================

    @PostMapping("/resellers/{buyerId}/toggle")
    public ResponseEntity<ResellerDiscountsResponse> toggleReseller(@PathVariable Long buyerId) {
        try {
            boolean reseller = buyerAccountService.toggleReseller(buyerId);
            return ResponseEntity.ok(ResellerDiscountsResponse.of(buyerId, reseller,
                    discountAdministrationService.resellerDiscounts(buyerId)));
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(ResellerDiscountsResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
        }
    }

    @GetMapping("/resellers/{buyerId}/discounts")
    public ResponseEntity<ResellerDiscountsResponse> resellerDiscounts(@PathVariable Long buyerId) {
        try {
            boolean reseller = buyerAccountService.getBuyer(buyerId).isReseller();
            return ResponseEntity.ok(ResellerDiscountsResponse.of(buyerId, reseller,
                    discountAdministrationService.resellerDiscounts(buyerId)));
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(ResellerDiscountsResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
        }
    }

    /**
     * Add or edit one category percentage
     * PUT /api/operator/resellers/{buyerId}/discounts/{category}
     */
    @PutMapping("/resellers/{buyerId}/discounts/{category}")
    public ResponseEntity<ResellerDiscountsResponse> setResellerDiscount(@PathVariable Long buyerId,
                                                                         @PathVariable String category,
                                                                         @Valid @RequestBody ResellerDiscountRequest request) {
        try {
            discountAdministrationService.setResellerDiscount(buyerId, category, request.getPercentage());
            return resellerDiscounts(buyerId);
        } catch (DomainException e) {
            return ResponseEntity.status(statusOf(e)).body(ResellerDiscountsResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
        }
    }

    @DeleteMapping("/resellers/{buyerId}/discounts/{category}")
    public ResponseEntity<ResellerDiscountsResponse> deleteResellerDiscount(@PathVariable Long buyerId,
                                                                            @PathVariable String category) {
        try {
            discountAdministrationService.deleteResellerDiscount(buyerId, category);
            return resellerDiscounts(buyerId);
        } catch (DomainException e) {
            return ResponseEntity.status(statusOf(e)).body(ResellerDiscountsResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
        }
    }

    private static HttpStatus statusOf(DomainException e) {
        if (e instanceof BuyerNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof AdministrationException) {
            return switch (((AdministrationException) e).getReason()) {
                case NOT_FOUND -> HttpStatus.NOT_FOUND;
                case DUPLICATE -> HttpStatus.CONFLICT;
                case INVALID -> HttpStatus.BAD_REQUEST;
            };
        }
        log.warn("Operator request failed: errorCode={}, reason={}", e.getErrorCode(), e.getMessage());
        return HttpStatus.UNPROCESSABLE_ENTITY;
    }
}
