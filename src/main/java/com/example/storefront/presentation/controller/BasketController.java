package com.example.storefront.presentation.controller;

import com.example.storefront.application.dto.ReservationCriteria;
import com.example.storefront.application.service.CheckoutService;
import com.example.storefront.application.service.ReservationService;
import com.example.storefront.config.CheckoutProperties;
import com.example.storefront.domain.exception.BasketEmptyException;
import com.example.storefront.domain.exception.BuyerNotFoundException;
import com.example.storefront.domain.exception.DiscountException;
import com.example.storefront.domain.exception.OutOfStockException;
import com.example.storefront.domain.model.buyer.BasketEntry;
import com.example.storefront.domain.model.discount.DiscountResolution;
import com.example.storefront.presentation.dto.request.DiscountCodeRequest;
import com.example.storefront.presentation.dto.request.ReserveUnitRequest;
import com.example.storefront.presentation.dto.response.BasketResponse;
import com.example.storefront.presentation.dto.response.DiscountResponse;
import com.example.storefront.presentation.dto.response.ReservationResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;

/**
 * Basket operations of one buyer.
 */
@RestController
@RequestMapping("/api/buyers/{buyerId}/basket")
@RequiredArgsConstructor
@Slf4j
@Validated
public class BasketController {

    private final ReservationService reservationService;
    private final CheckoutService checkoutService;
    private final CheckoutProperties properties;
    private final Clock clock;

    /**
     * Reserve one unit matching the selection
     * POST /api/buyers/{buyerId}/basket
     */
    @PostMapping
    public ResponseEntity<ReservationResponse> reserve(@PathVariable Long buyerId,
                                                       @Valid @RequestBody ReserveUnitRequest request) {
        log.info("Reservation request: buyerId={}, city={}, district={}, category={}, variant={}, price={}",
                buyerId, request.getCity(), request.getDistrict(), request.getCategory(),
                request.getVariant(), request.getPrice());

        try {
            BasketEntry entry = reservationService.reserve(buyerId, ReservationCriteria.builder()
                    .city(request.getCity())
                    .district(request.getDistrict())
                    .category(request.getCategory())
                    .variant(request.getVariant())
                    .price(request.getPrice())
                    .build());

            return ResponseEntity.ok(ReservationResponse.builder()
                    .status("RESERVED")
                    .buyerId(buyerId)
                    .productId(entry.getProductId())
                    .reservedAt(entry.getReservedAt())
                    .remainingSeconds(entry.remainingSeconds(clock.instant(), properties.getBasket().getTtl()))
                    .build());

        } catch (OutOfStockException e) {
            return ResponseEntity.status(409).body(ReservationResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
        } catch (ConcurrencyFailureException e) {
            log.warn("Reservation lost a lock race: buyerId={}, error={}", buyerId, e.getMessage());
            return ResponseEntity.status(409).body(ReservationResponse.failed(buyerId, "OUT_OF_STOCK",
                    "Item was just taken, please try again"));
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(ReservationResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
        }
    }

    /**
     * View basket, expiring stale entries first
     * GET /api/buyers/{buyerId}/basket
     */
    @GetMapping
    public ResponseEntity<BasketResponse> view(@PathVariable Long buyerId) {
        try {
            return ResponseEntity.ok(BasketResponse.from(checkoutService.viewBasket(buyerId), currency()));
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(failedBasket(e.getErrorCode(), e.getMessage()));
        }
    }

    /**
     * Remove one entry
     * DELETE /api/buyers/{buyerId}/basket/{productId}
     */
    @DeleteMapping("/{productId}")
    public ResponseEntity<BasketResponse> remove(@PathVariable Long buyerId, @PathVariable Long productId) {
        try {
            reservationService.removeFromBasket(buyerId, productId);
            return ResponseEntity.ok(BasketResponse.from(checkoutService.viewBasket(buyerId), currency()));
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(failedBasket(e.getErrorCode(), e.getMessage()));
        }
    }

    /**
     * Cancel the basket
     * DELETE /api/buyers/{buyerId}/basket
     */
    @DeleteMapping
    public ResponseEntity<BasketResponse> clear(@PathVariable Long buyerId) {
        try {
            int released = reservationService.clearBasket(buyerId);
            BasketResponse response = BasketResponse.from(checkoutService.viewBasket(buyerId), currency());
            response.setMessage("Basket cleared, " + released + " item(s) released");
            return ResponseEntity.ok(response);
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(failedBasket(e.getErrorCode(), e.getMessage()));
        }
    }

    /**
     * Apply a general discount code to the current basket
     * POST /api/buyers/{buyerId}/basket/discount
     */
    @PostMapping("/discount")
    public ResponseEntity<DiscountResponse> applyDiscount(@PathVariable Long buyerId,
                                                          @Valid @RequestBody DiscountCodeRequest request) {
        try {
            DiscountResolution resolution = checkoutService.applyDiscount(buyerId, request.getCode());
            return ResponseEntity.ok(DiscountResponse.applied(resolution));
        } catch (DiscountException e) {
            return ResponseEntity.unprocessableEntity().body(DiscountResponse.builder()
                    .status("FAILED")
                    .errorCode(e.getErrorCode())
                    .message(e.getMessage())
                    .code(request.getCode())
                    .build());
        } catch (BasketEmptyException e) {
            return ResponseEntity.status(409).body(DiscountResponse.builder()
                    .status("FAILED").errorCode(e.getErrorCode()).message(e.getMessage()).build());
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(DiscountResponse.builder()
                    .status("FAILED").errorCode(e.getErrorCode()).message(e.getMessage()).build());
        }
    }

    /**
     * Drop the applied discount code
     * DELETE /api/buyers/{buyerId}/basket/discount
     */
    @DeleteMapping("/discount")
    public ResponseEntity<DiscountResponse> removeDiscount(@PathVariable Long buyerId) {
        try {
            String removed = checkoutService.removeDiscount(buyerId);
            return ResponseEntity.ok(DiscountResponse.builder()
                    .status("SUCCESS")
                    .code(removed)
                    .message(removed == null ? "No discount code was applied" : "Discount code removed")
                    .build());
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(DiscountResponse.builder()
                    .status("FAILED").errorCode(e.getErrorCode()).message(e.getMessage()).build());
        }
    }

    private String currency() {
        return properties.getSettlement().getCurrency();
    }

    private static BasketResponse failedBasket(String errorCode, String message) {
        return BasketResponse.builder().status("FAILED").errorCode(errorCode).message(message).build();
    }
}
