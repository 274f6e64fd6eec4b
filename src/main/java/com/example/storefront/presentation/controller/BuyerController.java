package com.example.storefront.presentation.controller;

import com.example.storefront.application.dto.BalanceCheckoutResult;
import com.example.storefront.application.dto.PaymentIntent;
import com.example.storefront.application.service.BuyerAccountService;
import com.example.storefront.application.service.CheckoutService;
import com.example.storefront.application.session.BuyerMessageDispatcher;
import com.example.storefront.application.session.BuyerSessionStore;
import com.example.storefront.config.CheckoutProperties;
import com.example.storefront.domain.exception.BuyerNotFoundException;
import com.example.storefront.domain.exception.DomainException;
import com.example.storefront.domain.exception.FinalizationException;
import com.example.storefront.domain.exception.PaymentException;
import com.example.storefront.domain.exception.PaymentProcessorException;
import com.example.storefront.domain.exception.ProcessorErrorKind;
import com.example.storefront.domain.exception.ReservationException;
import com.example.storefront.domain.model.buyer.Buyer;
import com.example.storefront.presentation.dto.common.OperationResponse;
import com.example.storefront.presentation.dto.request.BuyerMessageRequest;
import com.example.storefront.presentation.dto.request.CryptoCheckoutRequest;
import com.example.storefront.presentation.dto.request.RegisterBuyerRequest;
import com.example.storefront.presentation.dto.request.SessionStateRequest;
import com.example.storefront.presentation.dto.request.TopUpRequest;
import com.example.storefront.presentation.dto.response.BuyerResponse;
import com.example.storefront.presentation.dto.response.CheckoutResponse;
import com.example.storefront.presentation.dto.response.MessageReplyResponse;
import com.example.storefront.presentation.dto.response.PurchaseHistoryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Buyer account, chat session and checkout endpoints called by the chat front end.
 */
@RestController
@RequestMapping("/api/buyers/{buyerId}")
@RequiredArgsConstructor
@Slf4j
@Validated
public class BuyerController {

    private static final String PROCESSOR_FAILURE_MESSAGE = "Payment could not be created, please try again later";

    private final BuyerAccountService buyerAccountService;
    private final CheckoutService checkoutService;
    private final BuyerSessionStore sessionStore;
    private final BuyerMessageDispatcher messageDispatcher;
    private final CheckoutProperties properties;

    /**
     * Register on first contact
     * PUT /api/buyers/{buyerId}
     */
    @PutMapping
    public ResponseEntity<BuyerResponse> register(@PathVariable Long buyerId,
                                                  @Valid @RequestBody(required = false) RegisterBuyerRequest request) {
        Buyer buyer = buyerAccountService.register(buyerId, request != null ? request.getUsername() : null);
        return ResponseEntity.ok(BuyerResponse.from(buyer, sessionStore.load(buyerId)));
    }

    /**
     * Profile: balance, purchase count, tier and session
     * GET /api/buyers/{buyerId}
     */
    @GetMapping
    public ResponseEntity<BuyerResponse> profile(@PathVariable Long buyerId) {
        try {
            Buyer buyer = buyerAccountService.getBuyer(buyerId);
            return ResponseEntity.ok(BuyerResponse.from(buyer, sessionStore.load(buyerId)));
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(BuyerResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
        }
    }

    /**
     * Ten latest purchases, newest first
     * GET /api/buyers/{buyerId}/purchases
     */
    @GetMapping("/purchases")
    public ResponseEntity<PurchaseHistoryResponse> purchases(@PathVariable Long buyerId) {
        try {
            return ResponseEntity.ok(PurchaseHistoryResponse.from(buyerId, properties.getSettlement().getCurrency(),
                    buyerAccountService.recentPurchases(buyerId)));
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(PurchaseHistoryResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
        }
    }

    /**
     * Menu navigation: what the next free-text message means
     * PUT /api/buyers/{buyerId}/session/state
     */
    @PutMapping("/session/state")
    public ResponseEntity<OperationResponse> setSessionState(@PathVariable Long buyerId,
                                                             @Valid @RequestBody SessionStateRequest request) {
        try {
            buyerAccountService.getBuyer(buyerId);
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(OperationResponse.failed(e.getErrorCode(), e.getMessage()));
        }
        sessionStore.transition(buyerId, request.getState());
        log.debug("Session state set: buyerId={}, state={}", buyerId, request.getState());
        return ResponseEntity.ok(OperationResponse.success("Session state is " + request.getState()));
    }

    /**
     * Free-text message
     * POST /api/buyers/{buyerId}/messages
     */
    @PostMapping("/messages")
    public ResponseEntity<MessageReplyResponse> message(@PathVariable Long buyerId,
                                                        @Valid @RequestBody BuyerMessageRequest request) {
        try {
            return ResponseEntity.ok(MessageReplyResponse.from(messageDispatcher.dispatch(buyerId, request.getText())));
        } catch (BuyerNotFoundException e) {
            return ResponseEntity.status(404).body(MessageReplyResponse.builder()
                    .status("FAILED").errorCode(e.getErrorCode()).message(e.getMessage()).build());
        }
    }

    /**
     * Pay the basket from the balance
     * POST /api/buyers/{buyerId}/checkout/balance
     */
    @PostMapping("/checkout/balance")
    public ResponseEntity<CheckoutResponse> payWithBalance(@PathVariable Long buyerId) {
        log.info("Balance checkout request: buyerId={}", buyerId);
        try {
            BalanceCheckoutResult result = checkoutService.payWithBalance(buyerId);
            CheckoutResponse response = CheckoutResponse.fromBalance(buyerId, result);
            return result.isCompleted()
                    ? ResponseEntity.ok(response)
                    : ResponseEntity.status(402).body(response);
        } catch (DomainException e) {
            return failure(buyerId, e);
        }
    }

    /**
     * Open a crypto payment for the basket
     * POST /api/buyers/{buyerId}/checkout/crypto
     */
    @PostMapping("/checkout/crypto")
    public ResponseEntity<CheckoutResponse> payWithCrypto(@PathVariable Long buyerId,
                                                          @Valid @RequestBody CryptoCheckoutRequest request) {
        log.info("Crypto checkout request: buyerId={}, asset={}", buyerId, request.getAsset());
        try {
            PaymentIntent intent = checkoutService.checkoutWithCrypto(buyerId, request.getAsset());
            return ResponseEntity.ok(CheckoutResponse.pending(buyerId, intent));
        } catch (DomainException e) {
            return failure(buyerId, e);
        }
    }

    /**
     * Open a balance top-up
     * POST /api/buyers/{buyerId}/top-ups
     */
    @PostMapping("/top-ups")
    public ResponseEntity<CheckoutResponse> topUp(@PathVariable Long buyerId,
                                                  @Valid @RequestBody TopUpRequest request) {
        log.info("Top-up request: buyerId={}, amount={}, asset={}", buyerId, request.getAmount(), request.getAsset());
        try {
            PaymentIntent intent = checkoutService.topUp(buyerId, request.getAmount(), request.getAsset());
            return ResponseEntity.ok(CheckoutResponse.pending(buyerId, intent));
        } catch (DomainException e) {
            return failure(buyerId, e);
        }
    }

    private ResponseEntity<CheckoutResponse> failure(Long buyerId, DomainException e) {
        if (e instanceof BuyerNotFoundException) {
            return ResponseEntity.status(404).body(CheckoutResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
        }
        if (e instanceof ReservationException || e instanceof FinalizationException) {
            log.warn("Checkout refused: buyerId={}, errorCode={}, reason={}", buyerId, e.getErrorCode(), e.getMessage());
            return ResponseEntity.status(409).body(CheckoutResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
        }
        if (e instanceof PaymentProcessorException) {
            PaymentProcessorException processorFailure = (PaymentProcessorException) e;
            if (processorFailure.getKind() == ProcessorErrorKind.AMOUNT_BELOW_MINIMUM
                    || processorFailure.getKind() == ProcessorErrorKind.AMOUNT_TOO_LOW_API) {
                return ResponseEntity.unprocessableEntity().body(CheckoutResponse.failed(buyerId, e.getErrorCode(),
                        "Amount is below the minimum for this asset, choose another asset or add items"));
            }
            log.error("Payment processor failure: buyerId={}, kind={}, reason={}",
                    buyerId, processorFailure.getKind(), e.getMessage(), e);
            return ResponseEntity.status(502).body(CheckoutResponse.failed(buyerId, e.getErrorCode(), PROCESSOR_FAILURE_MESSAGE));
        }
        if (e instanceof PaymentException) {
            return ResponseEntity.badRequest().body(CheckoutResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
        }
        log.warn("Checkout failed: buyerId={}, errorCode={}, reason={}", buyerId, e.getErrorCode(), e.getMessage());
        return ResponseEntity.unprocessableEntity().body(CheckoutResponse.failed(buyerId, e.getErrorCode(), e.getMessage()));
    }
}
