package com.example.storefront.application.service;

import com.example.storefront.application.dto.BalanceCheckoutResult;
import com.example.storefront.application.dto.BasketView;
import com.example.storefront.application.dto.FinalizationResult;
import com.example.storefront.application.dto.OpenIntentCommand;
import com.example.storefront.application.dto.PaymentIntent;
import com.example.storefront.application.session.BuyerSession;
import com.example.storefront.application.session.BuyerSessionStore;
import com.example.storefront.application.session.BuyerSessionState;
import com.example.storefront.config.CheckoutProperties;
import com.example.storefront.domain.exception.BasketEmptyException;
import com.example.storefront.domain.exception.DiscountException;
import com.example.storefront.domain.exception.PaymentException;
import com.example.storefront.domain.model.buyer.BasketEntry;
import com.example.storefront.domain.model.buyer.Buyer;
import com.example.storefront.domain.model.discount.DiscountResolution;
import com.example.storefront.domain.model.inventory.ProductUnit;
import com.example.storefront.domain.model.settlement.BasketSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Buyer-facing checkout flows: basket view, discount code, balance payment, crypto payment and top-up.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CheckoutService {

    private final ReservationService reservationService;
    private final BuyerAccountService buyerAccountService;
    private final DiscountCodeService discountCodeService;
    private final PurchaseFinalizer purchaseFinalizer;
    private final PaymentIntentBroker paymentIntentBroker;
    private final BuyerSessionStore sessionStore;
    private final CheckoutProperties properties;
    private final Clock clock;

    /**
     * Expires stale entries first, then prices what is left with the buyer's applied code.
     */
    public BasketView viewBasket(Long buyerId) {
        Instant now = clock.instant();
        int expired = reservationService.expireStaleEntries(buyerId, now);

        List<BasketEntry> entries = buyerAccountService.getBuyer(buyerId).basketEntries();
        Map<Long, ProductUnit> units = reservationService.loadUnits(entries);
        Duration ttl = properties.getBasket().getTtl();

        List<BasketView.Line> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (BasketEntry entry : entries) {
            ProductUnit unit = units.get(entry.getProductId());
            if (unit == null) {
                continue;
            }
            total = total.add(unit.getPrice());
            lines.add(BasketView.Line.builder()
                    .productId(unit.getId())
                    .name(unit.getName())
                    .city(unit.getCity())
                    .district(unit.getDistrict())
                    .category(unit.getCategory())
                    .variant(unit.getVariant())
                    .price(unit.getPrice())
                    .remainingSeconds(entry.remainingSeconds(now, ttl))
                    .build());
        }

        return BasketView.builder()
                .buyerId(buyerId)
                .lines(lines)
                .expiredRemoved(expired)
                .pricing(priceWithSessionCode(buyerId, total))
                .build();
    }

    /**
     * Validates {@code code} against the current basket and remembers it for checkout.
     *
     * @throws DiscountException    when the code cannot be used
     * @throws BasketEmptyException when there is nothing to discount
     */
    public DiscountResolution applyDiscount(Long buyerId, String code) {
        BasketSnapshot snapshot = reservationService.snapshotBasket(buyerId);
        if (snapshot.isEmpty()) {
            throw new BasketEmptyException(buyerId);
        }
        DiscountResolution resolution = discountCodeService.resolve(code, snapshot.catalogTotal());
        if (!resolution.isApplied()) {
            sessionStore.transition(buyerId, BuyerSessionState.BROWSING);
            log.info("Discount code rejected: buyerId={}, code={}, reason={}", buyerId, code, resolution.getRejection());
            throw new DiscountException(code, resolution.getRejection());
        }
        sessionStore.update(buyerId, session -> session.toBuilder()
                .state(BuyerSessionState.BROWSING)
                .appliedDiscountCode(resolution.getCode())
                .build());
        log.info("Discount code applied: buyerId={}, code={}, total={}, finalTotal={}",
                buyerId, resolution.getCode(), resolution.getOriginalTotal(), resolution.getFinalTotal());
        return resolution;
    }

    /**
     * Pays the whole basket from the buyer's balance. Debit and finalization commit together.
     * Returns an incomplete result carrying the shortfall when the balance is too low.
     */
    @Transactional
    public BalanceCheckoutResult payWithBalance(Long buyerId) {
        Buyer buyer = buyerAccountService.lockBuyer(buyerId);
        reservationService.expireStaleEntries(buyerId, clock.instant());

        BasketSnapshot snapshot = reservationService.snapshotBasket(buyerId);
        if (snapshot.isEmpty()) {
            throw new BasketEmptyException(buyerId);
        }
        DiscountResolution pricing = priceWithSessionCode(buyerId, snapshot.catalogTotal());
        BigDecimal charge = pricing.getFinalTotal();

        if (buyer.getBalance().compareTo(charge) < 0) {
            log.info("Balance checkout refused: buyerId={}, balance={}, total={}", buyerId, buyer.getBalance(), charge);
            return BalanceCheckoutResult.insufficient(buyer.getBalance(), charge);
        }

        buyer.debit(charge);
        FinalizationResult finalization = purchaseFinalizer.finalizePurchase(buyerId, snapshot,
                pricing.isApplied() ? pricing.getCode() : null);
        sessionStore.save(BuyerSession.browsing(buyerId));

        log.info("Balance checkout completed: buyerId={}, charged={}, balance={}, units={}",
                buyerId, charge, buyer.getBalance(), finalization.getUnitCount());
        return BalanceCheckoutResult.builder()
                .completed(true)
                .charged(charge)
                .balance(buyer.getBalance())
                .finalization(finalization)
                .build();
    }

    /**
     * Opens a crypto payment for the discounted basket total. The basket stays reserved until the
     * processor reports the outcome or the sweeper expires it.
     */
    public PaymentIntent checkoutWithCrypto(Long buyerId, String asset) {
        reservationService.expireStaleEntries(buyerId, clock.instant());
        BasketSnapshot snapshot = reservationService.snapshotBasket(buyerId);
        if (snapshot.isEmpty()) {
            throw new BasketEmptyException(buyerId);
        }

        DiscountResolution pricing = priceWithSessionCode(buyerId, snapshot.catalogTotal());
        if (pricing.getFinalTotal().signum() <= 0) {
            throw new PaymentException("Basket total is zero, pay with balance instead: buyerId=" + buyerId);
        }

        PaymentIntent intent = paymentIntentBroker.openIntent(OpenIntentCommand.builder()
                .buyerId(buyerId)
                .targetAmount(pricing.getFinalTotal())
                .asset(asset)
                .purchase(true)
                .snapshot(snapshot)
                .discountCode(pricing.isApplied() ? pricing.getCode() : null)
                .build());
        sessionStore.transition(buyerId, BuyerSessionState.BROWSING);
        return intent;
    }

    /**
     * Opens a balance top-up. A null {@code amount} uses the amount entered in the chat flow.
     */
    public PaymentIntent topUp(Long buyerId, BigDecimal amount, String asset) {
        buyerAccountService.getBuyer(buyerId);
        BigDecimal target = amount != null ? amount : sessionStore.load(buyerId).getPendingTopUpAmount();
        BigDecimal minimum = properties.getSettlement().getMinTopUpAmount();
        if (target == null) {
            throw new PaymentException("No top-up amount given: buyerId=" + buyerId);
        }
        if (target.compareTo(minimum) < 0) {
            throw new PaymentException("Top-up below minimum of " + minimum + ": " + target);
        }

        PaymentIntent intent = paymentIntentBroker.openIntent(OpenIntentCommand.builder()
                .buyerId(buyerId)
                .targetAmount(target.setScale(2, RoundingMode.HALF_UP))
                .asset(asset)
                .purchase(false)
                .build());
        sessionStore.update(buyerId, session -> session.toBuilder()
                .pendingTopUpAmount(null)
                .state(BuyerSessionState.BROWSING)
                .build());
        return intent;
    }

    /**
     * Forgets the buyer's applied discount code.
     *
     * @return the code that was removed, or null when none was applied
     */
    public String removeDiscount(Long buyerId) {
        buyerAccountService.getBuyer(buyerId);
        String removed = sessionStore.load(buyerId).getAppliedDiscountCode();
        if (removed == null) {
            return null;
        }
        sessionStore.update(buyerId, session -> session.withAppliedDiscountCode(null));
        log.info("Discount code removed: buyerId={}, code={}", buyerId, removed);
        return removed;
    }

    private DiscountResolution priceWithSessionCode(Long buyerId, BigDecimal total) {
        String code = sessionStore.load(buyerId).getAppliedDiscountCode();
        DiscountResolution resolution = discountCodeService.resolve(code, total);
        if (code != null && !resolution.isApplied()) {
            log.info("Applied discount code no longer valid, dropped: buyerId={}, code={}, reason={}",
                    buyerId, code, resolution.getRejection());
            sessionStore.update(buyerId, session -> session.withAppliedDiscountCode(null));
            return discountCodeService.resolve(null, total);
        }
        return resolution;
    }
}
