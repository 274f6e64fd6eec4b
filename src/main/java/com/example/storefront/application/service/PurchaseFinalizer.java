package com.example.storefront.application.service;

import com.example.storefront.application.dto.FinalizationResult;
import com.example.storefront.application.event.publisher.NotificationPublisher;
import com.example.storefront.domain.exception.FinalizationException;
import com.example.storefront.domain.model.buyer.BasketEntry;
import com.example.storefront.domain.model.buyer.Buyer;
import com.example.storefront.domain.model.inventory.ProductUnit;
import com.example.storefront.domain.model.purchase.PurchaseRecord;
import com.example.storefront.domain.model.settlement.BasketSnapshot;
import com.example.storefront.domain.repository.DiscountCodeRepository;
import com.example.storefront.domain.repository.ProductUnitRepository;
import com.example.storefront.domain.repository.PurchaseRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a paid basket snapshot into sold units and purchase records in one transaction.
 * Any failure rolls back every item of the snapshot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PurchaseFinalizer {

    private final ProductUnitRepository productUnitRepository;
    private final PurchaseRecordRepository purchaseRecordRepository;
    private final DiscountCodeRepository discountCodeRepository;
    private final BuyerAccountService buyerAccountService;
    private final ResellerPricingService resellerPricingService;
    private final NotificationPublisher notificationPublisher;
    private final Clock clock;

    /**
     * Sells every snapshot item to the buyer. Items still in the basket consume their reservation;
     * items the sweeper already released are sold from free stock if any is left.
     *
     * @throws FinalizationException when a unit no longer exists or cannot be sold
     */
    @Transactional
    public FinalizationResult finalizePurchase(Long buyerId, BasketSnapshot snapshot, String discountCodeUsed) {
        if (snapshot.isEmpty()) {
            throw new FinalizationException("Nothing to finalize: buyerId=" + buyerId);
        }

        Buyer buyer = buyerAccountService.lockBuyer(buyerId);
        List<BasketEntry> basket = buyer.basketEntries();
        Instant now = clock.instant();

        List<Long> productIds = new ArrayList<>();
        BigDecimal recordedTotal = BigDecimal.ZERO;
        StringBuilder delivery = new StringBuilder("Payment received. Your purchase:");

        for (BasketSnapshot.Item item : snapshot.items()) {
            ProductUnit unit = productUnitRepository.findById(item.productId())
                    .orElseThrow(() -> new FinalizationException("Unit no longer exists: productId=" + item.productId()));

            boolean held = BasketEntry.removeMatching(basket, item.productId(), item.reservedAt());
            int sold = held
                    ? productUnitRepository.consumeReservedUnit(unit.getId())
                    : productUnitRepository.consumeFreeUnit(unit.getId());
            if (sold == 0) {
                throw new FinalizationException("Unit cannot be sold: productId=" + unit.getId() + ", held=" + held);
            }
            if (!held) {
                log.warn("Sold a unit whose reservation had expired: buyerId={}, productId={}", buyerId, unit.getId());
            }

            BigDecimal pricePaid = resellerPricingService.priceFor(buyer, unit.getCategory(), unit.getPrice());
            purchaseRecordRepository.save(PurchaseRecord.builder()
                    .buyerId(buyerId)
                    .productId(unit.getId())
                    .productName(unit.getName())
                    .category(unit.getCategory())
                    .variant(unit.getVariant())
                    .pricePaid(pricePaid)
                    .city(unit.getCity())
                    .district(unit.getDistrict())
                    .purchasedAt(now)
                    .build());

            productIds.add(unit.getId());
            recordedTotal = recordedTotal.add(pricePaid);
            delivery.append("\n\n").append(unit.getName())
                    .append(" (").append(unit.getCity()).append(", ").append(unit.getDistrict()).append(")");
            if (unit.getPickupDetails() != null && !unit.getPickupDetails().isBlank()) {
                delivery.append('\n').append(unit.getPickupDetails());
            }
        }

        buyer.replaceBasket(basket);
        buyer.setTotalPurchases(buyer.getTotalPurchases() + productIds.size());

        if (discountCodeUsed != null && !discountCodeUsed.isBlank()) {
            discountCodeRepository.incrementUses(discountCodeUsed);
        }

        notificationPublisher.notifyBuyer(buyerId, delivery.toString());
        log.info("Purchase finalized: buyerId={}, units={}, recordedTotal={}, discountCode={}",
                buyerId, productIds.size(), recordedTotal, discountCodeUsed);
        return new FinalizationResult(buyerId, List.copyOf(productIds), recordedTotal);
    }
}
