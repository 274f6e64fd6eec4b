package com.example.storefront.application.service;

import com.example.storefront.application.dto.ReservationCriteria;
import com.example.storefront.config.CheckoutProperties;
import com.example.storefront.domain.exception.OutOfStockException;
import com.example.storefront.domain.model.buyer.BasketEntry;
import com.example.storefront.domain.model.buyer.Buyer;
import com.example.storefront.domain.model.inventory.ProductUnit;
import com.example.storefront.domain.model.settlement.BasketSnapshot;
import com.example.storefront.domain.repository.ProductUnitRepository;
import com.example.storefront.infrastructure.monitoring.CheckoutMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reservation manager. Every method that touches a basket holds the buyer's row lock for
 * the whole transaction, and a basket entry exists exactly when one reserved unit is held for it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReservationService {

    private final ProductUnitRepository productUnitRepository;
    private final BuyerAccountService buyerAccountService;
    private final CheckoutProperties properties;
    private final CheckoutMetrics metrics;
    private final Clock clock;

    /**
     * Reserves the first free unit matching {@code criteria} and appends it to the basket.
     *
     * @throws OutOfStockException when no matching unit is free
     */
    @Transactional
    public BasketEntry reserve(Long buyerId, ReservationCriteria criteria) {
        Buyer buyer = buyerAccountService.lockBuyer(buyerId);

        List<Long> candidates = productUnitRepository.findPurchasableIds(
                criteria.getCity(), criteria.getDistrict(), criteria.getCategory(),
                criteria.getVariant(), criteria.getPrice());

        for (Long productId : candidates) {
            if (productUnitRepository.reserveOne(productId) == 1) {
                BasketEntry entry = new BasketEntry(productId, clock.instant().truncatedTo(ChronoUnit.SECONDS));
                List<BasketEntry> entries = buyer.basketEntries();
                entries.add(entry);
                buyer.replaceBasket(entries);

                metrics.recordReservation("reserved");
                log.info("Unit reserved: buyerId={}, productId={}, basketSize={}", buyerId, productId, entries.size());
                return entry;
            }
            log.debug("Unit taken by a concurrent buyer: productId={}", productId);
        }

        metrics.recordReservation("out_of_stock");
        log.warn("Reservation failed, no free unit: buyerId={}, city={}, district={}, category={}, variant={}",
                buyerId, criteria.getCity(), criteria.getDistrict(), criteria.getCategory(), criteria.getVariant());
        throw new OutOfStockException("No free unit matches the selection");
    }

    /**
     * Drops one entry for {@code productId} and releases its unit. Returns false when the basket did not hold it.
     */
    @Transactional
    public boolean removeFromBasket(Long buyerId, Long productId) {
        Buyer buyer = buyerAccountService.lockBuyer(buyerId);
        List<BasketEntry> entries = buyer.basketEntries();
        if (!BasketEntry.removeMatching(entries, productId, null)) {
            log.debug("Remove ignored, product not in basket: buyerId={}, productId={}", buyerId, productId);
            return false;
        }
        release(productId);
        buyer.replaceBasket(entries);
        metrics.recordReservation("released");
        log.info("Basket entry removed: buyerId={}, productId={}", buyerId, productId);
        return true;
    }

    @Transactional
    public int clearBasket(Long buyerId) {
        Buyer buyer = buyerAccountService.lockBuyer(buyerId);
        List<BasketEntry> entries = buyer.basketEntries();
        entries.forEach(entry -> release(entry.getProductId()));
        buyer.replaceBasket(List.of());
        metrics.recordReservations("released", entries.size());
        log.info("Basket cleared: buyerId={}, released={}", buyerId, entries.size());
        return entries.size();
    }

    /**
     * Releases every entry whose TTL has passed at {@code now}. Returns the number released.
     */
    @Transactional
    public int expireStaleEntries(Long buyerId, Instant now) {
        Buyer buyer = buyerAccountService.lockBuyer(buyerId);
        Duration ttl = properties.getBasket().getTtl();

        List<BasketEntry> kept = new ArrayList<>();
        int expired = 0;
        for (BasketEntry entry : buyer.basketEntries()) {
            if (entry.isExpired(now, ttl)) {
                release(entry.getProductId());
                expired++;
            } else {
                kept.add(entry);
            }
        }

        if (expired > 0) {
            buyer.replaceBasket(kept);
            metrics.recordReservations("expired", expired);
            log.info("Expired basket entries released: buyerId={}, expired={}, remaining={}", buyerId, expired, kept.size());
        }
        return expired;
    }

    /**
     * Releases the snapshot items the buyer still holds. Items already swept out of the basket are skipped,
     * their unit was released at that point.
     */
    @Transactional
    public int releaseSnapshot(Long buyerId, BasketSnapshot snapshot) {
        Buyer buyer = buyerAccountService.lockBuyer(buyerId);
        List<BasketEntry> entries = buyer.basketEntries();

        int released = 0;
        for (BasketSnapshot.Item item : snapshot.items()) {
            if (BasketEntry.removeMatching(entries, item.productId(), item.reservedAt())) {
                release(item.productId());
                released++;
            } else {
                log.debug("Snapshot item no longer held: buyerId={}, productId={}", buyerId, item.productId());
            }
        }

        buyer.replaceBasket(entries);
        metrics.recordReservations("released", released);
        log.info("Snapshot reservations released: buyerId={}, released={}, items={}",
                buyerId, released, snapshot.items().size());
        return released;
    }

    /**
     * Current basket as a snapshot, without locking. Entries whose unit row is gone are left out.
     */
    @Transactional(readOnly = true)
    public BasketSnapshot snapshotBasket(Long buyerId) {
        List<BasketEntry> entries = buyerAccountService.getBuyer(buyerId).basketEntries();
        Map<Long, ProductUnit> units = loadUnits(entries);

        List<BasketSnapshot.Item> items = new ArrayList<>();
        for (BasketEntry entry : entries) {
            ProductUnit unit = units.get(entry.getProductId());
            if (unit == null) {
                log.warn("Basket references a missing unit: buyerId={}, productId={}", buyerId, entry.getProductId());
                continue;
            }
            items.add(new BasketSnapshot.Item(unit.getId(), unit.getCategory(), unit.getPrice(), entry.getReservedAt()));
        }
        return BasketSnapshot.of(items);
    }

    @Transactional(readOnly = true)
    public Map<Long, ProductUnit> loadUnits(List<BasketEntry> entries) {
        List<Long> ids = entries.stream().map(BasketEntry::getProductId).distinct().toList();
        return productUnitRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(ProductUnit::getId, Function.identity()));
    }

    private void release(Long productId) {
        if (productUnitRepository.releaseOne(productId) == 0) {
            log.warn("Release found no reservation on unit: productId={}", productId);
        }
    }
}
