package com.example.storefront.application.service;

import com.example.storefront.IntegrationTestSupport;
import com.example.storefront.application.dto.ReservationCriteria;
import com.example.storefront.domain.model.buyer.BasketEntry;
import com.example.storefront.domain.model.buyer.Buyer;
import com.example.storefront.domain.model.inventory.ProductUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BasketExpiryTest extends IntegrationTestSupport {

    @Autowired
    private ReservationService reservationService;

    @Autowired
    private BasketExpirySweeper basketExpirySweeper;

    private final ReservationCriteria chamomile = ReservationCriteria.builder()
            .city("Lisbon").district("Alfama").category("herbal").variant("1g")
            .price(new BigDecimal("12.00"))
            .build();

    @Test
    @DisplayName("Entry is kept at 899 seconds and released at 900")
    void entryExpiresExactlyAtTtl() {
        createBuyer(30L, BigDecimal.ZERO);
        ProductUnit unit = createUnit("Chamomile", "herbal", "12.00", 1);
        BasketEntry entry = reservationService.reserve(30L, chamomile);

        assertEquals(0, reservationService.expireStaleEntries(30L, entry.getReservedAt().plusSeconds(899)));
        assertEquals(1, reload(unit).getReserved());

        assertEquals(1, reservationService.expireStaleEntries(30L, entry.getReservedAt().plusSeconds(900)));
        assertEquals(0, reload(unit).getReserved());
        assertTrue(buyerRepository.findById(30L).orElseThrow().basketEntries().isEmpty());
    }

    @Test
    void sweeperReleasesOnlyStaleEntries() {
        createBuyer(31L, BigDecimal.ZERO);
        createBuyer(32L, BigDecimal.ZERO);
        createBuyer(33L, BigDecimal.ZERO);
        ProductUnit unit = createUnit("Chamomile", "herbal", "12.00", 3);

        BasketEntry stale = reservationService.reserve(31L, chamomile);
        reservationService.reserve(32L, chamomile);

        // age buyer 31's entry past the TTL
        Buyer staleBuyer = buyerRepository.findById(31L).orElseThrow();
        Instant longAgo = Instant.now().minus(20, ChronoUnit.MINUTES).truncatedTo(ChronoUnit.SECONDS);
        staleBuyer.replaceBasket(List.of(new BasketEntry(stale.getProductId(), longAgo)));
        buyerRepository.save(staleBuyer);

        BasketExpirySweeper.SweepResult result = basketExpirySweeper.sweepExpired(Instant.now());

        assertEquals(2, result.buyersScanned());
        assertEquals(1, result.released());
        assertEquals(0, result.failedBuyers());
        assertEquals(1, reload(unit).getReserved());
        assertTrue(buyerRepository.findById(31L).orElseThrow().basketEntries().isEmpty());
        assertEquals(1, buyerRepository.findById(32L).orElseThrow().basketEntries().size());
    }

    @Test
    void releasedUnitCanBeReservedAgain() {
        createBuyer(34L, BigDecimal.ZERO);
        createBuyer(35L, BigDecimal.ZERO);
        ProductUnit unit = createUnit("Chamomile", "herbal", "12.00", 1);

        BasketEntry entry = reservationService.reserve(34L, chamomile);
        reservationService.expireStaleEntries(34L, entry.getReservedAt().plusSeconds(900));

        BasketEntry second = reservationService.reserve(35L, chamomile);
        assertEquals(unit.getId(), second.getProductId());
        assertEquals(1, reload(unit).getReserved());
    }
}
