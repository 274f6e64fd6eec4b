package com.example.storefront.application.service;

import com.example.storefront.domain.repository.BuyerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Releases expired basket entries of every buyer. Each buyer is handled in its own transaction
 * under the buyer lock; one failing buyer does not stop the pass.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BasketExpirySweeper {

    private final BuyerRepository buyerRepository;
    private final ReservationService reservationService;

    public SweepResult sweepExpired(Instant now) {
        List<Long> buyerIds = buyerRepository.findIdsWithNonEmptyBasket();
        int released = 0;
        int failed = 0;

        for (Long buyerId : buyerIds) {
            try {
                released += reservationService.expireStaleEntries(buyerId, now);
            } catch (RuntimeException e) {
                failed++;
                log.error("Basket sweep failed for buyer: buyerId={}", buyerId, e);
            }
        }

        if (released > 0 || failed > 0) {
            log.info("Basket sweep finished: buyers={}, released={}, failed={}", buyerIds.size(), released, failed);
        }
        return new SweepResult(buyerIds.size(), released, failed);
    }

    public record SweepResult(int buyersScanned, int released, int failedBuyers) {
    }
}
