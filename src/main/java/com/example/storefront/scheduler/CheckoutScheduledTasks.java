package com.example.storefront.scheduler;

import com.example.storefront.application.event.publisher.OutboxRelay;
import com.example.storefront.application.service.BasketExpirySweeper;
import com.example.storefront.config.CheckoutProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@Slf4j
@RequiredArgsConstructor
public class CheckoutScheduledTasks {

    private final BasketExpirySweeper basketExpirySweeper;
    private final OutboxRelay outboxRelay;
    private final CheckoutProperties properties;
    private final Clock clock;

    /**
     * Release expired basket reservations (every minute by default)
     */
    @Scheduled(fixedDelayString = "${checkout.basket.sweep-interval-ms:60000}")
    public void sweepExpiredBaskets() {
        if (!properties.getBasket().isSweepEnabled()) {
            return;
        }
        try {
            basketExpirySweeper.sweepExpired(clock.instant());
        } catch (Exception e) {
            // next run retries
            log.error("[Scheduler] Basket sweep failed", e);
        }
    }

    /**
     * Deliver queued buyer and operator messages (every 5 seconds by default)
     */
    @Scheduled(fixedDelayString = "${checkout.outbox.relay-interval-ms:5000}")
    public void relayOutbox() {
        if (!properties.getOutbox().isRelayEnabled()) {
            return;
        }
        try {
            outboxRelay.relayPending();
        } catch (Exception e) {
            log.error("[Scheduler] Outbox relay failed", e);
        }
    }
}
