package com.example.storefront.infrastructure.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Checkout metrics exported through the Prometheus registry.
 *
 * <ul>
 *   <li>{@code checkout.reservations{outcome}}: reserved, out_of_stock, released, expired</li>
 *   <li>{@code checkout.settlements{outcome}}: one per reconciliation outcome</li>
 *   <li>{@code checkout.outbox.delivery{outcome}}: sent, retry, failed</li>
 *   <li>{@code checkout.processor.calls{operation,outcome}}: latency of processor calls</li>
 * </ul>
 */
@Service
@Slf4j
public class CheckoutMetrics {

    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

    public CheckoutMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordReservation(String outcome) {
        increment("checkout.reservations", outcome, 1);
    }

    public void recordReservations(String outcome, int amount) {
        increment("checkout.reservations", outcome, amount);
    }

    public void recordSettlement(String outcome) {
        increment("checkout.settlements", outcome, 1);
    }

    public void recordOutboxDelivery(String outcome) {
        increment("checkout.outbox.delivery", outcome, 1);
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordProcessorCall(Timer.Sample sample, String operation, String outcome) {
        Timer timer = timers.computeIfAbsent(operation + ":" + outcome, key ->
                Timer.builder("checkout.processor.calls")
                        .description("Payment processor call latency")
                        .tag("operation", operation)
                        .tag("outcome", outcome)
                        .register(meterRegistry));
        sample.stop(timer);
    }

    private void increment(String name, String outcome, int amount) {
        if (amount <= 0) {
            return;
        }
        Counter counter = counters.computeIfAbsent(name + ":" + outcome, key ->
                Counter.builder(name)
                        .tag("outcome", outcome)
                        .register(meterRegistry));
        counter.increment(amount);
        log.debug("Metric incremented: name={}, outcome={}, amount={}", name, outcome, amount);
    }
}
