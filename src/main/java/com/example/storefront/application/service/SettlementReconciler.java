package com.example.storefront.application.service;

import com.example.storefront.application.dto.FinalizationResult;
import com.example.storefront.application.dto.ReconciliationOutcome;
import com.example.storefront.application.dto.SettlementNotification;
import com.example.storefront.application.event.publisher.NotificationPublisher;
import com.example.storefront.config.CheckoutProperties;
import com.example.storefront.domain.model.settlement.BasketSnapshot;
import com.example.storefront.domain.model.settlement.PendingSettlement;
import com.example.storefront.domain.model.settlement.ProcessorPaymentStatus;
import com.example.storefront.domain.model.settlement.SettlementState;
import com.example.storefront.domain.repository.PendingSettlementRepository;
import com.example.storefront.domain.service.SettlementCalculator;
import com.example.storefront.infrastructure.monitoring.CheckoutMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Applies processor notifications to pending settlements.
 *
 * <p>Each notification is handled in one transaction that locks the pending record first, so duplicate
 * and concurrent deliveries are serialized and the second one finds the record gone. When funds arrived
 * but the purchase or credit cannot be applied, that transaction rolls back and a second one parks the
 * record in {@link SettlementState#MANUAL_REVIEW} and alerts the operator.
 */
@Service
@Slf4j
public class SettlementReconciler {

    private final PendingSettlementRepository pendingSettlementRepository;
    private final PurchaseFinalizer purchaseFinalizer;
    private final ReservationService reservationService;
    private final BuyerAccountService buyerAccountService;
    private final BasketSnapshotCodec basketSnapshotCodec;
    private final NotificationPublisher notificationPublisher;
    private final CheckoutProperties properties;
    private final CheckoutMetrics metrics;
    private final TransactionTemplate transactionTemplate;

    public SettlementReconciler(PendingSettlementRepository pendingSettlementRepository,
                                PurchaseFinalizer purchaseFinalizer,
                                ReservationService reservationService,
                                BuyerAccountService buyerAccountService,
                                BasketSnapshotCodec basketSnapshotCodec,
                                NotificationPublisher notificationPublisher,
                                CheckoutProperties properties,
                                CheckoutMetrics metrics,
                                PlatformTransactionManager transactionManager) {
        this.pendingSettlementRepository = pendingSettlementRepository;
        this.purchaseFinalizer = purchaseFinalizer;
        this.reservationService = reservationService;
        this.buyerAccountService = buyerAccountService;
        this.basketSnapshotCodec = basketSnapshotCodec;
        this.notificationPublisher = notificationPublisher;
        this.properties = properties;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public ReconciliationOutcome reconcile(SettlementNotification notification) {
        ProcessorPaymentStatus status = ProcessorPaymentStatus.fromWire(notification.getStatus());
        log.info("Settlement notification: paymentId={}, status={}, payCurrency={}, actuallyPaid={}",
                notification.getPaymentId(), notification.getStatus(), notification.getPayCurrency(),
                notification.getActuallyPaid());

        ReconciliationOutcome outcome;
        if (status.isPaid()) {
            outcome = reconcilePaid(notification);
        } else if (status.isFailed()) {
            outcome = transactionTemplate.execute(tx -> closeFailed(notification, status));
        } else {
            log.info("Notification status needs no action: paymentId={}, status={}",
                    notification.getPaymentId(), notification.getStatus());
            outcome = ReconciliationOutcome.STATUS_IGNORED;
        }

        metrics.recordSettlement(outcome.name().toLowerCase(Locale.ROOT));
        return outcome;
    }

    private ReconciliationOutcome reconcilePaid(SettlementNotification notification) {
        BigDecimal paid = notification.getActuallyPaid();
        if (paid == null || paid.signum() <= 0) {
            log.warn("Paid status with nothing received, record kept: paymentId={}, actuallyPaid={}",
                    notification.getPaymentId(), paid);
            return ReconciliationOutcome.NOTHING_PAID;
        }

        try {
            return transactionTemplate.execute(tx -> settlePaid(notification));
        } catch (RuntimeException e) {
            log.error("[CRITICAL] Funds received but settlement failed: paymentId={}, actuallyPaid={} {}",
                    notification.getPaymentId(), paid, notification.getPayCurrency(), e);
            return transactionTemplate.execute(tx -> holdForManualReview(notification, e));
        }
    }

    private ReconciliationOutcome settlePaid(SettlementNotification notification) {
        Optional<PendingSettlement> found = pendingSettlementRepository.findByPaymentIdForUpdate(notification.getPaymentId());
        if (found.isEmpty()) {
            return unknownPayment(notification);
        }
        PendingSettlement record = found.get();
        if (record.getState() == SettlementState.MANUAL_REVIEW) {
            log.warn("Notification for a record under manual review ignored: paymentId={}", record.getPaymentId());
            return ReconciliationOutcome.HELD_FOR_REVIEW;
        }

        if (notification.getPayCurrency() == null
                || !record.getSettlementAsset().equalsIgnoreCase(notification.getPayCurrency().trim())) {
            return rejectCurrencyMismatch(record, notification);
        }

        if (record.getExpectedAssetAmount() == null || record.getExpectedAssetAmount().signum() <= 0) {
            log.error("[CRITICAL] Pending record has no expected amount: paymentId={}, buyerId={}",
                    record.getPaymentId(), record.getBuyerId());
            record.holdForManualReview("Expected asset amount is zero");
            notificationPublisher.alertOperator("Payment " + record.getPaymentId() + " of buyer " + record.getBuyerId()
                    + " received " + notification.getActuallyPaid() + " " + notification.getPayCurrency()
                    + " but its expected amount is zero. Held for manual review.");
            return ReconciliationOutcome.MANUAL_REVIEW_RAISED;
        }

        return record.isPurchase()
                ? settlePurchase(record, notification.getActuallyPaid())
                : settleTopUp(record, notification.getActuallyPaid());
    }

    private ReconciliationOutcome settlePurchase(PendingSettlement record, BigDecimal paid) {
        BasketSnapshot snapshot = basketSnapshotCodec.read(record.getBasketSnapshotJson());

        if (paid.compareTo(record.getExpectedAssetAmount()) < 0) {
            reservationService.releaseSnapshot(record.getBuyerId(), snapshot);
            notificationPublisher.notifyBuyer(record.getBuyerId(), "Your payment of " + paid + " "
                    + record.getSettlementAsset().toUpperCase(Locale.ROOT) + " was below the required "
                    + record.getExpectedAssetAmount() + ". The reserved items were released.");
            pendingSettlementRepository.delete(record);
            log.warn("Purchase underpaid, reservations released: paymentId={}, buyerId={}, paid={}, expected={}",
                    record.getPaymentId(), record.getBuyerId(), paid, record.getExpectedAssetAmount());
            return ReconciliationOutcome.UNDERPAID_RELEASED;
        }

        FinalizationResult result = purchaseFinalizer.finalizePurchase(
                record.getBuyerId(), snapshot, record.getDiscountCodeUsed());
        pendingSettlementRepository.delete(record);
        log.info("Purchase settled: paymentId={}, buyerId={}, units={}",
                record.getPaymentId(), record.getBuyerId(), result.getUnitCount());
        return ReconciliationOutcome.FINALIZED;
    }

    private ReconciliationOutcome settleTopUp(PendingSettlement record, BigDecimal paid) {
        BigDecimal credit = SettlementCalculator.proportionalCredit(record.getTargetAmount(), paid,
                record.getExpectedAssetAmount(), properties.getSettlement().getFeeAdjustment());

        if (credit.signum() <= 0) {
            pendingSettlementRepository.delete(record);
            log.warn("Top-up credit rounds to zero, record closed: paymentId={}, buyerId={}, paid={}",
                    record.getPaymentId(), record.getBuyerId(), paid);
            return ReconciliationOutcome.ZERO_CREDIT_CLOSED;
        }

        BigDecimal balance = buyerAccountService.credit(record.getBuyerId(), credit);
        notificationPublisher.notifyBuyer(record.getBuyerId(), "Top-up received: " + credit + " "
                + properties.getSettlement().getCurrency() + " credited. Balance: " + balance + " "
                + properties.getSettlement().getCurrency() + ".");
        pendingSettlementRepository.delete(record);
        log.info("Top-up settled: paymentId={}, buyerId={}, credited={}, balance={}",
                record.getPaymentId(), record.getBuyerId(), credit, balance);
        return ReconciliationOutcome.CREDITED;
    }

    private ReconciliationOutcome rejectCurrencyMismatch(PendingSettlement record, SettlementNotification notification) {
        log.error("Settlement currency mismatch: paymentId={}, expected={}, received={}",
                record.getPaymentId(), record.getSettlementAsset(), notification.getPayCurrency());
        if (record.isPurchase()) {
            reservationService.releaseSnapshot(record.getBuyerId(), basketSnapshotCodec.read(record.getBasketSnapshotJson()));
        }
        notificationPublisher.alertOperator("Payment " + record.getPaymentId() + " of buyer " + record.getBuyerId()
                + " was paid in " + notification.getPayCurrency() + " instead of " + record.getSettlementAsset()
                + " (" + notification.getActuallyPaid() + "). The record was dropped.");
        pendingSettlementRepository.delete(record);
        return ReconciliationOutcome.CURRENCY_MISMATCH;
    }

    private ReconciliationOutcome closeFailed(SettlementNotification notification, ProcessorPaymentStatus status) {
        Optional<PendingSettlement> found = pendingSettlementRepository.findByPaymentIdForUpdate(notification.getPaymentId());
        if (found.isEmpty()) {
            return unknownPayment(notification);
        }
        PendingSettlement record = found.get();
        if (record.getState() == SettlementState.MANUAL_REVIEW) {
            log.warn("Notification for a record under manual review ignored: paymentId={}", record.getPaymentId());
            return ReconciliationOutcome.HELD_FOR_REVIEW;
        }

        if (record.isPurchase()) {
            reservationService.releaseSnapshot(record.getBuyerId(), basketSnapshotCodec.read(record.getBasketSnapshotJson()));
        }
        notificationPublisher.notifyBuyer(record.getBuyerId(), "Payment " + record.getPaymentId() + " is "
                + status.getWireValue() + "."
                + (record.isPurchase() ? " The reserved items were released." : ""));
        pendingSettlementRepository.delete(record);
        log.info("Failed payment closed: paymentId={}, buyerId={}, status={}",
                record.getPaymentId(), record.getBuyerId(), status.getWireValue());
        return ReconciliationOutcome.FAILED_RELEASED;
    }

    private ReconciliationOutcome holdForManualReview(SettlementNotification notification, RuntimeException cause) {
        Optional<PendingSettlement> found = pendingSettlementRepository.findByPaymentIdForUpdate(notification.getPaymentId());
        if (found.isEmpty()) {
            log.error("[CRITICAL] Record vanished before it could be held: paymentId={}", notification.getPaymentId());
            return ReconciliationOutcome.UNKNOWN_PAYMENT;
        }
        PendingSettlement record = found.get();
        record.holdForManualReview(cause.getMessage());
        notificationPublisher.alertOperator("Payment " + record.getPaymentId() + " of buyer " + record.getBuyerId()
                + " received " + notification.getActuallyPaid() + " " + notification.getPayCurrency()
                + " but could not be applied: " + cause.getMessage() + ". Held for manual review.");
        return ReconciliationOutcome.MANUAL_REVIEW_RAISED;
    }

    private ReconciliationOutcome unknownPayment(SettlementNotification notification) {
        if (notification.getParentPaymentId() != null) {
            log.warn("Notification for child payment ignored: paymentId={}, parentPaymentId={}",
                    notification.getPaymentId(), notification.getParentPaymentId());
            return ReconciliationOutcome.CHILD_PAYMENT_IGNORED;
        }
        log.warn("Notification for unknown or settled payment ignored: paymentId={}", notification.getPaymentId());
        return ReconciliationOutcome.UNKNOWN_PAYMENT;
    }
}
