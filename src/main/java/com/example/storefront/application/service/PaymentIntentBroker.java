package com.example.storefront.application.service;

import com.example.storefront.application.dto.OpenIntentCommand;
import com.example.storefront.application.dto.PaymentIntent;
import com.example.storefront.application.dto.ProcessorPayment;
import com.example.storefront.application.dto.ProcessorPaymentRequest;
import com.example.storefront.application.event.publisher.NotificationPublisher;
import com.example.storefront.config.CheckoutProperties;
import com.example.storefront.domain.exception.PaymentException;
import com.example.storefront.domain.exception.PaymentProcessorException;
import com.example.storefront.domain.exception.ProcessorErrorKind;
import com.example.storefront.domain.model.settlement.PendingSettlement;
import com.example.storefront.domain.repository.PendingSettlementRepository;
import com.example.storefront.domain.service.PaymentProcessorGateway;
import com.example.storefront.infrastructure.util.IdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Locale;

/**
 * Opens a payment intent with the processor and records what it is for.
 *
 * <p>No database transaction is held while the processor is called. The pending record is written
 * only after the processor accepted the intent with a positive amount.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaymentIntentBroker {

    private final PaymentProcessorGateway paymentProcessorGateway;
    private final PendingSettlementRepository pendingSettlementRepository;
    private final BasketSnapshotCodec basketSnapshotCodec;
    private final NotificationPublisher notificationPublisher;
    private final CheckoutProperties properties;
    private final Clock clock;

    /**
     * @throws PaymentProcessorException for any processor-side failure, with the failing step as kind
     * @throws PaymentException          when the command itself is invalid
     */
    public PaymentIntent openIntent(OpenIntentCommand command) {
        CheckoutProperties.Settlement settlement = properties.getSettlement();
        if (!settlement.isSupported(command.getAsset())) {
            throw new PaymentException("Unsupported settlement asset: " + command.getAsset());
        }
        if (command.getTargetAmount() == null || command.getTargetAmount().signum() <= 0) {
            throw new PaymentException("Target amount must be positive: " + command.getTargetAmount());
        }
        if (command.isPurchase() && (command.getSnapshot() == null || command.getSnapshot().isEmpty())) {
            throw new PaymentException("Purchase intent without basket snapshot: buyerId=" + command.getBuyerId());
        }

        String asset = command.getAsset().trim().toLowerCase(Locale.ROOT);
        String kind = command.isPurchase() ? "purchase" : "top-up";
        log.info("Opening payment intent: buyerId={}, kind={}, target={} {}, asset={}, gateway={}",
                command.getBuyerId(), kind, command.getTargetAmount(), settlement.getCurrency(), asset,
                paymentProcessorGateway.getGatewayName());

        BigDecimal estimated = paymentProcessorGateway.estimate(command.getTargetAmount(), settlement.currencyCode(), asset);
        BigDecimal minimum = paymentProcessorGateway.minimumAmount(asset);

        BigDecimal assetAmount = estimated;
        boolean roundedUp = false;
        if (minimum != null && estimated.compareTo(minimum) < 0) {
            if (command.isPurchase()) {
                log.warn("Purchase below processor minimum: buyerId={}, estimated={}, minimum={}, asset={}",
                        command.getBuyerId(), estimated, minimum, asset);
                throw new PaymentProcessorException(ProcessorErrorKind.AMOUNT_BELOW_MINIMUM,
                        "Estimated " + estimated + " " + asset + " is below minimum " + minimum);
            }
            assetAmount = minimum;
            roundedUp = true;
            log.info("Top-up raised to processor minimum: buyerId={}, estimated={}, minimum={}, asset={}",
                    command.getBuyerId(), estimated, minimum, asset);
        }

        String orderReference = IdGenerator.generateOrderReference(command.getBuyerId(), command.isPurchase(), clock.instant());
        ProcessorPayment payment = paymentProcessorGateway.createPayment(ProcessorPaymentRequest.builder()
                .assetAmount(assetAmount)
                .asset(asset)
                .orderReference(orderReference)
                .orderDescription((command.isPurchase() ? "Purchase " : "Balance top-up ")
                        + command.getTargetAmount() + " " + settlement.getCurrency())
                .callbackUrl(properties.getProcessor().callbackUrl())
                .build());

        if (payment.getPayAmount() == null || payment.getPayAmount().signum() <= 0) {
            log.error("[CRITICAL] Processor quoted a zero amount: buyerId={}, paymentId={}, orderReference={}",
                    command.getBuyerId(), payment.getPaymentId(), orderReference);
            notificationPublisher.alertOperator("Processor quoted a zero pay amount for payment "
                    + payment.getPaymentId() + " (buyer " + command.getBuyerId() + ", " + orderReference
                    + "). No pending record was written.");
            throw new PaymentProcessorException(ProcessorErrorKind.ZERO_QUOTED_AMOUNT,
                    "Zero pay amount for payment " + payment.getPaymentId());
        }

        String recordedAsset = payment.getPayCurrency() != null
                ? payment.getPayCurrency().toLowerCase(Locale.ROOT)
                : asset;
        PendingSettlement record = PendingSettlement.builder()
                .paymentId(payment.getPaymentId())
                .buyerId(command.getBuyerId())
                .settlementAsset(recordedAsset)
                .targetAmount(command.getTargetAmount())
                .expectedAssetAmount(payment.getPayAmount())
                .purchase(command.isPurchase())
                .basketSnapshotJson(command.isPurchase() ? basketSnapshotCodec.write(command.getSnapshot()) : null)
                .discountCodeUsed(command.isPurchase() ? command.getDiscountCode() : null)
                .orderReference(orderReference)
                .build();
        try {
            pendingSettlementRepository.save(record);
        } catch (DataAccessException e) {
            log.error("[CRITICAL] Pending record not written for an open intent: buyerId={}, paymentId={}",
                    command.getBuyerId(), payment.getPaymentId(), e);
            throw new PaymentProcessorException(ProcessorErrorKind.PENDING_RECORD_ERROR,
                    "Could not record payment " + payment.getPaymentId(), false, e);
        }

        log.info("Payment intent opened: buyerId={}, paymentId={}, payAmount={} {}, orderReference={}",
                command.getBuyerId(), payment.getPaymentId(), payment.getPayAmount(), recordedAsset, orderReference);

        return PaymentIntent.builder()
                .paymentId(payment.getPaymentId())
                .orderReference(orderReference)
                .payAddress(payment.getPayAddress())
                .payAmount(payment.getPayAmount())
                .asset(recordedAsset)
                .targetAmount(command.getTargetAmount())
                .expiresAt(payment.getExpiresAt())
                .purchase(command.isPurchase())
                .roundedUpToMinimum(roundedUp)
                .build();
    }
}
