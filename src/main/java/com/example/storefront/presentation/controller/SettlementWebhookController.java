package com.example.storefront.presentation.controller;

import com.example.storefront.application.dto.ReconciliationOutcome;
import com.example.storefront.application.dto.SettlementNotification;
import com.example.storefront.application.service.SettlementReconciler;
import com.example.storefront.infrastructure.security.WebhookSignatureVerifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

/**
 * Processor callback endpoint. The body is read raw so the signature is checked over exactly what was sent.
 *
 * <p>Every verified, well-formed notification is answered 200 whatever its outcome, so the processor
 * stops redelivering. Only a bad signature (401) or a malformed body or currency mismatch (400) is refused.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class SettlementWebhookController {

    private static final List<String> REQUIRED_KEYS = List.of("payment_id", "payment_status", "pay_currency", "actually_paid");

    private final SettlementReconciler settlementReconciler;
    private final WebhookSignatureVerifier signatureVerifier;
    private final ObjectMapper objectMapper;

    @PostMapping("/webhook")
    public ResponseEntity<String> receive(
            @RequestBody(required = false) String body,
            @RequestHeader(value = WebhookSignatureVerifier.SIGNATURE_HEADER, required = false) String signature) {

        if (body == null || body.isBlank()) {
            log.warn("Webhook received with empty body");
            return ResponseEntity.badRequest().body("Invalid Request");
        }

        if (signatureVerifier.isRequired() && !signatureVerifier.verify(body, signature)) {
            log.error("Webhook signature invalid or missing");
            return ResponseEntity.status(401).body("Invalid Signature");
        }

        JsonNode data;
        try {
            data = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Webhook body is not JSON: {}", e.getOriginalMessage());
            return ResponseEntity.badRequest().body("Invalid Request");
        }
        if (data == null || !data.isObject() || !REQUIRED_KEYS.stream().allMatch(data::has)) {
            log.warn("Webhook missing required keys: keys={}", REQUIRED_KEYS);
            return ResponseEntity.badRequest().body("Missing required keys");
        }

        BigDecimal actuallyPaid;
        try {
            actuallyPaid = data.get("actually_paid").isNull() ? null : new BigDecimal(data.get("actually_paid").asText());
        } catch (NumberFormatException e) {
            log.warn("Webhook actually_paid is not a number: value={}", data.get("actually_paid"));
            return ResponseEntity.badRequest().body("Invalid actually_paid");
        }

        SettlementNotification notification = SettlementNotification.builder()
                .paymentId(data.get("payment_id").asText())
                .status(data.get("payment_status").asText())
                .payCurrency(data.get("pay_currency").asText())
                .actuallyPaid(actuallyPaid)
                .parentPaymentId(data.hasNonNull("parent_payment_id") ? data.get("parent_payment_id").asText() : null)
                .build();

        ReconciliationOutcome outcome;
        try {
            outcome = settlementReconciler.reconcile(notification);
        } catch (RuntimeException e) {
            // non-2xx makes the processor redeliver
            log.error("Webhook processing failed: paymentId={}", notification.getPaymentId(), e);
            return ResponseEntity.internalServerError().body("Processing failed");
        }
        if (outcome.isRejected()) {
            return ResponseEntity.badRequest().body("Currency mismatch");
        }
        return ResponseEntity.ok(outcome.name());
    }
}
