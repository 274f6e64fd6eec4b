package com.example.storefront.application.event.publisher;

import com.example.storefront.config.CheckoutProperties;
import com.example.storefront.domain.model.outbox.OutboxChannel;
import com.example.storefront.domain.model.outbox.OutboxMessage;
import com.example.storefront.domain.model.outbox.OutboxStatus;
import com.example.storefront.domain.repository.OutboxMessageRepository;
import com.example.storefront.infrastructure.monitoring.CheckoutMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pushes pending outbox rows to the chat delivery topics, oldest first.
 * Buyer messages are keyed by buyer id so a buyer sees them in order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OutboxRelay {

    private final OutboxMessageRepository outboxMessageRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final CheckoutProperties properties;
    private final CheckoutMetrics metrics;
    private final Clock clock;

    // TODO: claim rows with a lease column before running the relay on more than one instance
    public int relayPending() {
        CheckoutProperties.Outbox config = properties.getOutbox();
        List<OutboxMessage> batch = outboxMessageRepository.findByStatusOrderByIdAsc(
                OutboxStatus.PENDING, PageRequest.of(0, config.getBatchSize()));
        if (batch.isEmpty()) {
            return 0;
        }

        int sent = 0;
        for (OutboxMessage message : batch) {
            if (deliver(message, config)) {
                sent++;
            }
        }
        log.info("Outbox relay pass finished: batch={}, sent={}", batch.size(), sent);
        return sent;
    }

    private boolean deliver(OutboxMessage message, CheckoutProperties.Outbox config) {
        String topic = message.getChannel() == OutboxChannel.BUYER
                ? properties.getTopics().getBuyerNotifications()
                : properties.getTopics().getOperatorAlerts();
        String key = message.getBuyerId() != null ? message.getBuyerId().toString() : "operator";

        try {
            kafkaTemplate.send(topic, key, toPayload(message)).get(config.getSendTimeoutSeconds(), TimeUnit.SECONDS);
            message.markSent(clock.instant());
            outboxMessageRepository.save(message);
            metrics.recordOutboxDelivery("sent");
            log.debug("Outbox message delivered: messageId={}, topic={}", message.getId(), topic);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(message, config, "interrupted");
            return false;
        } catch (ExecutionException | TimeoutException | JsonProcessingException | KafkaException e) {
            recordFailure(message, config, e.getMessage());
            return false;
        }
    }

    private void recordFailure(OutboxMessage message, CheckoutProperties.Outbox config, String error) {
        message.markAttemptFailed(error, config.getMaxAttempts());
        outboxMessageRepository.save(message);
        if (message.getStatus() == OutboxStatus.FAILED) {
            metrics.recordOutboxDelivery("failed");
            log.error("Outbox message abandoned: messageId={}, channel={}, attempts={}, error={}",
                    message.getId(), message.getChannel(), message.getAttempts(), error);
        } else {
            metrics.recordOutboxDelivery("retry");
            log.warn("Outbox delivery failed, will retry: messageId={}, attempts={}, error={}",
                    message.getId(), message.getAttempts(), error);
        }
    }

    private String toPayload(OutboxMessage message) throws JsonProcessingException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("messageId", message.getId());
        payload.put("channel", message.getChannel().name());
        payload.put("buyerId", message.getBuyerId());
        payload.put("text", message.getText());
        payload.put("createdAt", message.getCreatedAt().toString());
        return objectMapper.writeValueAsString(payload);
    }
}
