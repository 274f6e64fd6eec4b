package com.example.storefront.application.event.publisher;

import com.example.storefront.domain.model.outbox.OutboxChannel;
import com.example.storefront.domain.model.outbox.OutboxMessage;
import com.example.storefront.domain.repository.OutboxMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Writes outbound messages to the notification outbox. Joins the caller's transaction, so a
 * message exists only if the change it reports was committed; {@link OutboxRelay} delivers it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class NotificationPublisher {

    private final OutboxMessageRepository outboxMessageRepository;
    private final Clock clock;

    @Transactional
    public OutboxMessage notifyBuyer(Long buyerId, String text) {
        OutboxMessage message = outboxMessageRepository.save(OutboxMessage.builder()
                .channel(OutboxChannel.BUYER)
                .buyerId(buyerId)
                .text(text)
                .createdAt(clock.instant())
                .build());
        log.debug("Buyer notification queued: buyerId={}, messageId={}", buyerId, message.getId());
        return message;
    }

    @Transactional
    public OutboxMessage alertOperator(String text) {
        OutboxMessage message = outboxMessageRepository.save(OutboxMessage.builder()
                .channel(OutboxChannel.OPERATOR)
                .text(text)
                .createdAt(clock.instant())
                .build());
        log.info("Operator alert queued: messageId={}", message.getId());
        return message;
    }
}
