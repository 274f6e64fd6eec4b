package com.example.storefront.domain.repository;

import com.example.storefront.domain.model.outbox.OutboxChannel;
import com.example.storefront.domain.model.outbox.OutboxMessage;
import com.example.storefront.domain.model.outbox.OutboxStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OutboxMessageRepository extends JpaRepository<OutboxMessage, Long> {

    List<OutboxMessage> findByStatusOrderByIdAsc(OutboxStatus status, Pageable pageable);

    List<OutboxMessage> findByChannelAndBuyerIdOrderByIdAsc(OutboxChannel channel, Long buyerId);

    List<OutboxMessage> findByChannelOrderByIdAsc(OutboxChannel channel);
}
