package com.example.storefront.application.service;

import com.example.storefront.domain.exception.BuyerNotFoundException;
import com.example.storefront.domain.model.buyer.Buyer;
import com.example.storefront.domain.model.purchase.PurchaseRecord;
import com.example.storefront.domain.repository.BuyerRepository;
import com.example.storefront.domain.repository.PurchaseRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class BuyerAccountService {

    private final BuyerRepository buyerRepository;
    private final PurchaseRecordRepository purchaseRecordRepository;

    /**
     * Creates the account on first contact. Existing accounts are returned untouched apart from the username.
     */
    @Transactional
    public Buyer register(Long buyerId, String username) {
        return buyerRepository.findById(buyerId)
                .map(existing -> {
                    if (username != null && !username.equals(existing.getUsername())) {
                        existing.setUsername(username);
                    }
                    return existing;
                })
                .orElseGet(() -> {
                    Buyer created = buyerRepository.save(Buyer.builder()
                            .id(buyerId)
                            .username(username)
                            .build());
                    log.info("Buyer registered: buyerId={}", buyerId);
                    return created;
                });
    }

    @Transactional(readOnly = true)
    public Buyer getBuyer(Long buyerId) {
        return buyerRepository.findById(buyerId)
                .orElseThrow(() -> new BuyerNotFoundException(buyerId));
    }

    /**
     * The buyer's ten latest purchases, newest first.
     */
    @Transactional(readOnly = true)
    public List<PurchaseRecord> recentPurchases(Long buyerId) {
        getBuyer(buyerId);
        return purchaseRecordRepository.findTop10ByBuyerIdOrderByPurchasedAtDescIdDesc(buyerId);
    }

    /**
     * Flips the reseller flag and returns the new value.
     */
    @Transactional
    public boolean toggleReseller(Long buyerId) {
        Buyer buyer = buyerRepository.findById(buyerId)
                .orElseThrow(() -> new BuyerNotFoundException(buyerId));
        buyer.setReseller(!buyer.isReseller());
        log.info("Reseller flag changed: buyerId={}, reseller={}", buyerId, buyer.isReseller());
        return buyer.isReseller();
    }

    /**
     * Takes the buyer's exclusive row lock for the rest of the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Buyer lockBuyer(Long buyerId) {
        return buyerRepository.findByIdForUpdate(buyerId)
                .orElseThrow(() -> new BuyerNotFoundException(buyerId));
    }

    @Transactional
    public BigDecimal credit(Long buyerId, BigDecimal amount) {
        Buyer buyer = lockBuyer(buyerId);
        buyer.credit(amount);
        log.info("Balance credited: buyerId={}, amount={}, balance={}", buyerId, amount, buyer.getBalance());
        return buyer.getBalance();
    }
}
