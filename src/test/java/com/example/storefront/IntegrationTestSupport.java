package com.example.storefront;

import com.example.storefront.application.session.BuyerSessionStore;
import com.example.storefront.domain.model.buyer.Buyer;
import com.example.storefront.domain.model.inventory.ProductUnit;
import com.example.storefront.domain.repository.BuyerRepository;
import com.example.storefront.domain.repository.DiscountCodeRepository;
import com.example.storefront.domain.repository.OutboxMessageRepository;
import com.example.storefront.domain.repository.PendingSettlementRepository;
import com.example.storefront.domain.repository.ProductUnitRepository;
import com.example.storefront.domain.repository.PurchaseRecordRepository;
import com.example.storefront.domain.repository.ResellerDiscountRepository;
import com.example.storefront.domain.service.PaymentProcessorGateway;
import com.example.storefront.infrastructure.cache.CatalogCache;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.kafka.core.KafkaTemplate;

import java.math.BigDecimal;

/**
 * Shared Spring context for integration tests: in-memory H2, processor and Kafka mocked.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
public abstract class IntegrationTestSupport {

    @MockBean
    protected PaymentProcessorGateway paymentProcessorGateway;

    @MockBean
    protected KafkaTemplate<String, String> kafkaTemplate;

    @Autowired
    protected BuyerRepository buyerRepository;

    @Autowired
    protected ProductUnitRepository productUnitRepository;

    @Autowired
    protected PurchaseRecordRepository purchaseRecordRepository;

    @Autowired
    protected PendingSettlementRepository pendingSettlementRepository;

    @Autowired
    protected DiscountCodeRepository discountCodeRepository;

    @Autowired
    protected ResellerDiscountRepository resellerDiscountRepository;

    @Autowired
    protected OutboxMessageRepository outboxMessageRepository;

    @Autowired
    protected BuyerSessionStore sessionStore;

    @Autowired
    protected CacheManager cacheManager;

    @Autowired
    protected CatalogCache catalogCache;

    @BeforeEach
    void cleanDatabase() {
        purchaseRecordRepository.deleteAll();
        pendingSettlementRepository.deleteAll();
        outboxMessageRepository.deleteAll();
        resellerDiscountRepository.deleteAll();
        discountCodeRepository.deleteAll();
        productUnitRepository.deleteAll();
        buyerRepository.deleteAll();
        catalogCache.invalidate();
        Cache sessions = cacheManager.getCache(BuyerSessionStore.CACHE_NAME);
        if (sessions != null) {
            sessions.clear();
        }
    }

    protected Buyer createBuyer(Long id, BigDecimal balance) {
        Buyer buyer = Buyer.builder()
                .id(id)
                .username("buyer" + id)
                .balance(balance)
                .build();
        sessionStore.clear(id);
        return buyerRepository.save(buyer);
    }

    protected Buyer createReseller(Long id) {
        Buyer buyer = Buyer.builder()
                .id(id)
                .username("reseller" + id)
                .reseller(true)
                .build();
        sessionStore.clear(id);
        return buyerRepository.save(buyer);
    }

    protected ProductUnit createUnit(String name, String category, String price, int available) {
        return productUnitRepository.save(ProductUnit.builder()
                .name(name)
                .city("Lisbon")
                .district("Alfama")
                .category(category)
                .variant("1g")
                .price(new BigDecimal(price))
                .available(available)
                .reserved(0)
                .pickupDetails("Pickup point for " + name)
                .build());
    }

    protected ProductUnit reload(ProductUnit unit) {
        return productUnitRepository.findById(unit.getId()).orElseThrow();
    }
}
