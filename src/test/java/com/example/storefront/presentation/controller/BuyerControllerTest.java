package com.example.storefront.presentation.controller;

import com.example.storefront.IntegrationTestSupport;
import com.example.storefront.application.session.BuyerSessionState;
import com.example.storefront.domain.model.buyer.Buyer;
import com.example.storefront.domain.model.buyer.BuyerTier;
import com.example.storefront.domain.model.discount.DiscountCode;
import com.example.storefront.domain.model.discount.DiscountType;
import com.example.storefront.domain.model.purchase.PurchaseRecord;
import com.example.storefront.presentation.dto.request.BuyerMessageRequest;
import com.example.storefront.presentation.dto.request.DiscountCodeRequest;
import com.example.storefront.presentation.dto.request.ReserveUnitRequest;
import com.example.storefront.presentation.dto.request.SessionStateRequest;
import com.example.storefront.presentation.dto.response.BuyerResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BuyerControllerTest extends IntegrationTestSupport {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void profileShowsBalancePurchasesAndTier() {
        Buyer buyer = createBuyer(90L, new BigDecimal("42.50"));
        buyer.setTotalPurchases(5);
        buyerRepository.save(buyer);

        ResponseEntity<BuyerResponse> response = restTemplate.getForEntity("/api/buyers/90", BuyerResponse.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        BuyerResponse profile = response.getBody();
        assertNotNull(profile);
        assertEquals(0, new BigDecimal("42.50").compareTo(profile.getBalance()));
        assertEquals(5, profile.getTotalPurchases());
        assertEquals(BuyerTier.REGULAR, profile.getTier());
        assertEquals(BuyerSessionState.BROWSING, profile.getSessionState());
    }

    @Test
    void unknownProfileIsNotFound() {
        ResponseEntity<BuyerResponse> response = restTemplate.getForEntity("/api/buyers/404", BuyerResponse.class);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertNotNull(response.getBody());
        assertEquals("BUYER_NOT_FOUND", response.getBody().getErrorCode());
    }

    @Test
    @DisplayName("Purchase history lists the ten latest, newest first")
    void purchaseHistoryIsLatestTen() {
        createBuyer(91L, BigDecimal.ZERO);
        Instant start = Instant.parse("2026-01-01T10:00:00Z");
        for (int i = 0; i < 12; i++) {
            purchaseRecordRepository.save(PurchaseRecord.builder()
                    .buyerId(91L)
                    .productId(1_000L + i)
                    .productName("Sencha " + i)
                    .category("tea")
                    .variant("1g")
                    .pricePaid(new BigDecimal("10.00"))
                    .city("Lisbon")
                    .district("Alfama")
                    .purchasedAt(start.plusSeconds(60L * i))
                    .build());
        }

        ResponseEntity<Map> response = restTemplate.getForEntity("/api/buyers/91/purchases", Map.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        List<Map<String, Object>> purchases = (List<Map<String, Object>>) response.getBody().get("purchases");
        assertEquals(10, purchases.size());
        assertEquals("Sencha 11", purchases.get(0).get("name"));
        assertEquals("Sencha 2", purchases.get(9).get("name"));
        assertEquals("EUR", response.getBody().get("currency"));
    }

    @Test
    void purchaseHistoryOfUnknownBuyerIsNotFound() {
        ResponseEntity<Map> response = restTemplate.getForEntity("/api/buyers/404/purchases", Map.class);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    void appliedDiscountCanBeRemoved() {
        createBuyer(92L, BigDecimal.ZERO);
        createUnit("Sencha", "tea", "10.00", 1);
        discountCodeRepository.save(DiscountCode.builder()
                .code("TWO")
                .type(DiscountType.FIXED)
                .value(new BigDecimal("2.00"))
                .active(true)
                .build());
        restTemplate.postForEntity("/api/buyers/92/basket", ReserveUnitRequest.builder()
                .city("Lisbon").district("Alfama").category("tea").variant("1g")
                .price(new BigDecimal("10.00"))
                .build(), Map.class);
        ResponseEntity<Map> applied = restTemplate.postForEntity("/api/buyers/92/basket/discount",
                new DiscountCodeRequest("TWO"), Map.class);
        assertEquals(HttpStatus.OK, applied.getStatusCode());
        assertEquals("TWO", sessionStore.load(92L).getAppliedDiscountCode());

        ResponseEntity<Map> removed = restTemplate.exchange("/api/buyers/92/basket/discount", HttpMethod.DELETE,
                HttpEntity.EMPTY, Map.class);

        assertEquals(HttpStatus.OK, removed.getStatusCode());
        assertEquals("TWO", removed.getBody().get("code"));
        assertNull(sessionStore.load(92L).getAppliedDiscountCode());
        assertEquals(1, reload(productUnitRepository.findAll().get(0)).getReserved());

        ResponseEntity<Map> again = restTemplate.exchange("/api/buyers/92/basket/discount", HttpMethod.DELETE,
                HttpEntity.EMPTY, Map.class);
        assertEquals(HttpStatus.OK, again.getStatusCode());
        assertNull(again.getBody().get("code"));
    }

    @Test
    @DisplayName("Messages and menu navigation from unregistered ids create no session")
    void unregisteredIdsGetNoSession() {
        ResponseEntity<Map> message = restTemplate.postForEntity("/api/buyers/404/messages",
                new BuyerMessageRequest("hello"), Map.class);
        ResponseEntity<Map> state = restTemplate.exchange("/api/buyers/405/session/state", HttpMethod.PUT,
                new HttpEntity<>(new SessionStateRequest(BuyerSessionState.AWAITING_TOP_UP_AMOUNT)), Map.class);

        assertEquals(HttpStatus.NOT_FOUND, message.getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND, state.getStatusCode());
        assertFalse(sessionStore.exists(404L));
        assertFalse(sessionStore.exists(405L));
    }

    @Test
    void menuNavigationIsRemembered() {
        createBuyer(93L, BigDecimal.ZERO);

        restTemplate.exchange("/api/buyers/93/session/state", HttpMethod.PUT,
                new HttpEntity<>(new SessionStateRequest(BuyerSessionState.AWAITING_TOP_UP_AMOUNT)), Map.class);
        ResponseEntity<Map> reply = restTemplate.postForEntity("/api/buyers/93/messages",
                new BuyerMessageRequest("20"), Map.class);

        assertEquals(HttpStatus.OK, reply.getStatusCode());
        assertEquals("BROWSING", reply.getBody().get("state"));
        assertEquals(0, new BigDecimal("20").compareTo(sessionStore.load(93L).getPendingTopUpAmount()));
    }
}
