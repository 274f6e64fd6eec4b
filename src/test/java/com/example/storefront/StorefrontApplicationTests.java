package com.example.storefront;

import com.example.storefront.domain.model.buyer.Buyer;
import com.example.storefront.presentation.dto.request.RegisterBuyerRequest;
import com.example.storefront.presentation.dto.request.ReserveUnitRequest;
import com.example.storefront.presentation.dto.response.CatalogResponse;
import com.example.storefront.presentation.dto.response.CheckoutResponse;
import com.example.storefront.presentation.dto.response.ReservationResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class StorefrontApplicationTests extends IntegrationTestSupport {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void contextLoads() {
        assertNotNull(restTemplate);
    }

    @Test
    void catalogListsLocationsAndCategories() {
        createUnit("Sencha", "tea", "10.00", 1);
        createUnit("Mint", "herbal", "6.00", 1);

        ResponseEntity<CatalogResponse> response = restTemplate.getForEntity("/api/catalog", CatalogResponse.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        CatalogResponse catalog = response.getBody();
        assertNotNull(catalog);
        assertTrue(catalog.getDistrictsByCity().get("Lisbon").contains("Alfama"));
        assertTrue(catalog.getCategories().contains("tea"));
        assertTrue(catalog.getCategories().contains("herbal"));
    }

    @Test
    void reserveAndPayWithBalanceOverHttp() {
        ResponseEntity<String> registered = restTemplate.exchange("/api/buyers/70", HttpMethod.PUT,
                new HttpEntity<>(new RegisterBuyerRequest("tea_lover")), String.class);
        assertEquals(HttpStatus.OK, registered.getStatusCode());
        createUnit("Sencha", "tea", "10.00", 1);

        ReserveUnitRequest request = ReserveUnitRequest.builder()
                .city("Lisbon").district("Alfama").category("tea").variant("1g")
                .price(new BigDecimal("10.00"))
                .build();
        ResponseEntity<ReservationResponse> reserved = restTemplate.postForEntity(
                "/api/buyers/70/basket", request, ReservationResponse.class);
        assertEquals(HttpStatus.OK, reserved.getStatusCode());

        ResponseEntity<CheckoutResponse> refused = restTemplate.postForEntity(
                "/api/buyers/70/checkout/balance", null, CheckoutResponse.class);
        assertEquals(HttpStatus.PAYMENT_REQUIRED, refused.getStatusCode());
        assertNotNull(refused.getBody());
        assertEquals("INSUFFICIENT_BALANCE", refused.getBody().getErrorCode());
        assertEquals(0, new BigDecimal("10.00").compareTo(refused.getBody().getShortfall()));

        Buyer buyer = buyerRepository.findById(70L).orElseThrow();
        buyer.setBalance(new BigDecimal("15.00"));
        buyerRepository.save(buyer);

        ResponseEntity<CheckoutResponse> paid = restTemplate.postForEntity(
                "/api/buyers/70/checkout/balance", null, CheckoutResponse.class);
        assertEquals(HttpStatus.OK, paid.getStatusCode());
        assertNotNull(paid.getBody());
        assertEquals(0, new BigDecimal("5.00").compareTo(paid.getBody().getBalance()));
        assertEquals(1, paid.getBody().getUnitCount());
    }

    @Test
    void reservingForUnknownBuyerIsNotFound() {
        ReserveUnitRequest request = ReserveUnitRequest.builder()
                .city("Lisbon").district("Alfama").category("tea").variant("1g")
                .price(new BigDecimal("10.00"))
                .build();

        ResponseEntity<ReservationResponse> response = restTemplate.postForEntity(
                "/api/buyers/404/basket", request, ReservationResponse.class);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }
}
