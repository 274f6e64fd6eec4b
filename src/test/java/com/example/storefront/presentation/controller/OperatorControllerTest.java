package com.example.storefront.presentation.controller;

import com.example.storefront.IntegrationTestSupport;
import com.example.storefront.domain.model.discount.DiscountCode;
import com.example.storefront.domain.model.discount.DiscountType;
import com.example.storefront.presentation.dto.request.CreateDiscountCodeRequest;
import com.example.storefront.presentation.dto.request.ResellerDiscountRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OperatorControllerTest extends IntegrationTestSupport {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void discountCodeLifecycle() {
        CreateDiscountCodeRequest request = CreateDiscountCodeRequest.builder()
                .code("SPRING")
                .type(DiscountType.PERCENTAGE)
                .value(new BigDecimal("10"))
                .maxUses(3)
                .build();

        ResponseEntity<Map> created = restTemplate.postForEntity("/api/operator/discount-codes", request, Map.class);
        assertEquals(HttpStatus.CREATED, created.getStatusCode());
        DiscountCode stored = discountCodeRepository.findByCode("SPRING").orElseThrow();
        assertTrue(stored.isActive());
        assertEquals(0, new BigDecimal("10.00").compareTo(stored.getValue()));
        assertEquals(3, stored.getMaxUses());

        ResponseEntity<Map> duplicate = restTemplate.postForEntity("/api/operator/discount-codes", request, Map.class);
        assertEquals(HttpStatus.CONFLICT, duplicate.getStatusCode());
        assertEquals("ADMIN_DUPLICATE", duplicate.getBody().get("errorCode"));

        ResponseEntity<Map> toggled = restTemplate.postForEntity("/api/operator/discount-codes/SPRING/toggle", null, Map.class);
        assertEquals(HttpStatus.OK, toggled.getStatusCode());
        assertFalse(discountCodeRepository.findByCode("SPRING").orElseThrow().isActive());

        ResponseEntity<Map> listed = restTemplate.getForEntity("/api/operator/discount-codes", Map.class);
        List<Map<String, Object>> codes = (List<Map<String, Object>>) listed.getBody().get("codes");
        assertEquals(1, codes.size());
        assertEquals("SPRING", codes.get(0).get("code"));
        assertEquals(Boolean.FALSE, codes.get(0).get("active"));

        ResponseEntity<Map> deleted = restTemplate.exchange("/api/operator/discount-codes/SPRING", HttpMethod.DELETE,
                HttpEntity.EMPTY, Map.class);
        assertEquals(HttpStatus.OK, deleted.getStatusCode());
        assertTrue(discountCodeRepository.findByCode("SPRING").isEmpty());

        ResponseEntity<Map> missing = restTemplate.exchange("/api/operator/discount-codes/SPRING", HttpMethod.DELETE,
                HttpEntity.EMPTY, Map.class);
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());
    }

    @Test
    void percentageAboveHundredIsRefused() {
        CreateDiscountCodeRequest request = CreateDiscountCodeRequest.builder()
                .code("TOOMUCH")
                .type(DiscountType.PERCENTAGE)
                .value(new BigDecimal("150"))
                .build();

        ResponseEntity<Map> response = restTemplate.postForEntity("/api/operator/discount-codes", request, Map.class);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("ADMIN_INVALID", response.getBody().get("errorCode"));
        assertTrue(discountCodeRepository.findByCode("TOOMUCH").isEmpty());
    }

    @Test
    void resellerPercentagesAreManagedPerCategory() {
        createBuyer(95L, BigDecimal.ZERO);

        ResponseEntity<Map> toggled = restTemplate.postForEntity("/api/operator/resellers/95/toggle", null, Map.class);
        assertEquals(HttpStatus.OK, toggled.getStatusCode());
        assertEquals(Boolean.TRUE, toggled.getBody().get("reseller"));
        assertTrue(buyerRepository.findById(95L).orElseThrow().isReseller());

        put("/api/operator/resellers/95/discounts/tea", new BigDecimal("15"));
        ResponseEntity<Map> edited = put("/api/operator/resellers/95/discounts/tea", new BigDecimal("20"));
        put("/api/operator/resellers/95/discounts/coffee", new BigDecimal("5"));

        assertEquals(HttpStatus.OK, edited.getStatusCode());
        assertEquals(1, resellerDiscountRepository.findAll().stream()
                .filter(discount -> discount.getCategory().equals("tea")).count());
        assertEquals(0, new BigDecimal("20.00").compareTo(
                resellerDiscountRepository.findByResellerIdAndCategory(95L, "tea").orElseThrow().getPercentage()));

        ResponseEntity<Map> listed = restTemplate.getForEntity("/api/operator/resellers/95/discounts", Map.class);
        Map<String, Object> percentages = (Map<String, Object>) listed.getBody().get("percentages");
        assertEquals(List.of("coffee", "tea"), List.copyOf(percentages.keySet()));

        ResponseEntity<Map> tooHigh = put("/api/operator/resellers/95/discounts/tea", new BigDecimal("101"));
        assertEquals(HttpStatus.BAD_REQUEST, tooHigh.getStatusCode());

        ResponseEntity<Map> deleted = restTemplate.exchange("/api/operator/resellers/95/discounts/tea", HttpMethod.DELETE,
                HttpEntity.EMPTY, Map.class);
        assertEquals(HttpStatus.OK, deleted.getStatusCode());
        assertTrue(resellerDiscountRepository.findByResellerIdAndCategory(95L, "tea").isEmpty());

        ResponseEntity<Map> missing = restTemplate.exchange("/api/operator/resellers/95/discounts/tea", HttpMethod.DELETE,
                HttpEntity.EMPTY, Map.class);
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());

        ResponseEntity<Map> untoggled = restTemplate.postForEntity("/api/operator/resellers/95/toggle", null, Map.class);
        assertEquals(Boolean.FALSE, untoggled.getBody().get("reseller"));
    }

    @Test
    void unknownResellerIsNotFound() {
        assertEquals(HttpStatus.NOT_FOUND,
                restTemplate.postForEntity("/api/operator/resellers/404/toggle", null, Map.class).getStatusCode());
        assertEquals(HttpStatus.NOT_FOUND,
                put("/api/operator/resellers/404/discounts/tea", new BigDecimal("10")).getStatusCode());
        assertTrue(resellerDiscountRepository.findAll().isEmpty());
    }

    private ResponseEntity<Map> put(String path, BigDecimal percentage) {
        return restTemplate.exchange(path, HttpMethod.PUT,
                new HttpEntity<>(new ResellerDiscountRequest(percentage)), Map.class);
    }
}
