package com.example.storefront.application.service;

import com.example.storefront.IntegrationTestSupport;
import com.example.storefront.application.dto.ReservationCriteria;
import com.example.storefront.domain.exception.AdministrationException;
import com.example.storefront.domain.exception.BuyerNotFoundException;
import com.example.storefront.domain.exception.DiscountException;
import com.example.storefront.domain.model.discount.DiscountCode;
import com.example.storefront.domain.model.discount.DiscountRejection;
import com.example.storefront.domain.model.discount.DiscountResolution;
import com.example.storefront.domain.model.discount.DiscountType;
import com.example.storefront.domain.model.purchase.PurchaseRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiscountAdministrationServiceTest extends IntegrationTestSupport {

    @Autowired
    private DiscountAdministrationService discountAdministrationService;

    @Autowired
    private BuyerAccountService buyerAccountService;

    @Autowired
    private ReservationService reservationService;

    @Autowired
    private CheckoutService checkoutService;

    @Test
    @DisplayName("Created code is trimmed, active and usable at checkout")
    void createdCodeCanBeApplied() {
        DiscountCode created = discountAdministrationService.createCode(definition("  AUTUMN ", DiscountType.FIXED, "3"));
        assertEquals("AUTUMN", created.getCode());
        assertTrue(created.isActive());

        createBuyer(70L, BigDecimal.ZERO);
        createUnit("Sencha", "tea", "10.00", 1);
        reservationService.reserve(70L, criteria("tea", "10.00"));

        DiscountResolution resolution = checkoutService.applyDiscount(70L, "AUTUMN");
        assertEquals(0, new BigDecimal("7.00").compareTo(resolution.getFinalTotal()));
    }

    @Test
    void malformedCodesAreRefused() {
        assertInvalid(definition("", DiscountType.FIXED, "3"));
        assertInvalid(definition("X".repeat(DiscountAdministrationService.MAX_CODE_LENGTH + 1), DiscountType.FIXED, "3"));
        assertInvalid(definition("ZERO", DiscountType.FIXED, "0"));
        assertInvalid(definition("HALF", DiscountType.PERCENTAGE, "100.01"));

        assertNotNull(discountAdministrationService.createCode(definition("ALL", DiscountType.PERCENTAGE, "100")));
        assertNotNull(discountAdministrationService.createCode(
                definition("X".repeat(DiscountAdministrationService.MAX_CODE_LENGTH), DiscountType.FIXED, "500")));
        assertEquals(2, discountCodeRepository.count());
    }

    @Test
    void toggledOffCodeIsRejectedAtCheckout() {
        discountAdministrationService.createCode(definition("PAUSED", DiscountType.PERCENTAGE, "10"));
        discountAdministrationService.toggleCode("PAUSED");

        createBuyer(71L, BigDecimal.ZERO);
        createUnit("Sencha", "tea", "10.00", 1);
        reservationService.reserve(71L, criteria("tea", "10.00"));

        assertFalse(checkoutService.viewBasket(71L).getPricing().isApplied());
        DiscountException rejected = assertThrows(DiscountException.class, () -> checkoutService.applyDiscount(71L, "PAUSED"));
        assertEquals(DiscountRejection.INACTIVE, rejected.getRejection());
    }

    @Test
    @DisplayName("Reseller percentage set by the operator is recorded on the purchase")
    void resellerPercentageReachesPurchaseRecord() {
        createBuyer(72L, new BigDecimal("50.00"));
        assertTrue(buyerAccountService.toggleReseller(72L));
        discountAdministrationService.setResellerDiscount(72L, " tea ", new BigDecimal("25"));
        createUnit("Sencha", "tea", "20.00", 1);
        reservationService.reserve(72L, criteria("tea", "20.00"));

        checkoutService.payWithBalance(72L);

        List<PurchaseRecord> purchases = purchaseRecordRepository.findByBuyerIdOrderByPurchasedAtDesc(72L);
        assertEquals(1, purchases.size());
        assertEquals(0, new BigDecimal("15.00").compareTo(purchases.get(0).getPricePaid()));
        assertEquals(0, new BigDecimal("30.00").compareTo(buyerRepository.findById(72L).orElseThrow().getBalance()));
    }

    @Test
    void resellerPercentageOutsideRangeIsRefused() {
        createBuyer(73L, BigDecimal.ZERO);

        assertThrows(AdministrationException.class,
                () -> discountAdministrationService.setResellerDiscount(73L, "tea", new BigDecimal("-1")));
        assertThrows(AdministrationException.class,
                () -> discountAdministrationService.setResellerDiscount(73L, "tea", new BigDecimal("100.5")));
        assertThrows(BuyerNotFoundException.class,
                () -> discountAdministrationService.setResellerDiscount(404L, "tea", BigDecimal.TEN));
        assertTrue(resellerDiscountRepository.findAll().isEmpty());
    }

    private void assertInvalid(DiscountAdministrationService.NewDiscountCode definition) {
        AdministrationException thrown = assertThrows(AdministrationException.class,
                () -> discountAdministrationService.createCode(definition));
        assertEquals(AdministrationException.Reason.INVALID, thrown.getReason());
    }

    private static DiscountAdministrationService.NewDiscountCode definition(String code, DiscountType type, String value) {
        return DiscountAdministrationService.NewDiscountCode.builder()
                .code(code)
                .type(type)
                .value(new BigDecimal(value))
                .build();
    }

    private static ReservationCriteria criteria(String category, String price) {
        return ReservationCriteria.builder()
                .city("Lisbon").district("Alfama").category(category).variant("1g")
                .price(new BigDecimal(price))
                .build();
    }
}
