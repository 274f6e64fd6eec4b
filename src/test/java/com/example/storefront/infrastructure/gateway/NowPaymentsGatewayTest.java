package com.example.storefront.infrastructure.gateway;

import com.example.storefront.application.dto.ProcessorPayment;
import com.example.storefront.application.dto.ProcessorPaymentRequest;
import com.example.storefront.config.CheckoutProperties;
import com.example.storefront.domain.exception.PaymentProcessorException;
import com.example.storefront.domain.exception.ProcessorErrorKind;
import com.example.storefront.infrastructure.monitoring.CheckoutMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class NowPaymentsGatewayTest {

    private static final String BASE_URL = "http://processor.test";

    private MockRestServiceServer server;
    private CheckoutProperties properties;
    private NowPaymentsGateway gateway;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();

        properties = new CheckoutProperties();
        properties.getProcessor().setApiKey("test-key");

        Retry retry = Retry.of("test", RetryConfig.custom()
                .maxAttempts(2)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(e -> e instanceof PaymentProcessorException && ((PaymentProcessorException) e).isTransientFailure())
                .build());

        gateway = new NowPaymentsGateway(builder.build(), properties, CircuitBreaker.ofDefaults("test"), retry,
                new CheckoutMetrics(new SimpleMeterRegistry()));
    }

    @Test
    void estimateReadsEstimatedAmount() {
        server.expect(requestTo(BASE_URL + "/v1/estimate?amount=90.00&currency_from=eur&currency_to=btc"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("x-api-key", "test-key"))
                .andRespond(withSuccess("{\"currency_from\":\"eur\",\"amount_from\":90,\"currency_to\":\"btc\","
                        + "\"estimated_amount\":\"0.00142\"}", MediaType.APPLICATION_JSON));

        BigDecimal estimate = gateway.estimate(new BigDecimal("90.00"), "EUR", "BTC");

        assertEquals(new BigDecimal("0.00142"), estimate);
        server.verify();
    }

    @Test
    void unknownCurrencyOnEstimate() {
        server.expect(requestTo(BASE_URL + "/v1/estimate?amount=10&currency_from=eur&currency_to=xyz"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"statusCode\":400,\"code\":\"BAD_REQUEST\",\"message\":\"Currencies not found: xyz\"}"));

        PaymentProcessorException e = assertThrows(PaymentProcessorException.class,
                () -> gateway.estimate(BigDecimal.TEN, "eur", "xyz"));

        assertEquals(ProcessorErrorKind.ESTIMATE_CURRENCY_NOT_FOUND, e.getKind());
        server.verify();
    }

    @Test
    void minimumAmountIsParsed() {
        server.expect(requestTo(BASE_URL + "/v1/min-amount?currency_from=ltc"))
                .andRespond(withSuccess("{\"currency_from\":\"ltc\",\"min_amount\":0.0251}", MediaType.APPLICATION_JSON));

        assertEquals(new BigDecimal("0.0251"), gateway.minimumAmount("LTC"));
    }

    @Test
    void createPaymentMapsResponse() {
        server.expect(requestTo(BASE_URL + "/v1/payment"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.price_amount").value(0.0015))
                .andExpect(jsonPath("$.pay_currency").value("btc"))
                .andExpect(jsonPath("$.order_id").value("USER1_PURCHASE_1_abcdef"))
                .andExpect(jsonPath("$.ipn_callback_url").value("http://localhost:8080/webhook"))
                .andExpect(jsonPath("$.is_fixed_rate").value(false))
                .andRespond(withSuccess(paymentJson("0.0015"), MediaType.APPLICATION_JSON));

        ProcessorPayment payment = gateway.createPayment(request());

        assertEquals("5077125051", payment.getPaymentId());
        assertEquals("bc1qexampleaddress", payment.getPayAddress());
        assertEquals(new BigDecimal("0.0015"), payment.getPayAmount());
        assertEquals("btc", payment.getPayCurrency());
        server.verify();
    }

    @Test
    void serverErrorIsRetriedOnce() {
        server.expect(requestTo(BASE_URL + "/v1/payment")).andRespond(withServerError());
        server.expect(requestTo(BASE_URL + "/v1/payment"))
                .andRespond(withSuccess(paymentJson("0.0015"), MediaType.APPLICATION_JSON));

        ProcessorPayment payment = gateway.createPayment(request());

        assertEquals("5077125051", payment.getPaymentId());
        server.verify();
    }

    @Test
    void secondServerErrorGivesUp() {
        server.expect(requestTo(BASE_URL + "/v1/payment")).andRespond(withServerError());
        server.expect(requestTo(BASE_URL + "/v1/payment")).andRespond(withServerError());

        PaymentProcessorException e = assertThrows(PaymentProcessorException.class, () -> gateway.createPayment(request()));

        assertEquals(ProcessorErrorKind.API_REQUEST_FAILED, e.getKind());
        assertTrue(e.isTransientFailure());
        server.verify();
    }

    @Test
    void rejectedApiKeyIsNotRetried() {
        server.expect(requestTo(BASE_URL + "/v1/payment")).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        PaymentProcessorException e = assertThrows(PaymentProcessorException.class, () -> gateway.createPayment(request()));

        assertEquals(ProcessorErrorKind.API_KEY_INVALID, e.getKind());
        server.verify();
    }

    @Test
    void amountTooLowFromProcessor() {
        server.expect(requestTo(BASE_URL + "/v1/payment"))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"statusCode\":400,\"code\":\"AMOUNT_MINIMAL_ERROR\",\"message\":\"amountTo is too small\"}"));

        PaymentProcessorException e = assertThrows(PaymentProcessorException.class, () -> gateway.createPayment(request()));

        assertEquals(ProcessorErrorKind.AMOUNT_TOO_LOW_API, e.getKind());
    }

    @Test
    void incompleteResponseIsInvalid() {
        server.expect(requestTo(BASE_URL + "/v1/payment"))
                .andRespond(withSuccess("{\"payment_id\":\"1\",\"pay_amount\":0.1}", MediaType.APPLICATION_JSON));

        PaymentProcessorException e = assertThrows(PaymentProcessorException.class, () -> gateway.createPayment(request()));

        assertEquals(ProcessorErrorKind.INVALID_API_RESPONSE, e.getKind());
    }

    @Test
    void missingApiKeyFailsWithoutCallingProcessor() {
        properties.getProcessor().setApiKey(" ");

        PaymentProcessorException e = assertThrows(PaymentProcessorException.class,
                () -> gateway.estimate(BigDecimal.TEN, "eur", "btc"));

        assertEquals(ProcessorErrorKind.API_MISCONFIGURED, e.getKind());
        server.verify();
    }

    private ProcessorPaymentRequest request() {
        return ProcessorPaymentRequest.builder()
                .assetAmount(new BigDecimal("0.0015"))
                .asset("BTC")
                .orderReference("USER1_PURCHASE_1_abcdef")
                .orderDescription("Purchase 90.00 EUR")
                .callbackUrl(properties.getProcessor().callbackUrl())
                .build();
    }

    private static String paymentJson(String payAmount) {
        return "{\"payment_id\":\"5077125051\",\"payment_status\":\"waiting\",\"pay_address\":\"bc1qexampleaddress\","
                + "\"price_amount\":" + payAmount + ",\"price_currency\":\"btc\",\"pay_amount\":" + payAmount + ","
                + "\"pay_currency\":\"btc\",\"order_id\":\"USER1_PURCHASE_1_abcdef\","
                + "\"expiration_estimate_date\":\"2024-06-01T12:20:00.000Z\"}";
    }
}
