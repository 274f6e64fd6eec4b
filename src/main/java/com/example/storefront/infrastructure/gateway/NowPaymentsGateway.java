package com.example.storefront.infrastructure.gateway;

import com.example.storefront.application.dto.ProcessorPayment;
import com.example.storefront.application.dto.ProcessorPaymentRequest;
import com.example.storefront.config.CheckoutProperties;
import com.example.storefront.domain.exception.PaymentProcessorException;
import com.example.storefront.domain.exception.ProcessorErrorKind;
import com.example.storefront.domain.service.PaymentProcessorGateway;
import com.example.storefront.infrastructure.monitoring.CheckoutMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * NOWPayments REST client.
 */
@Component
@Slf4j
public class NowPaymentsGateway implements PaymentProcessorGateway {

    static final String API_KEY_HEADER = "x-api-key";
    public static final String MIN_AMOUNT_CACHE = "processor-minimums";

    private static final List<String> REQUIRED_PAYMENT_KEYS =
            List.of("payment_id", "pay_address", "pay_amount", "pay_currency", "expiration_estimate_date");

    private final RestClient restClient;
    private final CheckoutProperties properties;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final CheckoutMetrics metrics;

    public NowPaymentsGateway(@Qualifier("paymentProcessorRestClient") RestClient restClient,
                              CheckoutProperties properties,
                              @Qualifier("paymentProcessorCircuitBreaker") CircuitBreaker circuitBreaker,
                              @Qualifier("paymentProcessorRetry") Retry retry,
                              CheckoutMetrics metrics) {
        this.restClient = restClient;
        this.properties = properties;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
        this.metrics = metrics;
    }

    @Override
    public BigDecimal estimate(BigDecimal amount, String fiatCurrency, String asset) {
        String apiKey = requireApiKey();
        String assetCode = lower(asset);

        JsonNode body = execute("estimate", ProcessorErrorKind.ESTIMATE_FAILED,
                () -> restClient.get()
                        .uri(uri -> uri.path("/v1/estimate")
                                .queryParam("amount", amount.toPlainString())
                                .queryParam("currency_from", lower(fiatCurrency))
                                .queryParam("currency_to", assetCode)
                                .build())
                        .header(API_KEY_HEADER, apiKey)
                        .retrieve()
                        .body(JsonNode.class),
                e -> translateEstimateFailure(e, assetCode));

        BigDecimal estimated = decimalField(body, "estimated_amount", ProcessorErrorKind.ESTIMATE_FAILED);
        log.info("Processor estimate received: amount={} {}, estimated={} {}", amount, fiatCurrency, estimated, assetCode);
        return estimated;
    }

    @Override
    @Cacheable(cacheNames = MIN_AMOUNT_CACHE, key = "#p0.toLowerCase()")
    public BigDecimal minimumAmount(String asset) {
        String apiKey = requireApiKey();
        String assetCode = lower(asset);

        JsonNode body = execute("min-amount", ProcessorErrorKind.MIN_AMOUNT_FETCH_ERROR,
                () -> restClient.get()
                        .uri(uri -> uri.path("/v1/min-amount")
                                .queryParam("currency_from", assetCode)
                                .build())
                        .header(API_KEY_HEADER, apiKey)
                        .retrieve()
                        .body(JsonNode.class),
                e -> translate(e, ProcessorErrorKind.MIN_AMOUNT_FETCH_ERROR, "min-amount " + assetCode));

        BigDecimal minimum = decimalField(body, "min_amount", ProcessorErrorKind.MIN_AMOUNT_FETCH_ERROR);
        log.info("Processor minimum fetched: asset={}, minAmount={}", assetCode, minimum);
        return minimum;
    }

    @Override
    public ProcessorPayment createPayment(ProcessorPaymentRequest request) {
        String apiKey = requireApiKey();
        String assetCode = lower(request.getAsset());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("price_amount", request.getAssetAmount());
        payload.put("price_currency", assetCode);
        payload.put("pay_currency", assetCode);
        payload.put("ipn_callback_url", request.getCallbackUrl());
        payload.put("order_id", request.getOrderReference());
        payload.put("order_description", request.getOrderDescription());
        payload.put("is_fixed_rate", false);

        JsonNode body = execute("create-payment", ProcessorErrorKind.API_REQUEST_FAILED,
                () -> restClient.post()
                        .uri("/v1/payment")
                        .header(API_KEY_HEADER, apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(payload)
                        .retrieve()
                        .body(JsonNode.class),
                e -> translateCreateFailure(e, request.getOrderReference()));

        for (String key : REQUIRED_PAYMENT_KEYS) {
            if (body == null || !body.hasNonNull(key)) {
                log.error("Invalid processor payment response, missing key: orderReference={}, key={}",
                        request.getOrderReference(), key);
                throw new PaymentProcessorException(ProcessorErrorKind.INVALID_API_RESPONSE,
                        "Payment response missing " + key + ": orderReference=" + request.getOrderReference());
            }
        }

        ProcessorPayment payment = ProcessorPayment.builder()
                .paymentId(body.get("payment_id").asText())
                .payAddress(body.get("pay_address").asText())
                .payAmount(decimalField(body, "pay_amount", ProcessorErrorKind.INVALID_API_RESPONSE))
                .payCurrency(lower(body.get("pay_currency").asText()))
                .expiresAt(body.get("expiration_estimate_date").asText())
                .build();

        log.info("Processor payment created: paymentId={}, orderReference={}, payAmount={} {}",
                payment.getPaymentId(), request.getOrderReference(), payment.getPayAmount(), payment.getPayCurrency());
        return payment;
    }

    @Override
    public String getGatewayName() {
        return "NOWPAYMENTS";
    }

    // ===== Helpers =====

    private <T> T execute(String operation, ProcessorErrorKind unavailableKind, Supplier<T> call,
                          Function<RestClientException, PaymentProcessorException> translator) {
        Supplier<T> guarded = () -> {
            try {
                return call.get();
            } catch (RestClientException e) {
                throw translator.apply(e);
            }
        };
        Supplier<T> decorated = Retry.decorateSupplier(retry, CircuitBreaker.decorateSupplier(circuitBreaker, guarded));

        Timer.Sample sample = metrics.startTimer();
        try {
            T result = decorated.get();
            metrics.recordProcessorCall(sample, operation, "success");
            return result;
        } catch (CallNotPermittedException e) {
            metrics.recordProcessorCall(sample, operation, "rejected");
            log.error("Processor circuit open, call rejected: operation={}", operation);
            throw new PaymentProcessorException(unavailableKind, "Processor circuit open: operation=" + operation, false, e);
        } catch (PaymentProcessorException e) {
            metrics.recordProcessorCall(sample, operation, "failure");
            log.error("Processor call failed: operation={}, kind={}, transient={}",
                    operation, e.getKind(), e.isTransientFailure(), e);
            throw e;
        }
    }

    private PaymentProcessorException translateEstimateFailure(RestClientException e, String assetCode) {
        if (e instanceof HttpClientErrorException clientError
                && clientError.getResponseBodyAsString().toLowerCase(Locale.ROOT).contains("currencies not found")) {
            return new PaymentProcessorException(ProcessorErrorKind.ESTIMATE_CURRENCY_NOT_FOUND,
                    "Processor does not know currency " + assetCode, false, e);
        }
        return translate(e, ProcessorErrorKind.ESTIMATE_FAILED, "estimate " + assetCode);
    }

    private PaymentProcessorException translateCreateFailure(RestClientException e, String orderReference) {
        if (e instanceof HttpClientErrorException clientError) {
            if (clientError.getStatusCode().value() == 401) {
                log.error("[CRITICAL] Processor rejected the API key: orderReference={}", orderReference);
                return new PaymentProcessorException(ProcessorErrorKind.API_KEY_INVALID,
                        "Processor API key rejected", false, e);
            }
            if (clientError.getStatusCode().value() == 400
                    && clientError.getResponseBodyAsString().contains("AMOUNT_MINIMAL_ERROR")) {
                return new PaymentProcessorException(ProcessorErrorKind.AMOUNT_TOO_LOW_API,
                        "Processor rejected amount as too low: orderReference=" + orderReference, false, e);
            }
        }
        if (e instanceof ResourceAccessException && e.getCause() instanceof SocketTimeoutException) {
            return new PaymentProcessorException(ProcessorErrorKind.API_TIMEOUT,
                    "Processor timed out: orderReference=" + orderReference, true, e);
        }
        return translate(e, ProcessorErrorKind.API_REQUEST_FAILED, "create-payment " + orderReference);
    }

    private PaymentProcessorException translate(RestClientException e, ProcessorErrorKind kind, String context) {
        boolean transientFailure = e instanceof ResourceAccessException || e instanceof HttpServerErrorException;
        return new PaymentProcessorException(kind, "Processor call failed: " + context + ": " + e.getMessage(),
                transientFailure, e);
    }

    private BigDecimal decimalField(JsonNode body, String field, ProcessorErrorKind kind) {
        JsonNode node = body == null ? null : body.get(field);
        if (node == null || node.isNull()) {
            throw new PaymentProcessorException(kind, "Processor response missing " + field);
        }
        try {
            return node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new PaymentProcessorException(kind, "Processor returned non-numeric " + field + ": " + node, false, e);
        }
    }

    private String requireApiKey() {
        String apiKey = properties.getProcessor().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.error("Processor API key is not configured");
            throw new PaymentProcessorException(ProcessorErrorKind.API_MISCONFIGURED, "Processor API key is not configured");
        }
        return apiKey;
    }

    private static String lower(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }
}
