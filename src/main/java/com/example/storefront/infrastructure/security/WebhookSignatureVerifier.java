package com.example.storefront.infrastructure.security;

import com.example.storefront.config.CheckoutProperties;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;

/**
 * Verifies the processor's {@code x-nowpayments-sig} header:
 * HMAC-SHA512 (hex) of the body re-serialized with keys sorted, compared in constant time.
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    public static final String SIGNATURE_HEADER = "x-nowpayments-sig";

    private static final String ALGORITHM = "HmacSHA512";

    private final CheckoutProperties properties;
    private final ObjectMapper canonicalMapper;

    public WebhookSignatureVerifier(CheckoutProperties properties) {
        this.properties = properties;
        this.canonicalMapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true)
                .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
    }

    public boolean isRequired() {
        return properties.getProcessor().isSignatureRequired();
    }

    public boolean verify(String rawBody, String signatureHeader) {
        String secret = properties.getProcessor().getIpnSecret();
        if (secret == null || secret.isBlank() || signatureHeader == null || signatureHeader.isBlank()) {
            log.warn("Webhook signature cannot be checked: secretConfigured={}, headerPresent={}",
                    secret != null && !secret.isBlank(), signatureHeader != null && !signatureHeader.isBlank());
            return false;
        }
        try {
            String expected = sign(canonicalize(rawBody), secret);
            return MessageDigest.isEqual(
                    expected.getBytes(StandardCharsets.US_ASCII),
                    signatureHeader.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
        } catch (JsonProcessingException e) {
            log.warn("Webhook body is not valid JSON, signature rejected: {}", e.getOriginalMessage());
            return false;
        }
    }

    /**
     * Compact JSON with object keys sorted at every level.
     */
    public String canonicalize(String rawBody) throws JsonProcessingException {
        Map<String, Object> parsed = canonicalMapper.readValue(rawBody, new TypeReference<Map<String, Object>>() {
        });
        return canonicalMapper.writeValueAsString(parsed);
    }

    public String sign(String canonicalBody, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(canonicalBody.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA512 unavailable", e);
        }
    }
}
