package com.example.storefront.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Data
@Component
@ConfigurationProperties(prefix = "checkout")
public class CheckoutProperties {

    private Basket basket = new Basket();
    private Session session = new Session();
    private Processor processor = new Processor();
    private Settlement settlement = new Settlement();
    private Outbox outbox = new Outbox();
    private Topics topics = new Topics();

    @Data
    public static class Basket {
        private Duration ttl = Duration.ofMinutes(15);
        private long sweepIntervalMs = 60_000;
        private boolean sweepEnabled = true;
    }

    @Data
    public static class Session {
        // idle buyer sessions fall back to browsing after this long
        private Duration ttl = Duration.ofHours(12);
    }

    @Data
    public static class Processor {
        private String baseUrl = "https://api.nowpayments.io";
        private String apiKey;
        private String ipnSecret;
        private String callbackBaseUrl = "http://localhost:8080";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(20);
        private boolean signatureRequired = true;

        public String callbackUrl() {
            String base = callbackBaseUrl.endsWith("/")
                    ? callbackBaseUrl.substring(0, callbackBaseUrl.length() - 1)
                    : callbackBaseUrl;
            return base + "/webhook";
        }
    }

    @Data
    public static class Settlement {
        private String currency = "EUR";
        private BigDecimal feeAdjustment = BigDecimal.ONE;
        private BigDecimal minTopUpAmount = new BigDecimal("5.00");
        private List<String> supportedAssets = new ArrayList<>(List.of("BTC", "LTC", "ETH", "SOL", "USDT", "USDC", "TON"));

        public boolean isSupported(String asset) {
            return asset != null && supportedAssets.stream()
                    .anyMatch(supported -> supported.equalsIgnoreCase(asset.trim()));
        }

        public String currencyCode() {
            return currency.toLowerCase(Locale.ROOT);
        }
    }

    @Data
    public static class Outbox {
        private long relayIntervalMs = 5_000;
        private boolean relayEnabled = true;
        private int maxAttempts = 5;
        private int batchSize = 50;
        private long sendTimeoutSeconds = 10;
    }

    @Data
    public static class Topics {
        private String buyerNotifications = "buyer-notifications";
        private String operatorAlerts = "operator-alerts";
    }
}
