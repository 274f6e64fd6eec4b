package com.example.storefront.infrastructure.persistence.redis.config;

import com.example.storefront.application.session.BuyerSession;
import com.example.storefront.application.session.BuyerSessionStore;
import com.example.storefront.config.CheckoutProperties;
import com.example.storefront.infrastructure.cache.CatalogCache;
import com.example.storefront.infrastructure.gateway.NowPaymentsGateway;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Redis-backed Spring Cache. Active when {@code spring.cache.type=redis}; tests use the simple cache.
 * Each known cache gets a serializer bound to its value type.
 */
@Configuration
@ConditionalOnProperty(name = "spring.cache.type", havingValue = "redis")
public class RedisConfig {

    // the processor refreshes its minimums roughly every 15 minutes
    private static final Duration PROCESSOR_MINIMUMS_TTL = Duration.ofMinutes(30);
    private static final Duration DEFAULT_TTL = Duration.ofMinutes(10);

    @Bean
    public RedisCacheManager cacheManager(RedisConnectionFactory connectionFactory, CheckoutProperties properties) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        RedisCacheConfiguration defaults = RedisCacheConfiguration.defaultCacheConfig()
                .prefixCacheNameWith("storefront:")
                .disableCachingNullValues()
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(
                        new GenericJackson2JsonRedisSerializer()))
                .entryTtl(DEFAULT_TTL);

        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(defaults)
                .withInitialCacheConfigurations(Map.of(
                        NowPaymentsGateway.MIN_AMOUNT_CACHE, typed(defaults, mapper, BigDecimal.class).entryTtl(PROCESSOR_MINIMUMS_TTL),
                        CatalogCache.CACHE_NAME, typed(defaults, mapper, CatalogCache.CatalogView.class),
                        BuyerSessionStore.CACHE_NAME, typed(defaults, mapper, BuyerSession.class)
                                .entryTtl(properties.getSession().getTtl())))
                .build();
    }

    private static <T> RedisCacheConfiguration typed(RedisCacheConfiguration base, ObjectMapper mapper, Class<T> type) {
        return base.serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(
                new Jackson2JsonRedisSerializer<>(mapper, type)));
    }
}
