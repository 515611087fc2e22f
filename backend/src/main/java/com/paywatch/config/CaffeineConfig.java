package com.paywatch.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. {@link #PAYMENT_REQUEST_CACHE} holds the advisory local copy of each request;
 * the store stays authoritative.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String PAYMENT_REQUEST_CACHE = "paymentRequestCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        // outlives the 1h request window so a locally kept copy survives until it expires
        manager.registerCustomCache(PAYMENT_REQUEST_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(2, TimeUnit.HOURS)
                .maximumSize(10_000)
                .build());
        return manager;
    }
}
