package com.bridgewatcher.config;

import com.bridgewatcher.attestation.AttestationSink;
import com.bridgewatcher.attestation.config.AttestationProperties;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches. Delivered nonces are kept so a re-scanned batch does not post them twice.
 */
@Configuration
public class CaffeineConfig {

    @Bean
    public CacheManager caffeineCacheManager(AttestationProperties attestationProperties) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(AttestationSink.DELIVERED_NONCE_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(attestationProperties.deliveredCacheTtlHours(), TimeUnit.HOURS)
                .maximumSize(attestationProperties.deliveredCacheSize())
                .build());
        return manager;
    }
}
