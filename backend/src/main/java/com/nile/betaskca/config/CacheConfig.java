package com.nile.betaskca.config;

import java.time.Duration;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.nile.betaskca.service.ItemService;

/**
 * Caffeine-based cache configuration.
 * - "items" cache: the catalog listing, evicted whenever an item is created.
 *   The TTL bounds staleness for items written by another instance.
 *
 * The cache advice wraps the transaction advice, so evictions run after commit.
 */
@Configuration
@EnableCaching(order = CacheConfig.CACHE_ADVICE_ORDER)
public class CacheConfig {

    static final int CACHE_ADVICE_ORDER = Ordered.LOWEST_PRECEDENCE - 10;

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(ItemService.ITEMS_CACHE);
        manager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofMinutes(1))
                .maximumSize(10));
        return manager;
    }
}
