package com.campussecurity.dispatch.integration;

import com.campussecurity.dispatch.service.BeaconGraphService;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.cache.transaction.TransactionAwareCacheManagerProxy;
import org.springframework.context.annotation.Bean;

/**
 * In-memory cache with the same transaction-aware decoration as the Redis manager, so
 * evictions issued inside a proximity edit are deferred to commit exactly as in production.
 */
@TestConfiguration
class TransactionalCacheTestConfig {

    @Bean
    CacheManager cacheManager() {
        return new TransactionAwareCacheManagerProxy(new ConcurrentMapCacheManager(BeaconGraphService.GRAPH_CACHE));
    }
}
