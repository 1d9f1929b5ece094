package com.campussecurity.dispatch.config;

import com.campussecurity.dispatch.dto.BeaconGraphSnapshot;
import com.campussecurity.dispatch.service.BeaconGraphService;
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

/**
 * Redis cache configuration for the beacon graph snapshot.
 *
 * The adjacency graph is read on every dispatch search and changes only when an admin edits
 * proximities, so it is cached as one JSON document and evicted on edit.
 *
 * - The graph cache uses a typed serializer for {@link BeaconGraphSnapshot}; no polymorphic
 *   type info is written.
 * - The manager is transaction-aware: an eviction issued inside a proximity edit only takes
 *   effect after that edit commits, so a search never reloads a half-applied reorder.
 *
 * Active only with {@code spring.cache.type=redis}; tests use an in-memory cache with the same
 * transaction-aware decoration.
 */
@Configuration
@ConditionalOnProperty(prefix = "spring.cache", name = "type", havingValue = "redis")
public class RedisConfig {

    @Bean
    public RedisCacheManager cacheManager(RedisConnectionFactory connectionFactory,
                                          DispatchProperties properties) {
        RedisCacheConfiguration defaults = RedisCacheConfiguration.defaultCacheConfig()
            .entryTtl(properties.graph().cacheTtl())
            .disableCachingNullValues()
            .serializeKeysWith(
                RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer())
            )
            .serializeValuesWith(
                RedisSerializationContext.SerializationPair.fromSerializer(
                    new GenericJackson2JsonRedisSerializer()
                )
            );

        RedisCacheConfiguration graphCache = defaults.serializeValuesWith(
            RedisSerializationContext.SerializationPair.fromSerializer(
                new Jackson2JsonRedisSerializer<>(BeaconGraphSnapshot.class)
            )
        );

        return RedisCacheManager.builder(connectionFactory)
            .cacheDefaults(defaults)
            .withCacheConfiguration(BeaconGraphService.GRAPH_CACHE, graphCache)
            .transactionAware()
            .build();
    }
}
