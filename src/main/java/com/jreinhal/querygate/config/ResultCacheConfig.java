package com.jreinhal.querygate.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.querygate.execution.ExecutionResult;
import com.jreinhal.querygate.service.ResultCache;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResultCacheConfig {
    @Bean
    public Cache<ResultCache.CacheKey, ExecutionResult> queryResultCache(
            @Value("${querygate.cache.max-entries:500}") long maxEntries,
            @Value("${querygate.cache.ttl-seconds:60}") long ttlSeconds) {
        return Caffeine.newBuilder()
            .maximumSize(Math.max(1L, maxEntries))
            .expireAfterWrite(Duration.ofSeconds(Math.max(1L, ttlSeconds)))
            .build();
    }
}
