package com.jreinhal.querygate.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.jreinhal.querygate.execution.ExecutionResult;
import com.jreinhal.querygate.model.UserContext;
import com.jreinhal.querygate.query.SanitizedQuery;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Optional short-lived cache of successful reads. Keys carry everything that changes what a caller may see,
 * and never the question text.
 */
@Component
public class ResultCache {
    private final Cache<CacheKey, ExecutionResult> cache;
    private final boolean enabled;

    public record CacheKey(String tenantId, String role, List<String> scopeValues, SanitizedQuery query) {
        public CacheKey {
            scopeValues = List.copyOf(scopeValues);
        }
    }

    public ResultCache(@Qualifier("queryResultCache") Cache<CacheKey, ExecutionResult> cache,
                       @Value("${querygate.cache.enabled:false}") boolean enabled) {
        this.cache = cache;
        this.enabled = enabled;
    }

    public static CacheKey keyFor(UserContext context, String normalizedRole, SanitizedQuery query) {
        return new CacheKey(context.tenantId(), normalizedRole, List.copyOf(new TreeSet<>(context.scopeValues())), query);
    }

    public Optional<ExecutionResult> get(CacheKey key) {
        if (!this.enabled) {
            return Optional.empty();
        }
        return Optional.ofNullable(this.cache.getIfPresent(key));
    }

    public void put(CacheKey key, ExecutionResult result) {
        if (this.enabled && result != null && !result.isFailed()) {
            this.cache.put(key, result);
        }
    }

    public boolean isEnabled() {
        return this.enabled;
    }
}
