package com.jreinhal.querygate.execution;

import com.jreinhal.querygate.catalog.ResourceCatalog;
import com.jreinhal.querygate.catalog.ResourceDescriptor;
import com.jreinhal.querygate.query.FilterNode;
import com.jreinhal.querygate.query.FilterOperator;
import com.jreinhal.querygate.query.OpaqueId;
import com.jreinhal.querygate.query.SanitizedQuery;
import com.jreinhal.querygate.util.LogSanitizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs one sanitized query against the store under the caller's tenant and scope constraints.
 *
 * <p>The fetch runs on the bounded {@code queryExecutor} pool while the calling thread waits at most the
 * configured timeout. Failures are reported as an {@link ExecutionError} kind; nothing is retried.</p>
 */
@Service
public class QueryExecutor {
    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);
    private final ResourceCatalog catalog;
    private final ResourceStore store;
    private final ExecutorService queryExecutor;
    private final long timeoutMs;

    public QueryExecutor(ResourceCatalog catalog, ResourceStore store,
                         @Qualifier("queryExecutor") ExecutorService queryExecutor,
                         @Value("${querygate.query.timeout-ms:15000}") long timeoutMs) {
        this.catalog = catalog;
        this.store = store;
        this.queryExecutor = queryExecutor;
        this.timeoutMs = Math.max(1L, timeoutMs);
    }

    /**
     * @param scopeFilter site-scope predicate from the guard; null is treated as matching nothing
     * @param tenantId    tenant the read is confined to; blank refuses the read without touching the store
     */
    public ExecutionResult execute(SanitizedQuery query, FilterNode scopeFilter, String tenantId) {
        Optional<ResourceDescriptor> descriptor = query == null ? Optional.empty() : this.catalog.find(query.resourceKey());
        if (descriptor.isEmpty()) {
            log.warn("Query refused: {}", ExecutionError.INVALID_RESOURCE);
            return ExecutionResult.failed(ExecutionError.INVALID_RESOURCE);
        }
        ResourceDescriptor resource = descriptor.get();
        if (tenantId == null || tenantId.isBlank()) {
            log.warn("Query on '{}' refused: {}", resource.key(), ExecutionError.MISSING_TENANT);
            return ExecutionResult.failed(ExecutionError.MISSING_TENANT);
        }
        StoreQuery storeQuery = this.buildStoreQuery(resource, query, scopeFilter, tenantId.trim());
        Future<List<Map<String, Object>>> future;
        try {
            future = this.queryExecutor.submit(() -> this.store.find(storeQuery));
        }
        catch (RejectedExecutionException e) {
            return this.failure(resource, ExecutionError.OVERLOADED);
        }
        List<Map<String, Object>> records;
        try {
            records = future.get(this.timeoutMs, TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            return this.failure(resource, ExecutionError.TIMEOUT);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return this.failure(resource, ExecutionError.CANCELLED);
        }
        catch (CancellationException e) {
            return this.failure(resource, ExecutionError.CANCELLED);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Store read on '{}' failed: {}", resource.key(), cause.getClass().getSimpleName());
            return ExecutionResult.failed(ExecutionError.STORE_FAILURE);
        }
        if (records == null) {
            return ExecutionResult.of(List.of());
        }
        return ExecutionResult.of(records.size() > storeQuery.limit() ? new ArrayList<>(records.subList(0, storeQuery.limit())) : records);
    }

    StoreQuery buildStoreQuery(ResourceDescriptor resource, SanitizedQuery query, FilterNode scopeFilter, String tenantId) {
        FilterNode scope = scopeFilter != null ? scopeFilter : FilterNode.matchNone();
        FilterNode tenant = new FilterNode.FieldMatch(resource.tenantField(), FilterOperator.EQ, new OpaqueId(tenantId));
        FilterNode predicate = FilterNode.allOf(query.filter(), scope, tenant);
        List<String> fields = query.projection().isEmpty() ? new ArrayList<>(resource.allowedFields()) : query.projection();
        return new StoreQuery(resource.storeId(), predicate, fields, query.limit(), Duration.ofMillis(this.timeoutMs));
    }

    private ExecutionResult failure(ResourceDescriptor resource, ExecutionError error) {
        log.warn("Query on '{}' failed: {}", LogSanitizer.sanitize(resource.key()), error);
        return ExecutionResult.failed(error);
    }
}
