package com.jreinhal.querygate.execution;

import com.jreinhal.querygate.query.FilterNode;
import java.time.Duration;
import java.util.List;

/**
 * Fully resolved read: the predicate already carries the tenant and scope constraints.
 */
public record StoreQuery(String storeId, FilterNode predicate, List<String> fields, int limit, Duration timeout) {
    public StoreQuery {
        fields = List.copyOf(fields);
    }
}
