package com.jreinhal.querygate.execution;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to the document store. The seam has no write operation.
 */
public interface ResourceStore {

    /**
     * Returns at most {@code query.limit()} records matching the predicate, each holding only the requested fields
     * (plus the record id).
     */
    List<Map<String, Object>> find(StoreQuery query);
}
