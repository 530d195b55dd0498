package com.jreinhal.querygate.query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A query that passed the sanitizer: the resource is permitted, every field path's top-level segment is in
 * the resource's allowlist and the limit lies in [1, max].
 *
 * @param projection fields to return; empty means every allowed field of the resource
 */
public record SanitizedQuery(String resourceKey, FilterNode filter, List<String> projection, int limit) {
    public SanitizedQuery {
        filter = filter == null ? FilterNode.matchAll() : filter;
        projection = List.copyOf(projection);
    }

    /**
     * Re-expresses this query as an intent; sanitizing the result yields an equal query.
     */
    public QueryIntent toIntent() {
        Map<String, Object> projectionMap = new LinkedHashMap<>();
        this.projection.forEach(field -> projectionMap.put(field, 1));
        return new QueryIntent(this.resourceKey, this.filter.isMatchAll() ? Map.of() : this.filter.toMap(),
                projectionMap, this.limit, null);
    }
}
