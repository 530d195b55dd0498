package com.jreinhal.querygate.query;

import java.util.Map;

/**
 * Structured query proposed by the intent translator. Every component is untrusted: the filter and
 * projection are raw JSON-shaped maps and the limit is whatever JSON value the translator produced.
 *
 * @param resourceKey   requested resource, unvalidated
 * @param filter        operator-keyed predicate map (keys starting with {@code $} are operators)
 * @param projection    field to include-marker map
 * @param limit         requested result cap, possibly non-numeric
 * @param clarification question to hand back to the user instead of querying
 */
public record QueryIntent(
    String resourceKey,
    Map<String, Object> filter,
    Map<String, Object> projection,
    Object limit,
    String clarification
) {
    public static QueryIntent clarify(String clarification) {
        return new QueryIntent(null, null, null, null, clarification);
    }

    public boolean hasClarification() {
        return this.clarification != null && !this.clarification.isBlank();
    }

    public boolean isEmpty() {
        return (this.resourceKey == null || this.resourceKey.isBlank())
                && (this.filter == null || this.filter.isEmpty())
                && (this.projection == null || this.projection.isEmpty())
                && this.limit == null
                && !this.hasClarification();
    }
}
