package com.jreinhal.querygate.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-request identity as the query pipeline sees it. Built from trusted authentication data, never persisted.
 *
 * @param callerId    opaque caller id, used for logging only
 * @param tenantId    tenant every query is confined to; blank means no query may run
 * @param role        role name as supplied (normalized later by the policy table)
 * @param scopeValues assigned site ids
 */
public record UserContext(String callerId, String tenantId, String role, Set<String> scopeValues) {
    public UserContext {
        Set<String> copy = new LinkedHashSet<>();
        if (scopeValues != null) {
            for (String value : scopeValues) {
                if (value != null && !value.isBlank()) {
                    copy.add(value.trim());
                }
            }
        }
        scopeValues = Collections.unmodifiableSet(copy);
        tenantId = tenantId == null || tenantId.isBlank() ? null : tenantId.trim();
    }

    public boolean hasTenant() {
        return this.tenantId != null;
    }
}
