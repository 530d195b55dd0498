package com.jreinhal.querygate.policy;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What one role may query.
 *
 * @param role                normalized role name
 * @param allowedResourceKeys catalog keys the role may query
 * @param siteScoped          when true, results are restricted to the caller's assigned sites
 */
public record RolePolicy(String role, Set<String> allowedResourceKeys, boolean siteScoped) {
    public RolePolicy {
        allowedResourceKeys = Collections.unmodifiableSet(new LinkedHashSet<>(allowedResourceKeys));
    }
}
