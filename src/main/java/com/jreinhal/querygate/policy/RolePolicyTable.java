package com.jreinhal.querygate.policy;

import com.jreinhal.querygate.catalog.ResourceCatalog;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable role to policy lookup. Always holds a {@code default} policy used for any role without an entry.
 */
public final class RolePolicyTable {
    private static final Logger log = LoggerFactory.getLogger(RolePolicyTable.class);
    public static final String ALL_RESOURCES = "*";
    static final RolePolicy BUILT_IN_DEFAULT = new RolePolicy(RoleNames.DEFAULT_ROLE, Set.of("sites"), true);

    private final Map<String, RolePolicy> policies;

    public RolePolicyTable(Collection<RolePolicy> policies) {
        LinkedHashMap<String, RolePolicy> byRole = new LinkedHashMap<>();
        for (RolePolicy policy : policies) {
            String normalized = RoleNames.normalize(policy.role());
            if (normalized.isEmpty()) {
                throw new IllegalStateException("Role policy without a role name");
            }
            RolePolicy stored = new RolePolicy(normalized, policy.allowedResourceKeys(), policy.siteScoped());
            if (byRole.putIfAbsent(normalized, stored) != null) {
                throw new IllegalStateException("Duplicate role policy after normalization: " + normalized);
            }
        }
        if (!byRole.containsKey(RoleNames.DEFAULT_ROLE)) {
            log.warn("No '{}' role policy configured; installing built-in default (sites only, site-scoped)", RoleNames.DEFAULT_ROLE);
            byRole.put(RoleNames.DEFAULT_ROLE, BUILT_IN_DEFAULT);
        }
        this.policies = Collections.unmodifiableMap(byRole);
    }

    public static RolePolicyTable fromProperties(PolicyProperties properties, ResourceCatalog catalog) {
        LinkedHashMap<String, RolePolicy> built = new LinkedHashMap<>();
        properties.getRoles().forEach((role, config) -> {
            Set<String> keys = new LinkedHashSet<>();
            for (String raw : config.getResources()) {
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                String key = raw.trim().toLowerCase(Locale.ROOT);
                if (ALL_RESOURCES.equals(key)) {
                    keys.addAll(catalog.keys());
                } else {
                    if (!catalog.contains(key)) {
                        log.warn("Role '{}' references unknown resource '{}'; it will never be granted", role, key);
                    }
                    keys.add(key);
                }
            }
            built.put(role, new RolePolicy(role, keys, config.isSiteScope()));
        });
        return new RolePolicyTable(built.values());
    }

    /**
     * Policy for the role, or the default policy when the normalized role has no entry. Never fails.
     */
    public RolePolicy resolve(String role) {
        RolePolicy policy = this.policies.get(RoleNames.normalize(role));
        return policy != null ? policy : this.policies.get(RoleNames.DEFAULT_ROLE);
    }

    public RolePolicy defaultPolicy() {
        return this.policies.get(RoleNames.DEFAULT_ROLE);
    }

    public Set<String> roles() {
        return this.policies.keySet();
    }
}
