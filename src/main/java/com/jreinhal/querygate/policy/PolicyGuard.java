package com.jreinhal.querygate.policy;

import com.jreinhal.querygate.catalog.FieldType;
import com.jreinhal.querygate.catalog.ResourceCatalog;
import com.jreinhal.querygate.catalog.ResourceDescriptor;
import com.jreinhal.querygate.model.UserContext;
import com.jreinhal.querygate.query.FilterNode;
import com.jreinhal.querygate.query.FilterOperator;
import com.jreinhal.querygate.query.OpaqueId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines the role policy table with a caller's context. Pure: the same role and context always
 * produce the same result, and nothing is cached between requests.
 */
@Component
public class PolicyGuard {
    private static final Logger log = LoggerFactory.getLogger(PolicyGuard.class);
    private final ResourceCatalog catalog;
    private final RolePolicyTable policyTable;

    public PolicyGuard(ResourceCatalog catalog, RolePolicyTable policyTable) {
        this.catalog = catalog;
        this.policyTable = policyTable;
    }

    public GuardResult resolveGuard(String role, UserContext userContext) {
        RolePolicy policy = this.policyTable.resolve(role);
        Map<String, Set<String>> fieldsByResource = new LinkedHashMap<>();
        Map<String, Map<String, FieldType>> typesByResource = new LinkedHashMap<>();
        List<ResourceMenuEntry> menu = new ArrayList<>();
        for (String key : policy.allowedResourceKeys()) {
            Optional<ResourceDescriptor> descriptor = this.catalog.find(key);
            // A policy naming a retired resource grants nothing for it.
            if (descriptor.isEmpty()) {
                continue;
            }
            ResourceDescriptor resource = descriptor.get();
            fieldsByResource.put(key, resource.allowedFields());
            typesByResource.put(key, resource.fieldTypes());
            menu.add(new ResourceMenuEntry(key, resource.description(), new ArrayList<>(resource.allowedFields()),
                    resource.fieldTypes()));
        }
        Set<String> scopeValues = userContext == null ? Set.of() : userContext.scopeValues();
        boolean siteScoped = policy.siteScoped();
        return new GuardResult(policy.role(), fieldsByResource, typesByResource, menu,
                resourceKey -> this.buildScopeFilter(siteScoped, scopeValues, resourceKey));
    }

    FilterNode buildScopeFilter(boolean siteScoped, Set<String> scopeValues, String resourceKey) {
        if (!siteScoped || scopeValues.isEmpty()) {
            return FilterNode.matchAll();
        }
        Optional<ResourceDescriptor> descriptor = this.catalog.find(resourceKey);
        if (descriptor.isEmpty()) {
            return FilterNode.matchNone();
        }
        ResourceDescriptor resource = descriptor.get();
        if (!resource.siteScoped()) {
            return FilterNode.matchAll();
        }
        Optional<String> scopeField = resource.scopeFieldName();
        if (scopeField.isEmpty()) {
            log.warn("Resource '{}' requires site scope but declares no scope field; matching nothing", resourceKey);
            return FilterNode.matchNone();
        }
        List<OpaqueId> ids = scopeValues.stream().map(OpaqueId::new).toList();
        return new FilterNode.FieldMatch(scopeField.get(), FilterOperator.IN, ids);
    }
}
