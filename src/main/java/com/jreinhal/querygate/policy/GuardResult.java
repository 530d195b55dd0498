package com.jreinhal.querygate.policy;

import com.jreinhal.querygate.catalog.FieldType;
import com.jreinhal.querygate.query.FilterNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * What one caller may touch for the duration of a request: resources, fields per resource and the
 * site-scope predicate for each resource.
 */
public final class GuardResult {
    private final String role;
    private final Set<String> allowedResourceKeys;
    private final Map<String, Set<String>> allowedFieldsByResource;
    private final Map<String, Map<String, FieldType>> fieldTypesByResource;
    private final List<ResourceMenuEntry> menu;
    private final Function<String, FilterNode> scopeFilterFn;

    public GuardResult(String role, Map<String, Set<String>> allowedFieldsByResource, List<ResourceMenuEntry> menu,
                       Function<String, FilterNode> scopeFilterFn) {
        this(role, allowedFieldsByResource, Map.of(), menu, scopeFilterFn);
    }

    public GuardResult(String role, Map<String, Set<String>> allowedFieldsByResource,
                       Map<String, Map<String, FieldType>> fieldTypesByResource, List<ResourceMenuEntry> menu,
                       Function<String, FilterNode> scopeFilterFn) {
        LinkedHashMap<String, Set<String>> fields = new LinkedHashMap<>();
        allowedFieldsByResource.forEach((key, value) -> fields.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(value))));
        this.role = role;
        this.allowedFieldsByResource = Collections.unmodifiableMap(fields);
        this.allowedResourceKeys = this.allowedFieldsByResource.keySet();
        LinkedHashMap<String, Map<String, FieldType>> types = new LinkedHashMap<>();
        fieldTypesByResource.forEach((key, value) -> types.put(key, Map.copyOf(value)));
        this.fieldTypesByResource = Collections.unmodifiableMap(types);
        this.menu = List.copyOf(menu);
        this.scopeFilterFn = scopeFilterFn;
    }

    public String role() {
        return this.role;
    }

    public Set<String> allowedResourceKeys() {
        return this.allowedResourceKeys;
    }

    public Map<String, Set<String>> allowedFieldsByResource() {
        return this.allowedFieldsByResource;
    }

    public Set<String> allowedFieldsFor(String resourceKey) {
        Set<String> fields = resourceKey == null ? null : this.allowedFieldsByResource.get(resourceKey);
        return fields != null ? fields : Set.of();
    }

    /**
     * Storage types of the resource's typed fields, keyed by field path.
     */
    public Map<String, FieldType> fieldTypesFor(String resourceKey) {
        Map<String, FieldType> types = resourceKey == null ? null : this.fieldTypesByResource.get(resourceKey);
        return types != null ? types : Map.of();
    }

    public boolean allowsResource(String resourceKey) {
        return resourceKey != null && this.allowedResourceKeys.contains(resourceKey);
    }

    public boolean hasResources() {
        return !this.allowedResourceKeys.isEmpty();
    }

    public List<ResourceMenuEntry> menu() {
        return this.menu;
    }

    /**
     * Site-scope predicate for the resource. Tenant isolation is not part of it; the executor adds that.
     */
    public FilterNode scopeFilterFor(String resourceKey) {
        return this.scopeFilterFn.apply(resourceKey);
    }
}
