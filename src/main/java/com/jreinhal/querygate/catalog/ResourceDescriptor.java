package com.jreinhal.querygate.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One queryable resource: a logical key, the collection behind it and the fields a query may touch.
 *
 * @param key           unique, lower-case resource key (e.g. {@code purchase_orders})
 * @param storeId       backing collection name
 * @param allowedFields ordered allowlist of top-level field names
 * @param description   human description shown to the translator
 * @param scopeField    field holding the site reference, if the resource has one
 * @param siteScoped    false for tenant-wide master data that is never restricted by site
 * @param tenantField   field holding the tenant reference
 * @param fieldTypes    storage type per field path; fields not listed are compared as written
 */
public record ResourceDescriptor(
    String key,
    String storeId,
    Set<String> allowedFields,
    String description,
    String scopeField,
    boolean siteScoped,
    String tenantField,
    Map<String, FieldType> fieldTypes
) {
    public ResourceDescriptor {
        allowedFields = Collections.unmodifiableSet(new LinkedHashSet<>(allowedFields));
        description = description == null ? "" : description;
        fieldTypes = fieldTypes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fieldTypes));
    }

    public ResourceDescriptor(String key, String storeId, Set<String> allowedFields, String description,
                              String scopeField, boolean siteScoped, String tenantField) {
        this(key, storeId, allowedFields, description, scopeField, siteScoped, tenantField, Map.of());
    }

    public Optional<FieldType> fieldType(String path) {
        return path == null ? Optional.empty() : Optional.ofNullable(fieldTypes.get(path));
    }

    public Optional<String> scopeFieldName() {
        return scopeField == null || scopeField.isBlank() ? Optional.empty() : Optional.of(scopeField);
    }
}
