package com.jreinhal.querygate.catalog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable registry of queryable resources. Built once at startup and shared by every request thread.
 */
public final class ResourceCatalog {
    private final String version;
    private final Map<String, ResourceDescriptor> resources;

    public ResourceCatalog(String version, Collection<ResourceDescriptor> descriptors) {
        LinkedHashMap<String, ResourceDescriptor> byKey = new LinkedHashMap<>();
        for (ResourceDescriptor descriptor : descriptors) {
            validate(descriptor);
            if (byKey.putIfAbsent(descriptor.key(), descriptor) != null) {
                throw new IllegalStateException("Duplicate resource key in catalog: " + descriptor.key());
            }
        }
        this.version = version == null || version.isBlank() ? "unversioned" : version.trim();
        this.resources = Collections.unmodifiableMap(byKey);
    }

    public static ResourceCatalog fromProperties(CatalogProperties properties, String defaultTenantField) {
        List<ResourceDescriptor> descriptors = new ArrayList<>();
        properties.getResources().forEach((rawKey, resource) -> {
            String key = rawKey == null ? "" : rawKey.trim().toLowerCase(Locale.ROOT);
            String tenantField = resource.getTenantField() == null || resource.getTenantField().isBlank()
                    ? defaultTenantField
                    : resource.getTenantField().trim();
            descriptors.add(new ResourceDescriptor(key,
                    resource.getStoreId() == null ? null : resource.getStoreId().trim(),
                    resource.getFields() == null ? Set.of() : trimmed(resource.getFields()),
                    resource.getDescription(),
                    resource.getScopeField() == null ? null : resource.getScopeField().trim(),
                    resource.isSiteScoped(),
                    tenantField,
                    fieldTypes(key, resource)));
        });
        return new ResourceCatalog(properties.getVersion(), descriptors);
    }

    public String version() {
        return this.version;
    }

    public Optional<ResourceDescriptor> find(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(this.resources.get(key));
    }

    public boolean contains(String key) {
        return key != null && this.resources.containsKey(key);
    }

    public Set<String> keys() {
        return this.resources.keySet();
    }

    public int size() {
        return this.resources.size();
    }

    private static Map<String, FieldType> fieldTypes(String key, CatalogProperties.Resource resource) {
        Map<String, FieldType> types = new LinkedHashMap<>();
        if (resource.getDateFields() != null) {
            for (String field : trimmed(resource.getDateFields())) {
                types.put(field, FieldType.DATE);
            }
        }
        if (resource.getIdFields() != null) {
            for (String field : trimmed(resource.getIdFields())) {
                if (types.put(field, FieldType.OBJECT_ID) != null) {
                    throw new IllegalStateException("Catalog resource '" + key + "' types field '" + field + "' twice");
                }
            }
        }
        return types;
    }

    private static Set<String> trimmed(List<String> fields) {
        Set<String> out = new LinkedHashSet<>();
        for (String field : fields) {
            if (field != null && !field.isBlank()) {
                out.add(field.trim());
            }
        }
        return out;
    }

    private static void validate(ResourceDescriptor descriptor) {
        if (descriptor.key() == null || descriptor.key().isBlank()) {
            throw new IllegalStateException("Catalog resource without a key");
        }
        if (descriptor.storeId() == null || descriptor.storeId().isBlank()) {
            throw new IllegalStateException("Catalog resource '" + descriptor.key() + "' has no store-id");
        }
        if (descriptor.allowedFields().isEmpty()) {
            throw new IllegalStateException("Catalog resource '" + descriptor.key() + "' has no fields");
        }
        if (descriptor.tenantField() == null || descriptor.tenantField().isBlank()) {
            throw new IllegalStateException("Catalog resource '" + descriptor.key() + "' has no tenant field");
        }
        for (String field : descriptor.allowedFields()) {
            // Operator-shaped names would let a filter key masquerade as a field.
            if (field.startsWith("$") || field.indexOf('\0') >= 0) {
                throw new IllegalStateException("Catalog resource '" + descriptor.key() + "' has illegal field name");
            }
        }
        for (String path : descriptor.fieldTypes().keySet()) {
            String top = path.split("\\.", 2)[0];
            if (!descriptor.allowedFields().contains(top) && !"_id".equals(top)) {
                throw new IllegalStateException("Catalog resource '" + descriptor.key()
                        + "' types field '" + path + "' that is not in its field list");
            }
        }
    }
}
