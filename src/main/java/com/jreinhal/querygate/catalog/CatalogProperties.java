package com.jreinhal.querygate.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "querygate.catalog")
public class CatalogProperties {
    /**
     * Version label of the catalog data, reported by the health endpoint and startup log.
     */
    private String version = "unversioned";

    /**
     * Queryable resources keyed by logical resource key.
     *
     * Example:
     * querygate.catalog.resources.purchase_orders.store-id=purchase_orders
     * querygate.catalog.resources.purchase_orders.fields[0]=po_number
     */
    private Map<String, Resource> resources = new LinkedHashMap<>();

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public Map<String, Resource> getResources() {
        return resources;
    }

    public void setResources(Map<String, Resource> resources) {
        this.resources = resources;
    }

    public static class Resource {
        private String storeId;
        private String description;
        private List<String> fields = new ArrayList<>();
        /**
         * Field referencing the site; {@code _id} for the sites collection itself.
         */
        private String scopeField;
        /**
         * Set to false for master data shared across all sites of a tenant.
         */
        private boolean siteScoped = true;
        /**
         * Overrides querygate.tenant.field for this resource.
         */
        private String tenantField;
        /**
         * Fields stored as BSON dates. Dotted paths address nested fields.
         */
        private List<String> dateFields = new ArrayList<>();
        /**
         * Fields stored as ObjectId references.
         */
        private List<String> idFields = new ArrayList<>();

        public String getStoreId() {
            return storeId;
        }

        public void setStoreId(String storeId) {
            this.storeId = storeId;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public List<String> getFields() {
            return fields;
        }

        public void setFields(List<String> fields) {
            this.fields = fields;
        }

        public String getScopeField() {
            return scopeField;
        }

        public void setScopeField(String scopeField) {
            this.scopeField = scopeField;
        }

        public boolean isSiteScoped() {
            return siteScoped;
        }

        public void setSiteScoped(boolean siteScoped) {
            this.siteScoped = siteScoped;
        }

        public String getTenantField() {
            return tenantField;
        }

        public void setTenantField(String tenantField) {
            this.tenantField = tenantField;
        }

        public List<String> getDateFields() {
            return dateFields;
        }

        public void setDateFields(List<String> dateFields) {
            this.dateFields = dateFields;
        }

        public List<String> getIdFields() {
            return idFields;
        }

        public void setIdFields(List<String> idFields) {
            this.idFields = idFields;
        }
    }
}
