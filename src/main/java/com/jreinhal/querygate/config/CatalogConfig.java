package com.jreinhal.querygate.config;

import com.jreinhal.querygate.catalog.CatalogProperties;
import com.jreinhal.querygate.catalog.ResourceCatalog;
import com.jreinhal.querygate.policy.PolicyProperties;
import com.jreinhal.querygate.policy.RolePolicyTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the resource catalog and role policy table once at startup. Both are immutable afterwards; a broken
 * catalog stops the application from starting.
 */
@Configuration
public class CatalogConfig {
    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public ResourceCatalog resourceCatalog(CatalogProperties properties,
                                           @Value("${querygate.tenant.field:companyIdf}") String tenantField) {
        ResourceCatalog catalog = ResourceCatalog.fromProperties(properties, tenantField);
        log.info("Resource catalog '{}' loaded: {} resources", catalog.version(), catalog.size());
        return catalog;
    }

    @Bean
    public RolePolicyTable rolePolicyTable(PolicyProperties properties, ResourceCatalog resourceCatalog) {
        RolePolicyTable table = RolePolicyTable.fromProperties(properties, resourceCatalog);
        log.info("Role policy table loaded: roles={}", table.roles());
        return table;
    }
}
