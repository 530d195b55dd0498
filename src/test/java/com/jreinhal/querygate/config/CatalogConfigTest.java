package com.jreinhal.querygate.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.querygate.catalog.CatalogProperties;
import com.jreinhal.querygate.catalog.FieldType;
import com.jreinhal.querygate.catalog.ResourceCatalog;
import com.jreinhal.querygate.catalog.ResourceDescriptor;
import com.jreinhal.querygate.policy.PolicyProperties;
import com.jreinhal.querygate.policy.RolePolicyTable;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

/**
 * Binds the shipped application.yml the way Spring Boot does at startup.
 */
class CatalogConfigTest {

    private ResourceCatalog catalog;
    private RolePolicyTable policyTable;

    @BeforeEach
    void setUp() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader().load("application", new ClassPathResource("application.yml"));
        Binder binder = new Binder(ConfigurationPropertySources.from(sources));
        CatalogConfig config = new CatalogConfig();
        catalog = config.resourceCatalog(binder.bind("querygate.catalog", CatalogProperties.class).get(), "companyIdf");
        policyTable = config.rolePolicyTable(binder.bind("querygate.policy", PolicyProperties.class).get(), catalog);
    }

    @Test
    @DisplayName("Underscored resource keys survive binding")
    void bindsResources() {
        assertThat(catalog.keys()).contains("purchase_orders", "purchase_requests", "dmr_entries", "debit_notes", "rate_approvals");
        assertThat(catalog.size()).isEqualTo(12);
        ResourceDescriptor debitNotes = catalog.find("debit_notes").orElseThrow();
        assertThat(debitNotes.storeId()).isEqualTo("debitnotes");
        assertThat(debitNotes.tenantField()).isEqualTo("companyIdf");
        assertThat(catalog.find("vendors").orElseThrow().siteScoped()).isFalse();
    }

    @Test
    @DisplayName("Date and id field types bind per resource")
    void bindsFieldTypes() {
        ResourceDescriptor orders = catalog.find("purchase_orders").orElseThrow();
        ResourceDescriptor dmr = catalog.find("dmr_entries").orElseThrow();

        assertThat(orders.fieldType("poDate")).contains(FieldType.DATE);
        assertThat(orders.fieldType("site")).contains(FieldType.OBJECT_ID);
        assertThat(orders.fieldType("status")).isEmpty();
        assertThat(dmr.fieldType("GateEntry_Date")).contains(FieldType.DATE);
        assertThat(catalog.find("inventory").orElseThrow().fieldTypes())
                .containsEntry("item_id", FieldType.OBJECT_ID)
                .containsEntry("site_id", FieldType.OBJECT_ID);
    }

    @Test
    @DisplayName("Role policies bind with normalized names and wildcard expansion")
    void bindsPolicies() {
        assertThat(policyTable.roles()).contains("superadmin", "project_director", "project_manager", "store_manager", "default");
        assertThat(policyTable.resolve("Project Director").allowedResourceKeys()).containsAll(catalog.keys());
        assertThat(policyTable.resolve("superadmin").siteScoped()).isFalse();
        assertThat(policyTable.resolve("store_manager").allowedResourceKeys()).doesNotContain("vendors", "projects");
        assertThat(policyTable.resolve("janitor").allowedResourceKeys()).containsExactly("sites");
    }
}
