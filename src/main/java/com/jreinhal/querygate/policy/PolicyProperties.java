package com.jreinhal.querygate.policy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "querygate.policy")
public class PolicyProperties {
    /**
     * Role name to policy. Role names are normalized when the table is built.
     *
     * Example:
     * querygate.policy.roles.store_manager.resources[0]=purchase_orders
     * querygate.policy.roles.store_manager.site-scope=true
     */
    private Map<String, Role> roles = new LinkedHashMap<>();

    public Map<String, Role> getRoles() {
        return roles;
    }

    public void setRoles(Map<String, Role> roles) {
        this.roles = roles;
    }

    public static class Role {
        /**
         * Catalog keys; a single "*" grants every catalog resource.
         */
        private List<String> resources = new ArrayList<>();
        private boolean siteScope = true;

        public List<String> getResources() {
            return resources;
        }

        public void setResources(List<String> resources) {
            this.resources = resources;
        }

        public boolean isSiteScope() {
            return siteScope;
        }

        public void setSiteScope(boolean siteScope) {
            this.siteScope = siteScope;
        }
    }
}
