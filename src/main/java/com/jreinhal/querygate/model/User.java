package com.jreinhal.querygate.model;

import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Document(collection="users")
public class User {
    @Id
    private String id;
    private String username;
    private String displayName;
    private String role;
    @Field("sites")
    private Set<String> siteIds = new LinkedHashSet<String>();
    @Field("companyIdf")
    private String tenantId;
    private boolean active = true;

    /**
     * Caller known only by id, as forwarded by the authentication layer. Role, tenant and sites are filled in later.
     */
    public static User withId(String id) {
        User user = new User();
        user.id = id;
        user.username = id;
        user.displayName = id;
        user.active = true;
        return user;
    }

    public String getId() {
        return this.id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getUsername() {
        return this.username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getDisplayName() {
        return this.displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public String getRole() {
        return this.role;
    }

    public void setRole(String role) {
        this.role = role;
    }

    public Set<String> getSiteIds() {
        return this.siteIds;
    }

    public void setSiteIds(Set<String> siteIds) {
        this.siteIds = siteIds;
    }

    public String getTenantId() {
        return this.tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public boolean isActive() {
        return this.active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean hasRole() {
        return this.role != null && !this.role.isBlank();
    }

    public boolean hasTenant() {
        return this.tenantId != null && !this.tenantId.isBlank();
    }
}
