package com.vantage.security;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The authenticated caller of one request: who they are, which tenant they act
 * for and what they may do.
 */
public class RequestPrincipal {

    public static final String CONTEXT_KEY = "vantage.principal";

    private final String userId;
    private final String tenantId;
    private final Set<Permission> permissions;

    public RequestPrincipal(String userId, String tenantId, Set<Permission> permissions) {
        this.userId = userId;
        this.tenantId = tenantId;
        this.permissions = permissions == null || permissions.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(permissions));
    }

    public String getUserId() {
        return userId;
    }

    public String getTenantId() {
        return tenantId;
    }

    public Set<Permission> getPermissions() {
        return permissions;
    }

    public boolean hasPermission(Permission permission) {
        return permissions.contains(permission);
    }

    @Override
    public String toString() {
        return "RequestPrincipal{userId=" + userId + ", tenantId=" + tenantId + "}";
    }
}
