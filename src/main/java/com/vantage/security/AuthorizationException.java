package com.vantage.security;

/**
 * The caller is not authenticated or lacks a permission.
 *
 * Raised before any read or write begins; never degraded into a partial result.
 */
public class AuthorizationException extends RuntimeException {

    public enum Reason {
        UNAUTHENTICATED,
        FORBIDDEN
    }

    private final Reason reason;
    private final Permission permission;

    private AuthorizationException(String message, Reason reason, Permission permission) {
        super(message);
        this.reason = reason;
        this.permission = permission;
    }

    public static AuthorizationException unauthenticated() {
        return new AuthorizationException("Authentication is required", Reason.UNAUTHENTICATED, null);
    }

    public static AuthorizationException forbidden(Permission permission) {
        return new AuthorizationException("Missing permission " + permission, Reason.FORBIDDEN, permission);
    }

    public static AuthorizationException crossTenant(String tenantId) {
        return new AuthorizationException("Access to tenant " + tenantId + " is not allowed", Reason.FORBIDDEN, null);
    }

    public Reason getReason() {
        return reason;
    }

    public Permission getPermission() {
        return permission;
    }
}
