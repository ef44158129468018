package com.vantage.security;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authorization check run at the top of every service operation.
 *
 * Services call {@link #check} before touching any loader, store or channel,
 * including on paths that end in an error.
 */
@Component
public class AccessGate {

    private static final Logger log = LoggerFactory.getLogger(AccessGate.class);

    private final MeterRegistry meterRegistry;

    public AccessGate(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * @return the principal, for chaining
     * @throws AuthorizationException if the principal is missing or lacks the permission
     */
    public RequestPrincipal check(RequestPrincipal principal, Permission permission) {
        if (principal == null) {
            deny("unauthenticated");
            log.warn("Rejected unauthenticated request requiring {}", permission);
            throw AuthorizationException.unauthenticated();
        }
        if (!principal.hasPermission(permission)) {
            deny("forbidden");
            log.warn("User {} (tenant {}) lacks permission {}", principal.getUserId(), principal.getTenantId(), permission);
            throw AuthorizationException.forbidden(permission);
        }
        return principal;
    }

    /**
     * Verifies that a principal may act on data owned by {@code tenantId}.
     */
    public void checkTenant(RequestPrincipal principal, String tenantId) {
        if (principal == null) {
            throw AuthorizationException.unauthenticated();
        }
        if (tenantId != null && !tenantId.equals(principal.getTenantId())) {
            deny("cross_tenant");
            log.warn("User {} of tenant {} attempted to access tenant {}",
                    principal.getUserId(), principal.getTenantId(), tenantId);
            throw AuthorizationException.crossTenant(tenantId);
        }
    }

    private void deny(String reason) {
        Counter.builder("vantage.security.denied")
                .description("Requests rejected by the access gate")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }
}
