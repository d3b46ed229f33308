package com.bastion.security;

import java.time.Instant;
import java.util.List;

/**
 * Explicit authorization context passed into every command and query.
 *
 * @param user          authenticated caller
 * @param tenant        instance and organization the request is scoped to
 * @param memberships   roles the caller holds and where
 * @param correlationId trace correlation ID for this request
 * @param deadline      instant after which the operation must not commit, {@code null} for none
 */
public record CallerContext(
        AuthenticatedUser user,
        TenantContext tenant,
        List<RoleMembership> memberships,
        String correlationId,
        Instant deadline) {

    public CallerContext {
        memberships = memberships == null ? List.of() : List.copyOf(memberships);
    }

    public String userId() {
        return user.userId();
    }

    public String instanceId() {
        return tenant.instanceId();
    }

    public String organizationId() {
        return tenant.organizationId();
    }

    public CallerContext withDeadline(Instant newDeadline) {
        return new CallerContext(user, tenant, memberships, correlationId, newDeadline);
    }

    /** Whether the deadline, if any, has passed at the given instant. */
    public boolean deadlineExpired(Instant now) {
        return deadline != null && !now.isBefore(deadline);
    }
}
