package com.bastion.security;

/**
 * Compares the caller's tenant scope with the owner of a resource.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /** Whether the resource lives in the instance the caller belongs to. */
    public static boolean inCallerInstance(CallerContext caller, String resourceInstanceId) {
        return caller.instanceId().equals(resourceInstanceId);
    }

    /** Whether the resource owner is the organization the caller's request is scoped to. */
    public static boolean ownedByCallerOrganization(CallerContext caller, String resourceOwner) {
        return caller.organizationId().equals(resourceOwner);
    }
}
