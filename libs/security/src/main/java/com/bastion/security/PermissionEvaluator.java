package com.bastion.security;

/**
 * Resolves whether a caller may perform an action on a scope.
 *
 * <p>Pure function of (caller, permission, scope): it reads no resource state, so a denial is
 * decided before anything about the target is looked up and behaves the same whether the target
 * exists or not. Stateless and safe to share between threads.
 */
public final class PermissionEvaluator {

    private PermissionEvaluator() {
        // utility class
    }

    /**
     * Returns true if any of the caller's memberships grants the permission and reaches the scope.
     */
    public static boolean isAllowed(CallerContext caller, Permission permission, ResourceScope scope) {
        if (caller == null || caller.tenant() == null || permission == null || scope == null) {
            return false;
        }
        return caller.memberships().stream()
                .anyMatch(m -> m.role().grants(permission) && m.covers(scope, caller.instanceId()));
    }

    /**
     * Verifies the permission, failing fast.
     *
     * @throws PermissionDeniedException if the caller is not allowed
     */
    public static void check(CallerContext caller, Permission permission, ResourceScope scope) {
        if (!isAllowed(caller, permission, scope)) {
            throw new PermissionDeniedException(permission);
        }
    }

    /** Checks if the caller holds the role (directly or via hierarchy) on any scope. */
    public static boolean hasRole(CallerContext caller, Role required) {
        return caller.memberships().stream().anyMatch(m -> m.role().implies(required));
    }
}
