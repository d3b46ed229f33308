package com.bastion.security;

/**
 * A role held by the caller on one scope of the tenant hierarchy.
 *
 * @param role  the role
 * @param scope where the role was granted
 */
public record RoleMembership(Role role, ResourceScope scope) {

    /**
     * Whether this membership, held by a caller working in {@code callerInstanceId}, reaches the
     * given target scope.
     *
     * <p>An instance membership reaches everything in the caller's instance and nothing when it
     * names another instance. An organization membership reaches every scope living in that
     * organization. Project and project grant memberships only reach the exact project or project
     * grant.
     */
    public boolean covers(ResourceScope target, String callerInstanceId) {
        return switch (scope.type()) {
            case INSTANCE -> scope.id().equals(callerInstanceId)
                    && (target.type() != ScopeType.INSTANCE || scope.id().equals(target.id()));
            case ORGANIZATION -> scope.id().equals(target.organizationId());
            case PROJECT, PROJECT_GRANT ->
                    scope.type() == target.type() && scope.id().equals(target.id());
        };
    }
}
