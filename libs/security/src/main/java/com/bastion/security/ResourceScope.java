package com.bastion.security;

/**
 * A node of the tenant hierarchy (instance → organization → project → project grant).
 *
 * <p>{@code organizationId} is the organization the scope lives in: the organization itself, the
 * owner of a project, or the organization a project grant was granted to. It is {@code null} for
 * the instance scope.
 *
 * @param type           level of the scope
 * @param id             identifier of the instance, organization, project or project grant
 * @param organizationId organization the scope belongs to
 */
public record ResourceScope(ScopeType type, String id, String organizationId) {

    public ResourceScope {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
    }

    public static ResourceScope instance(String instanceId) {
        return new ResourceScope(ScopeType.INSTANCE, instanceId, null);
    }

    public static ResourceScope organization(String organizationId) {
        return new ResourceScope(ScopeType.ORGANIZATION, organizationId, organizationId);
    }

    public static ResourceScope project(String organizationId, String projectId) {
        return new ResourceScope(ScopeType.PROJECT, projectId, organizationId);
    }

    public static ResourceScope projectGrant(String organizationId, String projectGrantId) {
        return new ResourceScope(ScopeType.PROJECT_GRANT, projectGrantId, organizationId);
    }
}
