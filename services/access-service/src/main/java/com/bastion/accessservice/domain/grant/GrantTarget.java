package com.bastion.accessservice.domain.grant;

/**
 * What a user grant points at: a project of the caller's own organization, or a project shared
 * with the caller's organization through a project grant.
 */
public sealed interface GrantTarget permits GrantTarget.DirectProject, GrantTarget.ViaProjectGrant {

    record DirectProject(String projectId) implements GrantTarget {
    }

    record ViaProjectGrant(String projectGrantId) implements GrantTarget {
    }

    static GrantTarget project(String projectId) {
        return new DirectProject(projectId);
    }

    static GrantTarget projectGrant(String projectGrantId) {
        return new ViaProjectGrant(projectGrantId);
    }
}
