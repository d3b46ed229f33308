package com.bastion.accessservice.domain.query;

import com.bastion.accessservice.domain.grant.UserGrant;
import com.bastion.accessservice.domain.grant.UserGrantState;

/**
 * Conjunction of optional criteria for listing user grants. Null fields do not restrict.
 */
public record UserGrantFilter(String userId, String projectId, String projectGrantId, String roleKey,
                              UserGrantState state) {

    public static UserGrantFilter all() {
        return new UserGrantFilter(null, null, null, null, null);
    }

    boolean matches(UserGrant grant) {
        return (userId == null || userId.equals(grant.userId()))
                && (projectId == null || projectId.equals(grant.projectId()))
                && (projectGrantId == null || projectGrantId.equals(grant.projectGrantId()))
                && (roleKey == null || grant.roleKeys().contains(roleKey))
                && (state == null || state == grant.state());
    }
}
