package com.bastion.accessservice.domain.grant;

import java.time.Instant;
import java.util.List;

/**
 * Read view of a user grant.
 *
 * @param projectGrantId set only for grants made through a project grant
 */
public record UserGrant(
        String id,
        String instanceId,
        String userId,
        String projectId,
        String projectGrantId,
        List<String> roleKeys,
        UserGrantState state,
        String resourceOwner,
        long sequence,
        Instant creationDate,
        Instant changeDate) {

    public UserGrant {
        roleKeys = List.copyOf(roleKeys);
    }

    public UserGrant withChange(List<String> newRoleKeys, UserGrantState newState, long newSequence,
                                Instant newChangeDate) {
        return new UserGrant(id, instanceId, userId, projectId, projectGrantId, newRoleKeys, newState,
                resourceOwner, newSequence, creationDate, newChangeDate);
    }
}
