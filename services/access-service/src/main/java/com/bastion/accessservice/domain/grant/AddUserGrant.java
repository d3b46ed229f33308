package com.bastion.accessservice.domain.grant;

import java.util.List;

/**
 * Request to grant roles on a project to a user.
 */
public record AddUserGrant(String userId, GrantTarget target, List<String> roleKeys) {
}
