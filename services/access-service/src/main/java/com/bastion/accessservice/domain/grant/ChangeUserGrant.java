package com.bastion.accessservice.domain.grant;

import java.util.List;
import java.util.OptionalLong;

/**
 * Request to replace the role keys of a grant.
 *
 * @param expectedSequence when present, the change is rejected unless the grant is still at it
 */
public record ChangeUserGrant(String grantId, List<String> roleKeys, OptionalLong expectedSequence) {

    public ChangeUserGrant {
        expectedSequence = expectedSequence == null ? OptionalLong.empty() : expectedSequence;
    }

    public static ChangeUserGrant of(String grantId, List<String> roleKeys) {
        return new ChangeUserGrant(grantId, roleKeys, OptionalLong.empty());
    }
}
