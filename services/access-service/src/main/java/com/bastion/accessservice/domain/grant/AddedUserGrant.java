package com.bastion.accessservice.domain.grant;

import com.bastion.accessservice.domain.ChangeDetails;

public record AddedUserGrant(String grantId, ChangeDetails details) {
}
