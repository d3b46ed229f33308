package com.bastion.accessservice.domain.query;

import com.bastion.accessservice.domain.idp.IdentityProviderConfig;

import java.time.Instant;
import java.util.List;

public record IdentityProviderList(List<IdentityProviderConfig> providers, long totalCount,
                                   Instant timestamp) {
}
