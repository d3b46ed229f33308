package com.bastion.accessservice.domain.idp;

import java.util.List;
import java.util.Optional;

/**
 * Selects the identity providers usable for login.
 */
public final class IdentityProviderActivationFilter {

    private IdentityProviderActivationFilter() {
        // utility class
    }

    /**
     * Keeps active providers matching every supplied predicate, in their original order.
     */
    public static List<IdentityProviderConfig> filter(List<IdentityProviderConfig> configs,
                                                      ProviderPredicates predicates) {
        return configs.stream()
                .filter(IdentityProviderConfig::active)
                .filter(c -> matches(predicates.creationAllowed(), c.creationAllowed()))
                .filter(c -> matches(predicates.linkingAllowed(), c.linkingAllowed()))
                .filter(c -> matches(predicates.autoCreation(), c.autoCreation()))
                .filter(c -> matches(predicates.autoLinking(), c.autoLinking()))
                .toList();
    }

    private static boolean matches(Optional<Boolean> predicate, boolean flag) {
        return predicate.map(expected -> expected == flag).orElse(true);
    }
}
