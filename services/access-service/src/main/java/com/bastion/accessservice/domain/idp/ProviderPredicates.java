package com.bastion.accessservice.domain.idp;

import java.util.Optional;

/**
 * Optional restrictions on the active identity providers. A present value keeps only providers
 * whose flag equals it; an empty one does not restrict.
 */
public record ProviderPredicates(
        Optional<Boolean> creationAllowed,
        Optional<Boolean> linkingAllowed,
        Optional<Boolean> autoCreation,
        Optional<Boolean> autoLinking) {

    public ProviderPredicates {
        creationAllowed = creationAllowed == null ? Optional.empty() : creationAllowed;
        linkingAllowed = linkingAllowed == null ? Optional.empty() : linkingAllowed;
        autoCreation = autoCreation == null ? Optional.empty() : autoCreation;
        autoLinking = autoLinking == null ? Optional.empty() : autoLinking;
    }

    public static ProviderPredicates none() {
        return new ProviderPredicates(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public ProviderPredicates withCreationAllowed(boolean value) {
        return new ProviderPredicates(Optional.of(value), linkingAllowed, autoCreation, autoLinking);
    }

    public ProviderPredicates withLinkingAllowed(boolean value) {
        return new ProviderPredicates(creationAllowed, Optional.of(value), autoCreation, autoLinking);
    }

    public ProviderPredicates withAutoCreation(boolean value) {
        return new ProviderPredicates(creationAllowed, linkingAllowed, Optional.of(value), autoLinking);
    }

    public ProviderPredicates withAutoLinking(boolean value) {
        return new ProviderPredicates(creationAllowed, linkingAllowed, autoCreation, Optional.of(value));
    }
}
