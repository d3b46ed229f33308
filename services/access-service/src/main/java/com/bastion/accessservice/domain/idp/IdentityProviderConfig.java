package com.bastion.accessservice.domain.idp;

/**
 * An externally configured identity provider as seen by the login.
 *
 * @param active whether the provider is attached to the login policy
 */
public record IdentityProviderConfig(
        String id,
        String name,
        IdentityProviderType type,
        boolean active,
        boolean linkingAllowed,
        boolean creationAllowed,
        boolean autoCreation,
        boolean autoUpdate,
        AutoLinkingOption autoLinkingOption) {

    public IdentityProviderConfig {
        autoLinkingOption = autoLinkingOption == null ? AutoLinkingOption.UNSPECIFIED : autoLinkingOption;
    }

    /** Whether any automatic linking option is configured. */
    public boolean autoLinking() {
        return autoLinkingOption != AutoLinkingOption.UNSPECIFIED;
    }

    public IdentityProviderConfig withActive(boolean newActive) {
        return new IdentityProviderConfig(id, name, type, newActive, linkingAllowed, creationAllowed,
                autoCreation, autoUpdate, autoLinkingOption);
    }
}
