package com.bastion.accessservice.domain.idp;

import com.bastion.eventmodel.EventType;

import java.util.Map;

/**
 * Payloads written by the identity provider management surface and read by the projections.
 */
public final class IdentityProviderEvents {

    private IdentityProviderEvents() {
        // holder
    }

    public record ConfigAdded(String name, IdentityProviderType type, boolean linkingAllowed,
                              boolean creationAllowed, boolean autoCreation, boolean autoUpdate,
                              AutoLinkingOption autoLinkingOption) {
    }

    public record ConfigRemoved(String name) {
    }

    public record LoginPolicyIdpAdded(String idpId) {
    }

    public record LoginPolicyIdpRemoved(String idpId) {
    }

    public static Map<EventType, Class<?>> payloadTypes() {
        return Map.of(
                EventType.IDP_CONFIG_ADDED, ConfigAdded.class,
                EventType.IDP_CONFIG_REMOVED, ConfigRemoved.class,
                EventType.LOGIN_POLICY_IDP_ADDED, LoginPolicyIdpAdded.class,
                EventType.LOGIN_POLICY_IDP_REMOVED, LoginPolicyIdpRemoved.class);
    }
}
