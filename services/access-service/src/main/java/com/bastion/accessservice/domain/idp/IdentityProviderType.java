package com.bastion.accessservice.domain.idp;

public enum IdentityProviderType {
    OIDC,
    JWT,
    OAUTH,
    LDAP,
    SAML,
    AZURE_AD,
    GITHUB,
    GITLAB,
    GOOGLE,
    APPLE
}
