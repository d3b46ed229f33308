package com.bastion.accessservice.domain.idp;

/**
 * How an external identity is linked to an existing user automatically.
 */
public enum AutoLinkingOption {
    /** No automatic linking. */
    UNSPECIFIED,
    USERNAME,
    EMAIL
}
