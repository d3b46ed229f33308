package com.bastion.security;

/** Levels of the tenant hierarchy a permission can be granted on or checked against. */
public enum ScopeType {
    INSTANCE,
    ORGANIZATION,
    PROJECT,
    PROJECT_GRANT
}
