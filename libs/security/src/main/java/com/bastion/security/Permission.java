package com.bastion.security;

import java.util.Optional;

/** Actions guarded by the {@link PermissionEvaluator}. */
public enum Permission {

    IAM_POLICY_READ("iam.policy.read"),
    IAM_POLICY_WRITE("iam.policy.write"),
    POLICY_READ("policy.read"),
    USER_GRANT_READ("user.grant.read"),
    USER_GRANT_WRITE("user.grant.write"),
    USER_GRANT_DELETE("user.grant.delete");

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "user.grant.write"). */
    public String value() {
        return value;
    }

    public static Optional<Permission> fromString(String value) {
        for (Permission permission : values()) {
            if (permission.value.equals(value)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }
}
