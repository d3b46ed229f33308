package com.bastion.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Management roles a caller can hold on a scope.
 *
 * <p>Hierarchy:
 * <ul>
 *   <li>IAM_OWNER implies ORG_OWNER, ORG_USER_MANAGER and IAM_OWNER_VIEWER</li>
 *   <li>ORG_OWNER implies ORG_USER_MANAGER</li>
 *   <li>All others imply nothing</li>
 * </ul>
 *
 * <p>LOGIN_CLIENT is the role of the hosted login application. It carries no management
 * permissions.
 */
public enum Role {

    IAM_OWNER("IAM_OWNER", EnumSet.of(Permission.IAM_POLICY_READ, Permission.IAM_POLICY_WRITE)),
    IAM_OWNER_VIEWER("IAM_OWNER_VIEWER", EnumSet.of(
            Permission.IAM_POLICY_READ, Permission.POLICY_READ, Permission.USER_GRANT_READ)),
    ORG_OWNER("ORG_OWNER", EnumSet.of(Permission.POLICY_READ)),
    ORG_USER_MANAGER("ORG_USER_MANAGER", EnumSet.of(
            Permission.USER_GRANT_READ, Permission.USER_GRANT_WRITE, Permission.USER_GRANT_DELETE)),
    PROJECT_OWNER("PROJECT_OWNER", EnumSet.of(
            Permission.USER_GRANT_READ, Permission.USER_GRANT_WRITE, Permission.USER_GRANT_DELETE)),
    PROJECT_GRANT_OWNER("PROJECT_GRANT_OWNER", EnumSet.of(
            Permission.USER_GRANT_READ, Permission.USER_GRANT_WRITE, Permission.USER_GRANT_DELETE)),
    LOGIN_CLIENT("IAM_LOGIN_CLIENT", EnumSet.noneOf(Permission.class));

    private final String value;
    private final Set<Permission> ownPermissions;

    Role(String value, Set<Permission> ownPermissions) {
        this.value = value;
        this.ownPermissions = ownPermissions;
    }

    /** The canonical string representation (e.g., "ORG_OWNER"). */
    public String value() {
        return value;
    }

    /** Returns the set of roles that this role implies (inherits). */
    public Set<Role> impliedRoles() {
        return switch (this) {
            case IAM_OWNER -> EnumSet.of(ORG_OWNER, ORG_USER_MANAGER, IAM_OWNER_VIEWER);
            case ORG_OWNER -> EnumSet.of(ORG_USER_MANAGER);
            default -> EnumSet.noneOf(Role.class);
        };
    }

    /** Checks whether this role implies the given role (directly or through the hierarchy). */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /** Permissions of this role including those of every implied role. */
    public Set<Permission> permissions() {
        EnumSet<Permission> all = EnumSet.noneOf(Permission.class);
        all.addAll(ownPermissions);
        for (Role implied : impliedRoles()) {
            all.addAll(implied.ownPermissions);
        }
        return all;
    }

    public boolean grants(Permission permission) {
        return permissions().contains(permission);
    }

    /**
     * Looks up a Role by its canonical string value (e.g., "ORG_OWNER").
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        for (Role role : values()) {
            if (role.value.equals(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
