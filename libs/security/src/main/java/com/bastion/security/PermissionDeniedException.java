package com.bastion.security;

/**
 * Thrown when the caller lacks the permission for an action on a scope.
 *
 * <p>The message names the permission only. It never reveals whether the targeted resource
 * exists.
 */
public class PermissionDeniedException extends RuntimeException {

    private final Permission permission;

    public PermissionDeniedException(Permission permission) {
        super("No permission: " + permission.value());
        this.permission = permission;
    }

    public Permission permission() {
        return permission;
    }
}
