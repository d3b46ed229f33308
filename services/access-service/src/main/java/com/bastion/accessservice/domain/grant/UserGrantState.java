package com.bastion.accessservice.domain.grant;

/**
 * Lifecycle of a user grant. ACTIVE and INACTIVE switch back and forth; REMOVED is terminal.
 */
public enum UserGrantState {
    ACTIVE,
    INACTIVE,
    REMOVED;

    public boolean exists() {
        return this != REMOVED;
    }
}
