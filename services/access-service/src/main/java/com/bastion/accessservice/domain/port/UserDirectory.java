package com.bastion.accessservice.domain.port;

/**
 * Existence lookup for users, which are managed outside this service.
 */
public interface UserDirectory {

    boolean userExists(String instanceId, String userId);
}
