package com.bastion.security;

/**
 * Authenticated caller identity as forwarded by the authentication layer.
 *
 * @param userId      unique user identifier
 * @param username    login name
 * @param displayName optional human-readable display name
 */
public record AuthenticatedUser(String userId, String username, String displayName) {}
