package com.bastion.security;

/**
 * Tenant scope of a request.
 *
 * <p>The organization is the resource owner that new grants are attributed to; the instance owns
 * instance-level configuration such as security settings.
 *
 * @param instanceId     identifier of the instance the caller is working in
 * @param organizationId identifier of the organization the request is scoped to
 */
public record TenantContext(String instanceId, String organizationId) {}
