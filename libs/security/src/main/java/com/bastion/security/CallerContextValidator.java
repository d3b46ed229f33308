package com.bastion.security;

import java.util.ArrayList;

/**
 * Validates that a {@link CallerContext} received from the authentication layer is complete.
 */
public final class CallerContextValidator {

    private CallerContextValidator() {
        // utility class
    }

    /**
     * Validates that all required fields of the caller context are present and well-formed.
     *
     * @param context the caller context to validate
     * @return a {@link SecurityValidationResult} with any errors found
     */
    public static SecurityValidationResult validate(CallerContext context) {
        var errors = new ArrayList<String>();

        if (context.user() == null) {
            errors.add("user must not be null");
        } else if (isBlank(context.user().userId())) {
            errors.add("user.userId must not be null or blank");
        }

        if (context.tenant() == null) {
            errors.add("tenant must not be null");
        } else {
            if (isBlank(context.tenant().instanceId())) {
                errors.add("tenant.instanceId must not be null or blank");
            }
            if (isBlank(context.tenant().organizationId())) {
                errors.add("tenant.organizationId must not be null or blank");
            }
        }

        if (context.memberships().isEmpty()) {
            errors.add("memberships must contain at least one role membership");
        }
        for (RoleMembership membership : context.memberships()) {
            if (membership == null || membership.role() == null || membership.scope() == null) {
                errors.add("memberships must not contain incomplete entries");
                break;
            }
        }
        String instanceId = context.tenant() == null ? null : context.tenant().instanceId();
        boolean foreignInstance = !isBlank(instanceId) && context.memberships().stream()
                .filter(m -> m != null && m.scope() != null && m.scope().type() == ScopeType.INSTANCE)
                .anyMatch(m -> !m.scope().id().equals(instanceId));
        if (foreignInstance) {
            errors.add("instance memberships must name the tenant's instance");
        }

        return errors.isEmpty() ? SecurityValidationResult.ok() : SecurityValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
