package com.bastion.accessservice.infrastructure.grpc;

import com.bastion.accessservice.domain.ChangeDetails;
import com.bastion.accessservice.domain.grant.UserGrant;
import com.bastion.accessservice.domain.grant.UserGrantState;
import com.bastion.accessservice.domain.idp.IdentityProviderConfig;
import com.bastion.accessservice.domain.idp.IdentityProviderType;
import com.bastion.accessservice.domain.query.UserGrantFilter;
import com.bastion.accessservice.domain.settings.SecuritySettings;
import com.bastion.management.v1.UserGrantQuery;
import com.bastion.object.v1.Details;
import com.bastion.object.v1.ListDetails;
import com.bastion.settings.v1.EmbeddedIframeSettings;
import com.bastion.settings.v1.IdentityProvider;
import com.bastion.settings.v1.IdentityProviderOptions;
import com.google.protobuf.Timestamp;

import java.time.Instant;
import java.util.List;

/**
 * Conversions between domain types and generated protobuf messages.
 */
final class GrpcMappers {

    private GrpcMappers() {
        // utility class
    }

    static Timestamp timestamp(Instant instant) {
        return Timestamp.newBuilder()
                .setSeconds(instant.getEpochSecond())
                .setNanos(instant.getNano())
                .build();
    }

    static Details details(ChangeDetails details) {
        var builder = Details.newBuilder()
                .setSequence(details.sequence())
                .setResourceOwner(details.resourceOwner());
        if (details.changeDate() != null) {
            builder.setChangeDate(timestamp(details.changeDate()));
        }
        return builder.build();
    }

    static ListDetails listDetails(long totalResult, long processedSequence, Instant timestamp) {
        var builder = ListDetails.newBuilder()
                .setTotalResult(totalResult)
                .setProcessedSequence(processedSequence);
        if (timestamp != null) {
            builder.setTimestamp(timestamp(timestamp));
        }
        return builder.build();
    }

    static com.bastion.settings.v1.SecuritySettings securitySettings(SecuritySettings settings) {
        return com.bastion.settings.v1.SecuritySettings.newBuilder()
                .setEmbeddedIframe(EmbeddedIframeSettings.newBuilder()
                        .setEnabled(settings.embeddedIframeEnabled())
                        .addAllAllowedOrigins(settings.allowedOrigins()))
                .setEnableImpersonation(settings.impersonationEnabled())
                .setDetails(details(new ChangeDetails(settings.sequence(), settings.changeDate(),
                        settings.resourceOwner())))
                .build();
    }

    static IdentityProvider identityProvider(IdentityProviderConfig config) {
        return IdentityProvider.newBuilder()
                .setId(config.id())
                .setName(config.name())
                .setType(identityProviderType(config.type()))
                .setOptions(IdentityProviderOptions.newBuilder()
                        .setIsLinkingAllowed(config.linkingAllowed())
                        .setIsCreationAllowed(config.creationAllowed())
                        .setIsAutoCreation(config.autoCreation())
                        .setIsAutoUpdate(config.autoUpdate())
                        .setIsAutoLinking(config.autoLinking()))
                .build();
    }

    static com.bastion.settings.v1.IdentityProviderType identityProviderType(IdentityProviderType type) {
        if (type == null) {
            return com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_UNSPECIFIED;
        }
        return switch (type) {
            case OIDC -> com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_OIDC;
            case JWT -> com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_JWT;
            case OAUTH -> com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_OAUTH;
            case LDAP -> com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_LDAP;
            case SAML -> com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_SAML;
            case AZURE_AD -> com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_AZURE_AD;
            case GITHUB -> com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_GITHUB;
            case GITLAB -> com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_GITLAB;
            case GOOGLE -> com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_GOOGLE;
            case APPLE -> com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_APPLE;
        };
    }

    static com.bastion.management.v1.UserGrant userGrant(UserGrant grant) {
        var builder = com.bastion.management.v1.UserGrant.newBuilder()
                .setId(grant.id())
                .setUserId(grant.userId())
                .setProjectId(grant.projectId())
                .addAllRoleKeys(grant.roleKeys())
                .setState(userGrantState(grant.state()))
                .setResourceOwner(grant.resourceOwner())
                .setSequence(grant.sequence())
                .setCreationDate(timestamp(grant.creationDate()))
                .setChangeDate(timestamp(grant.changeDate()));
        if (grant.projectGrantId() != null) {
            builder.setProjectGrantId(grant.projectGrantId());
        }
        return builder.build();
    }

    static com.bastion.management.v1.UserGrantState userGrantState(UserGrantState state) {
        return switch (state) {
            case ACTIVE -> com.bastion.management.v1.UserGrantState.USER_GRANT_STATE_ACTIVE;
            case INACTIVE -> com.bastion.management.v1.UserGrantState.USER_GRANT_STATE_INACTIVE;
            case REMOVED -> com.bastion.management.v1.UserGrantState.USER_GRANT_STATE_UNSPECIFIED;
        };
    }

    /**
     * Folds the request queries into one filter. Empty strings do not restrict.
     *
     * @throws IllegalArgumentException if a criterion is given twice or the state is unspecified
     */
    static UserGrantFilter userGrantFilter(List<UserGrantQuery> queries) {
        String userId = null;
        String projectId = null;
        String projectGrantId = null;
        String roleKey = null;
        UserGrantState state = null;
        for (UserGrantQuery query : queries) {
            switch (query.getQueryCase()) {
                case USER_ID -> userId = once(userId, blankToNull(query.getUserId()), "user_id");
                case PROJECT_ID -> projectId = once(projectId, blankToNull(query.getProjectId()), "project_id");
                case PROJECT_GRANT_ID -> projectGrantId =
                        once(projectGrantId, blankToNull(query.getProjectGrantId()), "project_grant_id");
                case ROLE_KEY -> roleKey = once(roleKey, blankToNull(query.getRoleKey()), "role_key");
                case STATE -> state = once(state, domainState(query.getState()), "state");
                case QUERY_NOT_SET -> {
                    // empty query entry, ignored
                }
            }
        }
        return new UserGrantFilter(userId, projectId, projectGrantId, roleKey, state);
    }

    private static UserGrantState domainState(com.bastion.management.v1.UserGrantState state) {
        return switch (state) {
            case USER_GRANT_STATE_ACTIVE -> UserGrantState.ACTIVE;
            case USER_GRANT_STATE_INACTIVE -> UserGrantState.INACTIVE;
            default -> throw new IllegalArgumentException("state query requires ACTIVE or INACTIVE");
        };
    }

    private static <T> T once(T current, T value, String name) {
        if (current != null) {
            throw new IllegalArgumentException("query " + name + " given more than once");
        }
        return value;
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
