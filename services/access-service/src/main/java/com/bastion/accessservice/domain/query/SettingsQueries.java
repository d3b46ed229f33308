package com.bastion.accessservice.domain.query;

import com.bastion.accessservice.domain.command.CommandDispatcher;
import com.bastion.accessservice.domain.idp.IdentityProviderActivationFilter;
import com.bastion.accessservice.domain.idp.IdentityProviderConfig;
import com.bastion.accessservice.domain.idp.ProviderPredicates;
import com.bastion.accessservice.domain.settings.SecuritySettings;
import com.bastion.security.CallerContext;
import com.bastion.security.Permission;
import com.bastion.security.ResourceScope;

import java.util.List;

/**
 * Read side of the instance settings and the login identity providers.
 */
public class SettingsQueries {

    private final CommandDispatcher dispatcher;
    private final SecuritySettingsProjection securitySettings;
    private final IdentityProviderProjection identityProviders;
    private final QueryProjector projector;

    public SettingsQueries(CommandDispatcher dispatcher, SecuritySettingsProjection securitySettings,
                           IdentityProviderProjection identityProviders, QueryProjector projector) {
        this.dispatcher = dispatcher;
        this.securitySettings = securitySettings;
        this.identityProviders = identityProviders;
        this.projector = projector;
    }

    /** Current settings of the caller's instance, defaults when never set. */
    public SecuritySettings getSecuritySettings(CallerContext caller) {
        String instanceId = caller.instanceId();
        return dispatcher.query("GetSecuritySettings", caller, Permission.IAM_POLICY_READ,
                ResourceScope.instance(instanceId),
                () -> securitySettings.find(instanceId).orElseGet(() -> SecuritySettings.defaults(instanceId)));
    }

    public IdentityProviderList getActiveIdentityProviders(CallerContext caller, ProviderPredicates predicates) {
        return dispatcher.query("GetActiveIdentityProviders", caller, Permission.POLICY_READ,
                ResourceScope.organization(caller.organizationId()), () -> {
                    var timestamp = projector.processedAt();
                    List<IdentityProviderConfig> active = IdentityProviderActivationFilter.filter(
                            identityProviders.list(caller.instanceId()),
                            predicates == null ? ProviderPredicates.none() : predicates);
                    return new IdentityProviderList(active, active.size(), timestamp);
                });
    }
}
