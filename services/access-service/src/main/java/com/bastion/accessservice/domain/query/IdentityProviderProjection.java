package com.bastion.accessservice.domain.query;

import com.bastion.accessservice.domain.idp.IdentityProviderConfig;
import com.bastion.accessservice.domain.idp.IdentityProviderEvents;
import com.bastion.eventmodel.EventEnvelope;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identity provider configurations per instance, in creation order, with their login policy
 * attachment.
 */
public class IdentityProviderProjection implements Projection {

    private final Map<String, InstanceProviders> instances = new ConcurrentHashMap<>();

    @Override
    public void apply(EventEnvelope<?> event) {
        Object payload = event.payload();
        if (payload instanceof IdentityProviderEvents.ConfigAdded added) {
            var config = new IdentityProviderConfig(event.aggregate().aggregateId(), added.name(), added.type(),
                    false, added.linkingAllowed(), added.creationAllowed(), added.autoCreation(),
                    added.autoUpdate(), added.autoLinkingOption());
            providers(event).put(config);
        } else if (payload instanceof IdentityProviderEvents.ConfigRemoved) {
            providers(event).remove(event.aggregate().aggregateId());
        } else if (payload instanceof IdentityProviderEvents.LoginPolicyIdpAdded attached) {
            providers(event).attach(attached.idpId());
        } else if (payload instanceof IdentityProviderEvents.LoginPolicyIdpRemoved detached) {
            providers(event).detach(detached.idpId());
        }
    }

    /** All configurations of the instance, with {@code active} reflecting the login policy. */
    public List<IdentityProviderConfig> list(String instanceId) {
        InstanceProviders providers = instances.get(instanceId);
        return providers == null ? List.of() : providers.snapshot();
    }

    private InstanceProviders providers(EventEnvelope<?> event) {
        return instances.computeIfAbsent(event.instanceId(), id -> new InstanceProviders());
    }

    private static final class InstanceProviders {
        private final Map<String, IdentityProviderConfig> configs = new LinkedHashMap<>();
        private final Set<String> attached = new HashSet<>();

        synchronized void put(IdentityProviderConfig config) {
            configs.put(config.id(), config);
        }

        synchronized void remove(String idpId) {
            configs.remove(idpId);
            attached.remove(idpId);
        }

        synchronized void attach(String idpId) {
            attached.add(idpId);
        }

        synchronized void detach(String idpId) {
            attached.remove(idpId);
        }

        synchronized List<IdentityProviderConfig> snapshot() {
            return configs.values().stream()
                    .map(c -> c.withActive(attached.contains(c.id())))
                    .toList();
        }
    }
}
