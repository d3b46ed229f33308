package com.bastion.accessservice.infrastructure.idp;

import com.bastion.accessservice.domain.idp.AutoLinkingOption;
import com.bastion.accessservice.domain.idp.IdentityProviderEvents;
import com.bastion.accessservice.domain.idp.IdentityProviderType;
import com.bastion.accessservice.domain.port.EventStore;
import com.bastion.eventmodel.AggregateType;
import com.bastion.eventmodel.EventEnvelope;
import com.bastion.eventmodel.EventFactory;
import com.bastion.eventmodel.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Local stand-in for the identity provider management surface. Writes provider configurations
 * and login policy attachments to the journal; no permission checks are made here.
 */
public class EventSourcedIdentityProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(EventSourcedIdentityProviderRegistry.class);
    private static final String PRODUCER = "idp-management";
    private static final String SYSTEM_USER = "system";

    private final EventStore eventStore;
    private final Clock clock;

    public EventSourcedIdentityProviderRegistry(EventStore eventStore, Clock clock) {
        this.eventStore = eventStore;
        this.clock = clock;
    }

    /**
     * Options of a provider to register.
     */
    public record Definition(String name, IdentityProviderType type, boolean linkingAllowed,
                             boolean creationAllowed, boolean autoCreation, boolean autoUpdate,
                             AutoLinkingOption autoLinking) {
    }

    /** Registers a provider, not yet attached to the login policy, and returns its id. */
    public String add(String instanceId, Definition definition) {
        String idpId = UUID.randomUUID().toString();
        append(instanceId, AggregateType.IDP_CONFIG, idpId, EventType.IDP_CONFIG_ADDED,
                new IdentityProviderEvents.ConfigAdded(definition.name(), definition.type(),
                        definition.linkingAllowed(), definition.creationAllowed(), definition.autoCreation(),
                        definition.autoUpdate(), definition.autoLinking()));
        log.info("Registered identity provider {} ({})", definition.name(), idpId);
        return idpId;
    }

    /** Registers a provider and attaches it to the login policy. */
    public String addActive(String instanceId, Definition definition) {
        String idpId = add(instanceId, definition);
        activate(instanceId, idpId);
        return idpId;
    }

    public void activate(String instanceId, String idpId) {
        append(instanceId, AggregateType.INSTANCE, instanceId, EventType.LOGIN_POLICY_IDP_ADDED,
                new IdentityProviderEvents.LoginPolicyIdpAdded(idpId));
    }

    public void deactivate(String instanceId, String idpId) {
        append(instanceId, AggregateType.INSTANCE, instanceId, EventType.LOGIN_POLICY_IDP_REMOVED,
                new IdentityProviderEvents.LoginPolicyIdpRemoved(idpId));
    }

    public void remove(String instanceId, String idpId, String name) {
        append(instanceId, AggregateType.IDP_CONFIG, idpId, EventType.IDP_CONFIG_REMOVED,
                new IdentityProviderEvents.ConfigRemoved(name));
    }

    private void append(String instanceId, AggregateType aggregateType, String aggregateId, EventType type,
                        Object payload) {
        List<EventEnvelope<?>> stream = eventStore.readStream(instanceId, aggregateType, aggregateId);
        long sequence = stream.isEmpty() ? 0 : stream.get(stream.size() - 1).sequence();
        EventEnvelope<?> event = EventFactory.create(type, PRODUCER, instanceId, instanceId, SYSTEM_USER, null,
                clock.instant(), aggregateId, sequence + 1, payload);
        eventStore.append(List.of(event), sequence);
    }
}
