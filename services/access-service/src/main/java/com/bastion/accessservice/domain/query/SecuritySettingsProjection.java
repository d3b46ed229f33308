package com.bastion.accessservice.domain.query;

import com.bastion.accessservice.domain.settings.SecurityPolicySet;
import com.bastion.accessservice.domain.settings.SecuritySettings;
import com.bastion.eventmodel.EventEnvelope;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Security settings by instance. */
public class SecuritySettingsProjection implements Projection {

    private final Map<String, SecuritySettings> settings = new ConcurrentHashMap<>();

    @Override
    public void apply(EventEnvelope<?> event) {
        if (event.payload() instanceof SecurityPolicySet set) {
            settings.put(event.instanceId(), new SecuritySettings(set.embeddedIframeEnabled(),
                    set.allowedOrigins(), set.impersonationEnabled(), event.occurredAt(),
                    event.resourceOwner(), event.sequence()));
        }
    }

    public Optional<SecuritySettings> find(String instanceId) {
        return Optional.ofNullable(settings.get(instanceId));
    }
}
