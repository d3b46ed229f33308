package com.bastion.accessservice.domain.settings;

import com.bastion.eventmodel.EventEnvelope;

import java.util.List;

/**
 * Security settings folded from the instance stream. Other instance events only advance the
 * sequence.
 */
final class SecuritySettingsWriteModel {

    private final String instanceId;
    private boolean embeddedIframeEnabled;
    private List<String> allowedOrigins = List.of();
    private boolean impersonationEnabled;
    private EventEnvelope<?> lastPolicyEvent;
    private long sequence;

    private SecuritySettingsWriteModel(String instanceId) {
        this.instanceId = instanceId;
    }

    static SecuritySettingsWriteModel load(String instanceId, List<EventEnvelope<?>> stream) {
        var model = new SecuritySettingsWriteModel(instanceId);
        for (EventEnvelope<?> event : stream) {
            if (event.payload() instanceof SecurityPolicySet set) {
                model.embeddedIframeEnabled = set.embeddedIframeEnabled();
                model.allowedOrigins = List.copyOf(set.allowedOrigins());
                model.impersonationEnabled = set.impersonationEnabled();
                model.lastPolicyEvent = event;
            }
            model.sequence = event.sequence();
        }
        return model;
    }

    /** The state after applying {@code update}, current values kept where it is empty. */
    SecurityPolicySet apply(SecuritySettingsUpdate update) {
        return new SecurityPolicySet(
                update.embeddedIframeEnabled().orElse(embeddedIframeEnabled),
                update.allowedOrigins().orElse(allowedOrigins),
                update.impersonationEnabled().orElse(impersonationEnabled));
    }

    SecurityPolicySet current() {
        return new SecurityPolicySet(embeddedIframeEnabled, allowedOrigins, impersonationEnabled);
    }

    String instanceId() {
        return instanceId;
    }

    long sequence() {
        return sequence;
    }

    /** The last policy change, null if the policy was never set. */
    EventEnvelope<?> lastPolicyEvent() {
        return lastPolicyEvent;
    }
}
