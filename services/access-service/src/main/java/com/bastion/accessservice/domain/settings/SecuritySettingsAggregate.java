package com.bastion.accessservice.domain.settings;

import com.bastion.accessservice.domain.ChangeDetails;
import com.bastion.accessservice.domain.command.CommandDispatcher;
import com.bastion.accessservice.domain.error.InvalidArgumentException;
import com.bastion.accessservice.domain.port.EventStore;
import com.bastion.eventmodel.AggregateType;
import com.bastion.eventmodel.EventEnvelope;
import com.bastion.eventmodel.EventFactory;
import com.bastion.eventmodel.EventType;
import com.bastion.security.CallerContext;
import com.bastion.security.Permission;
import com.bastion.security.ResourceScope;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;

/**
 * Writes the security settings of the caller's instance. The settings are created by the first
 * write that changes anything.
 */
public class SecuritySettingsAggregate {

    private final CommandDispatcher dispatcher;
    private final EventStore eventStore;
    private final Clock clock;
    private final String producer;

    public SecuritySettingsAggregate(CommandDispatcher dispatcher, EventStore eventStore, Clock clock,
                                     String producer) {
        this.dispatcher = dispatcher;
        this.eventStore = eventStore;
        this.clock = clock;
        this.producer = producer;
    }

    /**
     * Applies a partial update. When the result equals the current settings nothing is written and
     * the details of the last change are returned.
     */
    public ChangeDetails set(CallerContext caller, SecuritySettingsUpdate update) {
        String instanceId = caller.instanceId();
        return dispatcher.execute("SetSecuritySettings", caller, Permission.IAM_POLICY_WRITE,
                ResourceScope.instance(instanceId), () -> {
                    update.allowedOrigins().ifPresent(SecuritySettingsAggregate::validateOrigins);

                    var model = SecuritySettingsWriteModel.load(instanceId,
                            eventStore.readStream(instanceId, AggregateType.INSTANCE, instanceId));
                    SecurityPolicySet next = model.apply(update);
                    if (next.equals(model.current())) {
                        EventEnvelope<?> last = model.lastPolicyEvent();
                        return last == null
                                ? new ChangeDetails(model.sequence(), null, instanceId)
                                : ChangeDetails.of(last);
                    }

                    EventEnvelope<?> event = EventFactory.create(EventType.SECURITY_POLICY_SET, producer,
                            instanceId, instanceId, caller.userId(), caller.correlationId(), clock.instant(),
                            instanceId, model.sequence() + 1, next);
                    dispatcher.checkDeadline(caller);
                    List<EventEnvelope<?>> committed = eventStore.append(List.of(event), model.sequence());
                    return ChangeDetails.of(committed.get(0));
                });
    }

    private static void validateOrigins(List<String> origins) {
        var seen = new HashSet<String>();
        for (String origin : origins) {
            if (origin == null || origin.isBlank()) {
                throw new InvalidArgumentException("INSTANCE-Hg42a", "allowed origins must not be blank");
            }
            if (!seen.add(origin)) {
                throw new InvalidArgumentException("INSTANCE-Hg42b", "allowed origin is listed twice: " + origin);
            }
        }
    }
}
