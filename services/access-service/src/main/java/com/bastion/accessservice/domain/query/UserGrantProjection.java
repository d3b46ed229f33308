package com.bastion.accessservice.domain.query;

import com.bastion.accessservice.domain.grant.UserGrant;
import com.bastion.accessservice.domain.grant.UserGrantEvents;
import com.bastion.accessservice.domain.grant.UserGrantState;
import com.bastion.eventmodel.EventEnvelope;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current user grants by id. Removed grants are dropped from the view.
 */
public class UserGrantProjection implements Projection {

    private final Map<String, UserGrant> grants = new ConcurrentHashMap<>();

    @Override
    public void apply(EventEnvelope<?> event) {
        Object payload = event.payload();
        String id = event.aggregate().aggregateId();
        if (payload instanceof UserGrantEvents.Added added) {
            grants.put(id, new UserGrant(id, event.instanceId(), added.userId(), added.projectId(),
                    added.projectGrantId(), added.roleKeys(), UserGrantState.ACTIVE, event.resourceOwner(),
                    event.sequence(), event.occurredAt(), event.occurredAt()));
        } else if (payload instanceof UserGrantEvents.Changed changed) {
            update(event, changed.roleKeys(), null);
        } else if (payload instanceof UserGrantEvents.Deactivated) {
            update(event, null, UserGrantState.INACTIVE);
        } else if (payload instanceof UserGrantEvents.Reactivated) {
            update(event, null, UserGrantState.ACTIVE);
        } else if (payload instanceof UserGrantEvents.Removed) {
            grants.remove(id);
        }
    }

    private void update(EventEnvelope<?> event, List<String> roleKeys, UserGrantState state) {
        grants.computeIfPresent(event.aggregate().aggregateId(), (id, grant) -> grant.withChange(
                roleKeys != null ? roleKeys : grant.roleKeys(),
                state != null ? state : grant.state(),
                event.sequence(),
                event.occurredAt()));
    }

    public Optional<UserGrant> find(String instanceId, String grantId) {
        return Optional.ofNullable(grants.get(grantId))
                .filter(g -> g.instanceId().equals(instanceId));
    }

    public List<UserGrant> search(String instanceId, String resourceOwner, UserGrantFilter filter) {
        return grants.values().stream()
                .filter(g -> g.instanceId().equals(instanceId))
                .filter(g -> g.resourceOwner().equals(resourceOwner))
                .filter(filter::matches)
                .toList();
    }
}
