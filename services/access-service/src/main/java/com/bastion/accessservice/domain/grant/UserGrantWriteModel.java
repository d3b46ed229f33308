package com.bastion.accessservice.domain.grant;

import com.bastion.eventmodel.EventEnvelope;
import com.bastion.security.CallerContext;
import com.bastion.security.TenantIsolationEnforcer;

import java.time.Instant;
import java.util.List;

/**
 * State of one user grant folded from its event stream, used to decide commands.
 */
final class UserGrantWriteModel {

    private final String grantId;
    private String instanceId;
    private String userId;
    private String projectId;
    private String projectGrantId;
    private List<String> roleKeys = List.of();
    private UserGrantState state;
    private String resourceOwner;
    private long sequence;
    private Instant changeDate;
    private EventEnvelope<?> last;

    private UserGrantWriteModel(String grantId) {
        this.grantId = grantId;
    }

    static UserGrantWriteModel load(String grantId, List<EventEnvelope<?>> stream) {
        var model = new UserGrantWriteModel(grantId);
        stream.forEach(model::apply);
        return model;
    }

    private void apply(EventEnvelope<?> event) {
        Object payload = event.payload();
        if (payload instanceof UserGrantEvents.Added added) {
            instanceId = event.instanceId();
            userId = added.userId();
            projectId = added.projectId();
            projectGrantId = added.projectGrantId();
            roleKeys = List.copyOf(added.roleKeys());
            resourceOwner = event.resourceOwner();
            state = UserGrantState.ACTIVE;
        } else if (payload instanceof UserGrantEvents.Changed changed) {
            roleKeys = List.copyOf(changed.roleKeys());
        } else if (payload instanceof UserGrantEvents.Deactivated) {
            state = UserGrantState.INACTIVE;
        } else if (payload instanceof UserGrantEvents.Reactivated) {
            state = UserGrantState.ACTIVE;
        } else if (payload instanceof UserGrantEvents.Removed) {
            state = UserGrantState.REMOVED;
        }
        sequence = event.sequence();
        changeDate = event.occurredAt();
        last = event;
    }

    /** Whether the grant exists, is not removed, and lives in the caller's instance and organization. */
    boolean visibleTo(CallerContext caller) {
        return state != null && state.exists()
                && TenantIsolationEnforcer.inCallerInstance(caller, instanceId)
                && TenantIsolationEnforcer.ownedByCallerOrganization(caller, resourceOwner);
    }

    String grantId() {
        return grantId;
    }

    String userId() {
        return userId;
    }

    String projectId() {
        return projectId;
    }

    String projectGrantId() {
        return projectGrantId;
    }

    List<String> roleKeys() {
        return roleKeys;
    }

    UserGrantState state() {
        return state;
    }

    String resourceOwner() {
        return resourceOwner;
    }

    long sequence() {
        return sequence;
    }

    Instant changeDate() {
        return changeDate;
    }

    EventEnvelope<?> last() {
        return last;
    }
}
