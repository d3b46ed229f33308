package com.bastion.accessservice.domain.grant;

import com.bastion.accessservice.domain.ChangeDetails;
import com.bastion.accessservice.domain.command.CommandDispatcher;
import com.bastion.accessservice.domain.error.AccessException;
import com.bastion.accessservice.domain.error.ConflictException;
import com.bastion.accessservice.domain.error.FailedPreconditionException;
import com.bastion.accessservice.domain.error.InvalidArgumentException;
import com.bastion.accessservice.domain.error.NotFoundException;
import com.bastion.accessservice.domain.port.EventStore;
import com.bastion.accessservice.domain.port.ProjectDirectory;
import com.bastion.accessservice.domain.port.UserDirectory;
import com.bastion.eventmodel.AggregateType;
import com.bastion.eventmodel.EventEnvelope;
import com.bastion.eventmodel.EventFactory;
import com.bastion.eventmodel.EventType;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.security.CallerContext;
import com.bastion.security.Permission;
import com.bastion.security.ResourceScope;
import com.bastion.security.TenantIsolationEnforcer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * State transitions of user grants.
 * <p>
 * Every operation runs through the {@link CommandDispatcher}, so the caller's permission is
 * checked on a scope built from the request and the caller's organization before any grant,
 * project or user is looked up. Grants of other organizations are reported as not found.
 */
public class UserGrantCommands {

    private static final Logger log = LoggerFactory.getLogger(UserGrantCommands.class);

    private final CommandDispatcher dispatcher;
    private final EventStore eventStore;
    private final ProjectDirectory projects;
    private final UserDirectory users;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final String producer;
    private final Executor bulkExecutor;

    public UserGrantCommands(CommandDispatcher dispatcher, EventStore eventStore, ProjectDirectory projects,
                             UserDirectory users, Clock clock, Supplier<String> idGenerator,
                             String producer, Executor bulkExecutor) {
        this.dispatcher = dispatcher;
        this.eventStore = eventStore;
        this.projects = projects;
        this.users = users;
        this.clock = clock;
        this.idGenerator = idGenerator;
        this.producer = producer;
        this.bulkExecutor = bulkExecutor;
    }

    /**
     * Creates an ACTIVE grant at sequence 1, owned by the caller's organization.
     */
    public AddedUserGrant add(CallerContext caller, AddUserGrant command) {
        return dispatcher.execute("AddUserGrant", caller, Permission.USER_GRANT_WRITE,
                scopeOf(caller, command.target()), () -> {
            if (command.target() == null) {
                throw new InvalidArgumentException("USERGRANT-4m9Gs", "project or project grant is required");
            }
            String userId = requireText(command.userId(), "USERGRANT-2n0Fs", "user id is required");
            List<String> roleKeys = normalizeRoleKeys(command.roleKeys());
            ResolvedTarget target = resolve(caller, command.target());
            target.requireRoles(roleKeys);
            if (!users.userExists(caller.instanceId(), userId)) {
                throw new FailedPreconditionException("USERGRANT-4f8sW", "user not found");
            }

            String grantId = idGenerator.get();
            EventEnvelope<?> added = EventFactory.create(EventType.USER_GRANT_ADDED, producer,
                    caller.instanceId(), caller.organizationId(), caller.userId(), caller.correlationId(),
                    clock.instant(), grantId, 1,
                    new UserGrantEvents.Added(userId, target.projectId(), target.projectGrantId(), roleKeys));
            return new AddedUserGrant(grantId, commit(caller, added, 0));
        });
    }

    /**
     * Replaces the grant's role keys. Setting the keys it already has appends nothing.
     */
    public ChangeDetails change(CallerContext caller, ChangeUserGrant command) {
        return dispatcher.execute("UpdateUserGrant", caller, Permission.USER_GRANT_WRITE,
                organizationScope(caller), () -> {
                    String grantId = requireGrantId(command.grantId());
                    List<String> roleKeys = normalizeRoleKeys(command.roleKeys());
                    UserGrantWriteModel model = loadVisible(caller, grantId);
                    if (command.expectedSequence().isPresent()
                            && command.expectedSequence().getAsLong() != model.sequence()) {
                        throw new ConflictException("USERGRANT-5m0Fs", "user grant was modified concurrently");
                    }
                    resolve(caller, targetOf(model)).requireRoles(roleKeys);
                    if (new HashSet<>(roleKeys).equals(new HashSet<>(model.roleKeys()))) {
                        return ChangeDetails.of(model.last());
                    }
                    return commit(caller, next(caller, model, EventType.USER_GRANT_CHANGED,
                            new UserGrantEvents.Changed(model.userId(), roleKeys)), model.sequence());
                });
    }

    public ChangeDetails deactivate(CallerContext caller, String grantId) {
        return dispatcher.execute("DeactivateUserGrant", caller, Permission.USER_GRANT_WRITE,
                organizationScope(caller), () -> {
                    UserGrantWriteModel model = loadVisible(caller, requireGrantId(grantId));
                    if (model.state() == UserGrantState.INACTIVE) {
                        throw new FailedPreconditionException("USERGRANT-1S9gx", "user grant is already inactive");
                    }
                    return commit(caller, next(caller, model, EventType.USER_GRANT_DEACTIVATED,
                            new UserGrantEvents.Deactivated(model.userId())), model.sequence());
                });
    }

    public ChangeDetails reactivate(CallerContext caller, String grantId) {
        return dispatcher.execute("ReactivateUserGrant", caller, Permission.USER_GRANT_WRITE,
                organizationScope(caller), () -> {
                    UserGrantWriteModel model = loadVisible(caller, requireGrantId(grantId));
                    if (model.state() != UserGrantState.INACTIVE) {
                        throw new FailedPreconditionException("USERGRANT-1ML0v", "user grant is not inactive");
                    }
                    return commit(caller, next(caller, model, EventType.USER_GRANT_REACTIVATED,
                            new UserGrantEvents.Reactivated(model.userId())), model.sequence());
                });
    }

    public ChangeDetails remove(CallerContext caller, String grantId) {
        return dispatcher.execute("RemoveUserGrant", caller, Permission.USER_GRANT_DELETE,
                organizationScope(caller), () -> removeChecked(caller, requireGrantId(grantId)));
    }

    /**
     * Removes each grant independently on the bulk executor and waits for all of them. Failures of
     * single grants are logged and do not affect the others or the result. Grants not yet started
     * when the caller's deadline passes are skipped.
     */
    public void bulkRemove(CallerContext caller, List<String> grantIds) {
        dispatcher.execute("BulkRemoveUserGrant", caller, Permission.USER_GRANT_DELETE,
                organizationScope(caller), () -> {
                    if (grantIds == null || grantIds.isEmpty()) {
                        throw new InvalidArgumentException("USERGRANT-7n8Sg", "at least one grant id is required");
                    }
                    var removals = new ArrayList<CompletableFuture<Void>>(grantIds.size());
                    for (String grantId : grantIds) {
                        removals.add(CompletableFuture.runAsync(
                                CorrelationContextHolder.wrap(() -> removeQuietly(caller, grantId)),
                                bulkExecutor));
                    }
                    CompletableFuture.allOf(removals.toArray(new CompletableFuture[0])).join();
                    return null;
                });
    }

    private void removeQuietly(CallerContext caller, String grantId) {
        try {
            ChangeDetails details = removeChecked(caller, requireGrantId(grantId));
            log.debug("bulk removal of user grant {} committed at sequence {}", grantId, details.sequence());
        } catch (AccessException e) {
            log.warn("bulk removal of user grant {} skipped [{}]: {}", grantId, e.messageId(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("bulk removal of user grant {} failed", grantId, e);
        }
    }

    private ChangeDetails removeChecked(CallerContext caller, String grantId) {
        UserGrantWriteModel model = loadVisible(caller, grantId);
        return commit(caller, next(caller, model, EventType.USER_GRANT_REMOVED,
                new UserGrantEvents.Removed(model.userId(), model.projectId(), model.projectGrantId())),
                model.sequence());
    }

    private UserGrantWriteModel loadVisible(CallerContext caller, String grantId) {
        var model = UserGrantWriteModel.load(grantId,
                eventStore.readStream(caller.instanceId(), AggregateType.USER_GRANT, grantId));
        if (!model.visibleTo(caller)) {
            throw new NotFoundException("USERGRANT-5m9Gq", "user grant not found");
        }
        return model;
    }

    private EventEnvelope<?> next(CallerContext caller, UserGrantWriteModel model, EventType type, Object payload) {
        return EventFactory.create(type, producer, caller.instanceId(), model.resourceOwner(), caller.userId(),
                caller.correlationId(), clock.instant(), model.grantId(), model.sequence() + 1, payload);
    }

    private ChangeDetails commit(CallerContext caller, EventEnvelope<?> event, long expectedSequence) {
        dispatcher.checkDeadline(caller);
        List<EventEnvelope<?>> committed = eventStore.append(List.of(event), expectedSequence);
        return ChangeDetails.of(committed.get(committed.size() - 1));
    }

    private ResolvedTarget resolve(CallerContext caller, GrantTarget target) {
        if (target instanceof GrantTarget.DirectProject direct) {
            String projectId = requireText(direct.projectId(), "USERGRANT-3m9Gg", "project id is required");
            var project = projects.findProject(caller.instanceId(), projectId)
                    .filter(p -> TenantIsolationEnforcer.ownedByCallerOrganization(caller, p.resourceOwner()))
                    .orElseThrow(() -> new FailedPreconditionException("USERGRANT-4M0fs", "project not found"));
            return new ResolvedTarget(project.id(), null, project.roleKeys());
        }
        var via = (GrantTarget.ViaProjectGrant) target;
        String projectGrantId = requireText(via.projectGrantId(), "USERGRANT-2m9Fd", "project grant id is required");
        var grant = projects.findProjectGrant(caller.instanceId(), projectGrantId)
                .filter(ProjectDirectory.ProjectGrant::active)
                .filter(g -> TenantIsolationEnforcer.ownedByCallerOrganization(caller, g.grantedOrgId()))
                .orElseThrow(() -> new FailedPreconditionException("USERGRANT-8mGR2", "project grant not found"));
        return new ResolvedTarget(grant.projectId(), grant.id(), grant.grantedRoleKeys());
    }

    private static GrantTarget targetOf(UserGrantWriteModel model) {
        return model.projectGrantId() != null
                ? GrantTarget.projectGrant(model.projectGrantId())
                : GrantTarget.project(model.projectId());
    }

    /**
     * Permission scope of an add request. A request without a usable target is checked against the
     * caller's organization; the missing target is reported after the check passes.
     */
    private static ResourceScope scopeOf(CallerContext caller, GrantTarget target) {
        if (target instanceof GrantTarget.DirectProject direct && hasText(direct.projectId())) {
            return ResourceScope.project(caller.organizationId(), direct.projectId());
        }
        if (target instanceof GrantTarget.ViaProjectGrant via && hasText(via.projectGrantId())) {
            return ResourceScope.projectGrant(caller.organizationId(), via.projectGrantId());
        }
        return organizationScope(caller);
    }

    private static ResourceScope organizationScope(CallerContext caller) {
        return ResourceScope.organization(caller.organizationId());
    }

    private static List<String> normalizeRoleKeys(List<String> roleKeys) {
        if (roleKeys == null || roleKeys.isEmpty()) {
            throw new InvalidArgumentException("USERGRANT-Fm9kS", "at least one role key is required");
        }
        var unique = new LinkedHashSet<String>();
        for (String key : roleKeys) {
            unique.add(requireText(key, "USERGRANT-Fm9kT", "role keys must not be blank"));
        }
        return List.copyOf(unique);
    }

    private static String requireGrantId(String grantId) {
        return requireText(grantId, "USERGRANT-8jSfE", "grant id is required");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String requireText(String value, String messageId, String message) {
        if (!hasText(value)) {
            throw new InvalidArgumentException(messageId, message);
        }
        return value;
    }

    private record ResolvedTarget(String projectId, String projectGrantId, List<String> allowedRoleKeys) {

        void requireRoles(List<String> roleKeys) {
            var missing = roleKeys.stream().filter(k -> !allowedRoleKeys.contains(k)).toList();
            if (!missing.isEmpty()) {
                throw new FailedPreconditionException("USERGRANT-m8Fs2", "role keys not found: " + missing);
            }
        }
    }
}
