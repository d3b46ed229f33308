package com.bastion.accessservice.domain.query;

import com.bastion.accessservice.domain.command.CommandDispatcher;
import com.bastion.accessservice.domain.error.DeadlineExceededException;
import com.bastion.accessservice.domain.error.NotFoundException;
import com.bastion.accessservice.domain.grant.UserGrant;
import com.bastion.eventmodel.AggregateType;
import com.bastion.security.CallerContext;
import com.bastion.security.Permission;
import com.bastion.security.ResourceScope;

import java.util.Comparator;
import java.util.List;

/**
 * Reads user grants of the caller's organization from the projected view.
 */
public class UserGrantQueries {

    private static final Comparator<UserGrant> BY_CREATION =
            Comparator.comparing(UserGrant::creationDate).thenComparing(UserGrant::id);

    private final CommandDispatcher dispatcher;
    private final UserGrantProjection projection;
    private final QueryProjector projector;
    private final ReadAfterWrite readAfterWrite;

    public UserGrantQueries(CommandDispatcher dispatcher, UserGrantProjection projection,
                            QueryProjector projector, ReadAfterWrite readAfterWrite) {
        this.dispatcher = dispatcher;
        this.projection = projection;
        this.projector = projector;
        this.readAfterWrite = readAfterWrite;
    }

    public UserGrant getById(CallerContext caller, String grantId) {
        return dispatcher.query("GetUserGrantByID", caller, Permission.USER_GRANT_READ,
                ResourceScope.organization(caller.organizationId()), () -> findVisible(caller, grantId));
    }

    /**
     * Like {@link #getById(CallerContext, String)}, but first waits until the view has applied the
     * grant up to {@code minSequence}, typically the sequence a command just returned.
     *
     * @throws DeadlineExceededException if the view does not get there within the configured wait
     */
    public UserGrant getById(CallerContext caller, String grantId, long minSequence) {
        return dispatcher.query("GetUserGrantByID", caller, Permission.USER_GRANT_READ,
                ResourceScope.organization(caller.organizationId()), () -> {
                    readAfterWrite.await(
                                    () -> projector.appliedSequence(AggregateType.USER_GRANT.value(), grantId),
                                    applied -> applied >= minSequence)
                            .orElseThrow(() -> new DeadlineExceededException("QUERY-Sfw3q",
                                    "user grant view did not reach sequence " + minSequence));
                    return findVisible(caller, grantId);
                });
    }

    /**
     * Lists grants matching the filter. A project filter narrows the required permission to that
     * project, so project owners can list their project's grants.
     */
    public UserGrantList list(CallerContext caller, UserGrantFilter filter, ListQuery page) {
        ResourceScope scope = filter.projectId() != null
                ? ResourceScope.project(caller.organizationId(), filter.projectId())
                : ResourceScope.organization(caller.organizationId());
        return dispatcher.query("ListUserGrants", caller, Permission.USER_GRANT_READ, scope, () -> {
            long position = projector.processedPosition();
            var processedAt = projector.processedAt();
            List<UserGrant> matches = projection.search(caller.instanceId(), caller.organizationId(), filter)
                    .stream()
                    .sorted(page.ascending() ? BY_CREATION : BY_CREATION.reversed())
                    .toList();
            var paged = matches.stream()
                    .skip(page.offset())
                    .limit(page.limit() == 0 ? Long.MAX_VALUE : page.limit())
                    .toList();
            return new UserGrantList(paged, matches.size(), position, processedAt);
        });
    }

    private UserGrant findVisible(CallerContext caller, String grantId) {
        return projection.find(caller.instanceId(), grantId)
                .filter(g -> g.resourceOwner().equals(caller.organizationId()))
                .orElseThrow(() -> new NotFoundException("QUERY-4Fm9s", "user grant not found"));
    }
}
