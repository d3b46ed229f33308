package com.bastion.accessservice.infrastructure.grpc;

import com.bastion.accessservice.domain.grant.AddUserGrant;
import com.bastion.accessservice.domain.grant.ChangeUserGrant;
import com.bastion.accessservice.domain.grant.GrantTarget;
import com.bastion.accessservice.domain.grant.UserGrantCommands;
import com.bastion.accessservice.domain.query.ListQuery;
import com.bastion.accessservice.domain.query.UserGrantQueries;
import com.bastion.management.v1.AddUserGrantRequest;
import com.bastion.management.v1.AddUserGrantResponse;
import com.bastion.management.v1.BulkRemoveUserGrantRequest;
import com.bastion.management.v1.BulkRemoveUserGrantResponse;
import com.bastion.management.v1.DeactivateUserGrantRequest;
import com.bastion.management.v1.DeactivateUserGrantResponse;
import com.bastion.management.v1.GetUserGrantByIDRequest;
import com.bastion.management.v1.GetUserGrantByIDResponse;
import com.bastion.management.v1.ListUserGrantsRequest;
import com.bastion.management.v1.ListUserGrantsResponse;
import com.bastion.management.v1.ReactivateUserGrantRequest;
import com.bastion.management.v1.ReactivateUserGrantResponse;
import com.bastion.management.v1.RemoveUserGrantRequest;
import com.bastion.management.v1.RemoveUserGrantResponse;
import com.bastion.management.v1.UpdateUserGrantRequest;
import com.bastion.management.v1.UpdateUserGrantResponse;
import com.bastion.management.v1.UserGrantServiceGrpc;
import io.grpc.stub.StreamObserver;

import java.util.OptionalLong;

/**
 * gRPC adapter of the user grant commands and queries. All grants are scoped to the caller's
 * organization.
 */
public class UserGrantGrpcService extends UserGrantServiceGrpc.UserGrantServiceImplBase {

    private final UserGrantCommands commands;
    private final UserGrantQueries queries;

    public UserGrantGrpcService(UserGrantCommands commands, UserGrantQueries queries) {
        this.commands = commands;
        this.queries = queries;
    }

    @Override
    public void getUserGrantByID(GetUserGrantByIDRequest request,
                                 StreamObserver<GetUserGrantByIDResponse> responseObserver) {
        var caller = CallerContextInterceptor.current();
        var grant = request.hasMinSequence()
                ? queries.getById(caller, request.getGrantId(), request.getMinSequence())
                : queries.getById(caller, request.getGrantId());
        responseObserver.onNext(GetUserGrantByIDResponse.newBuilder()
                .setUserGrant(GrpcMappers.userGrant(grant))
                .build());
        responseObserver.onCompleted();
    }

    @Override
    public void listUserGrants(ListUserGrantsRequest request,
                               StreamObserver<ListUserGrantsResponse> responseObserver) {
        var page = request.hasQuery()
                ? new ListQuery(request.getQuery().getOffset(), request.getQuery().getLimit(),
                        request.getQuery().getAsc())
                : ListQuery.unpaged();
        var result = queries.list(CallerContextInterceptor.current(),
                GrpcMappers.userGrantFilter(request.getQueriesList()), page);
        var response = ListUserGrantsResponse.newBuilder()
                .setDetails(GrpcMappers.listDetails(result.totalCount(), result.latestSequence(),
                        result.latestTimestamp()));
        result.grants().forEach(g -> response.addResult(GrpcMappers.userGrant(g)));
        responseObserver.onNext(response.build());
        responseObserver.onCompleted();
    }

    @Override
    public void addUserGrant(AddUserGrantRequest request, StreamObserver<AddUserGrantResponse> responseObserver) {
        GrantTarget target = switch (request.getTargetCase()) {
            case PROJECT_ID -> GrantTarget.project(request.getProjectId());
            case PROJECT_GRANT_ID -> GrantTarget.projectGrant(request.getProjectGrantId());
            case TARGET_NOT_SET -> null;
        };
        var added = commands.add(CallerContextInterceptor.current(),
                new AddUserGrant(request.getUserId(), target, request.getRoleKeysList()));
        responseObserver.onNext(AddUserGrantResponse.newBuilder()
                .setUserGrantId(added.grantId())
                .setDetails(GrpcMappers.details(added.details()))
                .build());
        responseObserver.onCompleted();
    }

    @Override
    public void updateUserGrant(UpdateUserGrantRequest request,
                                StreamObserver<UpdateUserGrantResponse> responseObserver) {
        var command = new ChangeUserGrant(request.getGrantId(), request.getRoleKeysList(),
                request.hasExpectedSequence() ? OptionalLong.of(request.getExpectedSequence()) : OptionalLong.empty());
        var details = commands.change(CallerContextInterceptor.current(), command);
        responseObserver.onNext(UpdateUserGrantResponse.newBuilder()
                .setDetails(GrpcMappers.details(details))
                .build());
        responseObserver.onCompleted();
    }

    @Override
    public void deactivateUserGrant(DeactivateUserGrantRequest request,
                                    StreamObserver<DeactivateUserGrantResponse> responseObserver) {
        var details = commands.deactivate(CallerContextInterceptor.current(), request.getGrantId());
        responseObserver.onNext(DeactivateUserGrantResponse.newBuilder()
                .setDetails(GrpcMappers.details(details))
                .build());
        responseObserver.onCompleted();
    }

    @Override
    public void reactivateUserGrant(ReactivateUserGrantRequest request,
                                    StreamObserver<ReactivateUserGrantResponse> responseObserver) {
        var details = commands.reactivate(CallerContextInterceptor.current(), request.getGrantId());
        responseObserver.onNext(ReactivateUserGrantResponse.newBuilder()
                .setDetails(GrpcMappers.details(details))
                .build());
        responseObserver.onCompleted();
    }

    @Override
    public void removeUserGrant(RemoveUserGrantRequest request,
                                StreamObserver<RemoveUserGrantResponse> responseObserver) {
        var details = commands.remove(CallerContextInterceptor.current(), request.getGrantId());
        responseObserver.onNext(RemoveUserGrantResponse.newBuilder()
                .setDetails(GrpcMappers.details(details))
                .build());
        responseObserver.onCompleted();
    }

    @Override
    public void bulkRemoveUserGrant(BulkRemoveUserGrantRequest request,
                                    StreamObserver<BulkRemoveUserGrantResponse> responseObserver) {
        commands.bulkRemove(CallerContextInterceptor.current(), request.getGrantIdList());
        responseObserver.onNext(BulkRemoveUserGrantResponse.getDefaultInstance());
        responseObserver.onCompleted();
    }
}
