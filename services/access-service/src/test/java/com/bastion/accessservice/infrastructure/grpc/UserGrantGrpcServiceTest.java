package com.bastion.accessservice.infrastructure.grpc;

import static com.bastion.accessservice.AccessServiceFixture.ORG_ID;
import static com.bastion.accessservice.AccessServiceFixture.PROJECT;
import static com.bastion.accessservice.AccessServiceFixture.PROJECT_GRANT;
import static com.bastion.accessservice.AccessServiceFixture.USER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.bastion.accessservice.AccessServiceFixture;
import com.bastion.management.v1.AddUserGrantRequest;
import com.bastion.management.v1.AddUserGrantResponse;
import com.bastion.management.v1.BulkRemoveUserGrantRequest;
import com.bastion.management.v1.DeactivateUserGrantRequest;
import com.bastion.management.v1.GetUserGrantByIDRequest;
import com.bastion.management.v1.ListUserGrantsRequest;
import com.bastion.management.v1.RemoveUserGrantRequest;
import com.bastion.management.v1.UpdateUserGrantRequest;
import com.bastion.management.v1.UserGrant;
import com.bastion.management.v1.UserGrantQuery;
import com.bastion.management.v1.UserGrantServiceGrpc;
import com.bastion.management.v1.UserGrantState;
import com.bastion.object.v1.ListQuery;
import com.bastion.security.CallerContext;
import com.bastion.security.CallerContextSerializer;
import com.bastion.security.testing.TestCallerContextFactory;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.Server;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.MetadataUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Exercises the user grant service through a real gRPC channel, with the interceptors in
 * production order.
 */
@DisplayName("UserGrantGrpcService over gRPC")
class UserGrantGrpcServiceTest {

    private AccessServiceFixture fixture;
    private Server server;
    private ManagedChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new AccessServiceFixture();
        fixture.projector.start();
        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name)
                .directExecutor()
                .addService(ServerInterceptors.intercept(
                        new UserGrantGrpcService(fixture.userGrants, fixture.userGrantQueries),
                        new GrpcExceptionInterceptor(),
                        new CallerContextInterceptor(fixture.clock),
                        new GrpcCorrelationInterceptor()))
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
        server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
        fixture.projector.close();
    }

    private UserGrantServiceGrpc.UserGrantServiceBlockingStub stubFor(CallerContext caller) {
        var headers = new Metadata();
        headers.put(CallerContextInterceptor.CALLER_CONTEXT_KEY, CallerContextSerializer.serialize(caller));
        return UserGrantServiceGrpc.newBlockingStub(channel)
                .withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers));
    }

    private UserGrantServiceGrpc.UserGrantServiceBlockingStub owner() {
        return stubFor(TestCallerContextFactory.orgOwner(ORG_ID));
    }

    private AddUserGrantResponse addViewer() {
        return owner().addUserGrant(AddUserGrantRequest.newBuilder()
                .setUserId(USER)
                .setProjectId(PROJECT)
                .addRoleKeys("viewer")
                .build());
    }

    @Test
    @DisplayName("add then read back with min_sequence sees the write")
    void addAndReadBack() {
        AddUserGrantResponse added = addViewer();

        assertThat(added.getDetails().getSequence()).isEqualTo(1);
        assertThat(added.getDetails().getResourceOwner()).isEqualTo(ORG_ID);

        var update = owner().updateUserGrant(UpdateUserGrantRequest.newBuilder()
                .setGrantId(added.getUserGrantId())
                .addRoleKeys("editor")
                .addRoleKeys("admin")
                .build());
        var grant = owner().getUserGrantByID(GetUserGrantByIDRequest.newBuilder()
                .setGrantId(added.getUserGrantId())
                .setMinSequence(update.getDetails().getSequence())
                .build()).getUserGrant();

        assertThat(grant.getRoleKeysList()).containsExactly("editor", "admin");
        assertThat(grant.getState()).isEqualTo(UserGrantState.USER_GRANT_STATE_ACTIVE);
        assertThat(grant.getSequence()).isEqualTo(2);
        assertThat(grant.getProjectId()).isEqualTo(PROJECT);
    }

    @Test
    @DisplayName("list filters by state and reports list details")
    void listByState() {
        String first = addViewer().getUserGrantId();
        addViewer();
        owner().deactivateUserGrant(DeactivateUserGrantRequest.newBuilder().setGrantId(first).build());

        await().atMost(Duration.ofSeconds(5)).until(() -> fixture.projector.lag() == 0);
        var response = owner().listUserGrants(ListUserGrantsRequest.newBuilder()
                .setQuery(ListQuery.newBuilder().setAsc(true).build())
                .addQueries(UserGrantQuery.newBuilder().setState(UserGrantState.USER_GRANT_STATE_INACTIVE))
                .build());

        assertThat(response.getResultList()).extracting(UserGrant::getId).containsExactly(first);
        assertThat(response.getDetails().getTotalResult()).isEqualTo(1);
        assertThat(response.getDetails().getProcessedSequence()).isEqualTo(3);
    }

    @Test
    @DisplayName("a project grant target is carried through to the stored grant")
    void addViaProjectGrant() {
        var added = owner().addUserGrant(AddUserGrantRequest.newBuilder()
                .setUserId(USER)
                .setProjectGrantId(PROJECT_GRANT)
                .addRoleKeys("viewer")
                .build());

        var grant = owner().getUserGrantByID(GetUserGrantByIDRequest.newBuilder()
                .setGrantId(added.getUserGrantId())
                .setMinSequence(1)
                .build()).getUserGrant();

        assertThat(grant.getProjectGrantId()).isEqualTo(PROJECT_GRANT);
        assertThat(grant.getProjectId()).isEqualTo(AccessServiceFixture.PARTNER_PROJECT);
    }

    @Test
    @DisplayName("bulk removal removes every listed grant")
    void bulkRemove() {
        String first = addViewer().getUserGrantId();
        String second = addViewer().getUserGrantId();

        owner().bulkRemoveUserGrant(BulkRemoveUserGrantRequest.newBuilder()
                .addGrantId(first)
                .addGrantId(second)
                .build());

        await().atMost(Duration.ofSeconds(5)).until(() -> fixture.projector.lag() == 0);
        assertThat(owner().listUserGrants(ListUserGrantsRequest.getDefaultInstance()).getResultCount()).isZero();
    }

    @Test
    @DisplayName("domain errors arrive as gRPC status codes with the message id trailer")
    void mapsErrors() {
        assertThatThrownBy(() -> owner().removeUserGrant(
                RemoveUserGrantRequest.newBuilder().setGrantId("missing").build()))
                .isInstanceOf(StatusRuntimeException.class)
                .satisfies(e -> {
                    var sre = (StatusRuntimeException) e;
                    assertThat(sre.getStatus().getCode()).isEqualTo(Status.Code.NOT_FOUND);
                    assertThat(sre.getTrailers().get(GrpcExceptionInterceptor.ERROR_ID_KEY))
                            .isEqualTo("USERGRANT-5m9Gq");
                });

        assertThatThrownBy(() -> stubFor(TestCallerContextFactory.loginClient()).addUserGrant(
                AddUserGrantRequest.newBuilder().setUserId(USER).setProjectId(PROJECT).addRoleKeys("viewer").build()))
                .isInstanceOf(StatusRuntimeException.class)
                .extracting(e -> ((StatusRuntimeException) e).getStatus().getCode())
                .isEqualTo(Status.Code.PERMISSION_DENIED);

        assertThatThrownBy(() -> owner().addUserGrant(
                AddUserGrantRequest.newBuilder().setUserId(USER).addRoleKeys("viewer").build()))
                .isInstanceOf(StatusRuntimeException.class)
                .extracting(e -> ((StatusRuntimeException) e).getStatus().getCode())
                .isEqualTo(Status.Code.INVALID_ARGUMENT);
    }

    @Test
    @DisplayName("a stale expected sequence aborts the update")
    void staleUpdateAborts() {
        String grantId = addViewer().getUserGrantId();
        owner().updateUserGrant(UpdateUserGrantRequest.newBuilder()
                .setGrantId(grantId).addRoleKeys("editor").setExpectedSequence(1).build());

        assertThatThrownBy(() -> owner().updateUserGrant(UpdateUserGrantRequest.newBuilder()
                .setGrantId(grantId).addRoleKeys("admin").setExpectedSequence(1).build()))
                .isInstanceOf(StatusRuntimeException.class)
                .extracting(e -> ((StatusRuntimeException) e).getStatus().getCode())
                .isEqualTo(Status.Code.ABORTED);
    }

    @Test
    @DisplayName("calls without caller context are unauthenticated")
    void unauthenticated() {
        assertThatThrownBy(() -> UserGrantServiceGrpc.newBlockingStub(channel)
                .removeUserGrant(RemoveUserGrantRequest.newBuilder().setGrantId("x").build()))
                .isInstanceOf(StatusRuntimeException.class)
                .extracting(e -> ((StatusRuntimeException) e).getStatus().getCode())
                .isEqualTo(Status.Code.UNAUTHENTICATED);
    }
}
