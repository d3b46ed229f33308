package com.bastion.accessservice.infrastructure.grpc;

import static com.bastion.accessservice.AccessServiceFixture.INSTANCE_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import com.bastion.accessservice.AccessServiceFixture;
import com.bastion.accessservice.domain.idp.AutoLinkingOption;
import com.bastion.accessservice.domain.idp.IdentityProviderType;
import com.bastion.accessservice.infrastructure.idp.EventSourcedIdentityProviderRegistry.Definition;
import com.bastion.security.CallerContext;
import com.bastion.security.CallerContextSerializer;
import com.bastion.security.testing.TestCallerContextFactory;
import com.bastion.settings.v1.AllowedOrigins;
import com.bastion.settings.v1.GetActiveIdentityProvidersRequest;
import com.bastion.settings.v1.GetSecuritySettingsRequest;
import com.bastion.settings.v1.IdentityProvider;
import com.bastion.settings.v1.SetSecuritySettingsRequest;
import com.bastion.settings.v1.SettingsServiceGrpc;
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

@DisplayName("SettingsGrpcService over gRPC")
class SettingsGrpcServiceTest {

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
                        new SettingsGrpcService(fixture.securitySettings, fixture.settingsQueries),
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

    private SettingsServiceGrpc.SettingsServiceBlockingStub stubFor(CallerContext caller) {
        var headers = new Metadata();
        headers.put(CallerContextInterceptor.CALLER_CONTEXT_KEY, CallerContextSerializer.serialize(caller));
        return SettingsServiceGrpc.newBlockingStub(channel)
                .withInterceptors(MetadataUtils.newAttachHeadersInterceptor(headers));
    }

    private void awaitProjection() {
        await().atMost(Duration.ofSeconds(5)).until(() -> fixture.projector.lag() == 0);
    }

    @Test
    @DisplayName("a partial update keeps the fields it does not mention")
    void partialUpdate() {
        var admin = stubFor(TestCallerContextFactory.iamOwner());
        admin.setSecuritySettings(SetSecuritySettingsRequest.newBuilder()
                .setEmbeddedIframeEnabled(true)
                .setAllowedOrigins(AllowedOrigins.newBuilder().addOrigins("https://a.example"))
                .build());
        var details = admin.setSecuritySettings(SetSecuritySettingsRequest.newBuilder()
                .setEnableImpersonation(true)
                .build()).getDetails();
        awaitProjection();

        var settings = admin.getSecuritySettings(GetSecuritySettingsRequest.getDefaultInstance()).getSettings();

        assertThat(details.getSequence()).isEqualTo(2);
        assertThat(settings.getEmbeddedIframe().getEnabled()).isTrue();
        assertThat(settings.getEmbeddedIframe().getAllowedOriginsList()).containsExactly("https://a.example");
        assertThat(settings.getEnableImpersonation()).isTrue();
        assertThat(settings.getDetails().getResourceOwner()).isEqualTo(INSTANCE_ID);
    }

    @Test
    @DisplayName("duplicate origins are an invalid argument")
    void duplicateOrigins() {
        var admin = stubFor(TestCallerContextFactory.iamOwner());

        assertThatThrownBy(() -> admin.setSecuritySettings(SetSecuritySettingsRequest.newBuilder()
                .setAllowedOrigins(AllowedOrigins.newBuilder()
                        .addOrigins("https://a.example")
                        .addOrigins("https://a.example"))
                .build()))
                .isInstanceOf(StatusRuntimeException.class)
                .extracting(e -> ((StatusRuntimeException) e).getStatus().getCode())
                .isEqualTo(Status.Code.INVALID_ARGUMENT);
    }

    @Test
    @DisplayName("organization owners cannot read instance settings")
    void orgOwnerDenied() {
        assertThatThrownBy(() -> stubFor(TestCallerContextFactory.orgOwner("test-org"))
                .getSecuritySettings(GetSecuritySettingsRequest.getDefaultInstance()))
                .isInstanceOf(StatusRuntimeException.class)
                .extracting(e -> ((StatusRuntimeException) e).getStatus().getCode())
                .isEqualTo(Status.Code.PERMISSION_DENIED);
    }

    @Test
    @DisplayName("active identity providers honour the request predicates")
    void activeIdentityProviders() {
        fixture.identityProviders.addActive(INSTANCE_ID, new Definition("Google", IdentityProviderType.GOOGLE,
                true, true, true, false, AutoLinkingOption.EMAIL));
        fixture.identityProviders.addActive(INSTANCE_ID, new Definition("LDAP", IdentityProviderType.LDAP,
                false, true, false, false, AutoLinkingOption.UNSPECIFIED));
        awaitProjection();
        var owner = stubFor(TestCallerContextFactory.orgOwner("test-org"));

        var all = owner.getActiveIdentityProviders(GetActiveIdentityProvidersRequest.getDefaultInstance());
        var linking = owner.getActiveIdentityProviders(GetActiveIdentityProvidersRequest.newBuilder()
                .setLinkingAllowed(true)
                .build());

        assertThat(all.getIdentityProvidersList()).extracting(IdentityProvider::getName)
                .containsExactly("Google", "LDAP");
        assertThat(all.getDetails().getTotalResult()).isEqualTo(2);
        assertThat(linking.getIdentityProvidersList()).singleElement().satisfies(idp -> {
            assertThat(idp.getType()).isEqualTo(com.bastion.settings.v1.IdentityProviderType.IDENTITY_PROVIDER_TYPE_GOOGLE);
            assertThat(idp.getOptions().getIsAutoLinking()).isTrue();
        });
    }
}
