package com.bastion.accessservice.infrastructure.grpc;

import com.bastion.accessservice.domain.idp.ProviderPredicates;
import com.bastion.accessservice.domain.query.SettingsQueries;
import com.bastion.accessservice.domain.settings.SecuritySettingsAggregate;
import com.bastion.accessservice.domain.settings.SecuritySettingsUpdate;
import com.bastion.settings.v1.GetActiveIdentityProvidersRequest;
import com.bastion.settings.v1.GetActiveIdentityProvidersResponse;
import com.bastion.settings.v1.GetSecuritySettingsRequest;
import com.bastion.settings.v1.GetSecuritySettingsResponse;
import com.bastion.settings.v1.SetSecuritySettingsRequest;
import com.bastion.settings.v1.SetSecuritySettingsResponse;
import com.bastion.settings.v1.SettingsServiceGrpc;
import io.grpc.stub.StreamObserver;

import java.util.Optional;

/**
 * gRPC adapter of the settings aggregate and queries.
 */
public class SettingsGrpcService extends SettingsServiceGrpc.SettingsServiceImplBase {

    private final SecuritySettingsAggregate settings;
    private final SettingsQueries queries;

    public SettingsGrpcService(SecuritySettingsAggregate settings, SettingsQueries queries) {
        this.settings = settings;
        this.queries = queries;
    }

    @Override
    public void getSecuritySettings(GetSecuritySettingsRequest request,
                                    StreamObserver<GetSecuritySettingsResponse> responseObserver) {
        var current = queries.getSecuritySettings(CallerContextInterceptor.current());
        responseObserver.onNext(GetSecuritySettingsResponse.newBuilder()
                .setSettings(GrpcMappers.securitySettings(current))
                .build());
        responseObserver.onCompleted();
    }

    @Override
    public void setSecuritySettings(SetSecuritySettingsRequest request,
                                    StreamObserver<SetSecuritySettingsResponse> responseObserver) {
        var update = new SecuritySettingsUpdate(
                request.hasEmbeddedIframeEnabled() ? Optional.of(request.getEmbeddedIframeEnabled()) : Optional.empty(),
                request.hasAllowedOrigins()
                        ? Optional.of(request.getAllowedOrigins().getOriginsList())
                        : Optional.empty(),
                request.hasEnableImpersonation() ? Optional.of(request.getEnableImpersonation()) : Optional.empty());
        var details = settings.set(CallerContextInterceptor.current(), update);
        responseObserver.onNext(SetSecuritySettingsResponse.newBuilder()
                .setDetails(GrpcMappers.details(details))
                .build());
        responseObserver.onCompleted();
    }

    @Override
    public void getActiveIdentityProviders(GetActiveIdentityProvidersRequest request,
                                           StreamObserver<GetActiveIdentityProvidersResponse> responseObserver) {
        var predicates = new ProviderPredicates(
                request.hasCreationAllowed() ? Optional.of(request.getCreationAllowed()) : Optional.empty(),
                request.hasLinkingAllowed() ? Optional.of(request.getLinkingAllowed()) : Optional.empty(),
                request.hasAutoCreation() ? Optional.of(request.getAutoCreation()) : Optional.empty(),
                request.hasAutoLinking() ? Optional.of(request.getAutoLinking()) : Optional.empty());
        var result = queries.getActiveIdentityProviders(CallerContextInterceptor.current(), predicates);
        var response = GetActiveIdentityProvidersResponse.newBuilder()
                .setDetails(GrpcMappers.listDetails(result.totalCount(), 0, result.timestamp()));
        result.providers().forEach(p -> response.addIdentityProviders(GrpcMappers.identityProvider(p)));
        responseObserver.onNext(response.build());
        responseObserver.onCompleted();
    }
}
