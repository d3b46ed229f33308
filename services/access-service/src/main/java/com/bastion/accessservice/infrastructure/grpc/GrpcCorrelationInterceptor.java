package com.bastion.accessservice.infrastructure.grpc;

import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;

import java.util.UUID;

/**
 * Propagates correlation IDs from gRPC metadata.
 *
 * <p>When a call arrives, this interceptor:
 *
 * <ol>
 *   <li>Extracts {@code x-correlation-id} from the metadata, generating a UUID if absent
 *   <li>Stores it in the gRPC {@link Context} for the rest of the interceptor chain
 *   <li>Sets the {@link CorrelationContextHolder} around every listener callback, whichever thread
 *       runs it, and clears it afterwards
 *   <li>Echoes the ID in the response headers
 * </ol>
 */
public class GrpcCorrelationInterceptor implements ServerInterceptor {

    public static final Metadata.Key<String> CORRELATION_ID_KEY =
            Metadata.Key.of("x-correlation-id", Metadata.ASCII_STRING_MARSHALLER);

    public static final Context.Key<String> CORRELATION_ID = Context.key("bastion-correlation-id");

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String header = headers.get(CORRELATION_ID_KEY);
        String correlationId = header == null || header.isBlank() ? UUID.randomUUID().toString() : header;
        var correlation = new CorrelationContext(correlationId, null, null, null, UUID.randomUUID().toString());

        ServerCall<ReqT, RespT> echoingCall = new ForwardingServerCall.SimpleForwardingServerCall<>(call) {
            @Override
            public void sendHeaders(Metadata responseHeaders) {
                responseHeaders.put(CORRELATION_ID_KEY, correlationId);
                super.sendHeaders(responseHeaders);
            }
        };

        Context context = Context.current().withValue(CORRELATION_ID, correlationId);
        ServerCall.Listener<ReqT> delegate = CorrelationContextHolder.callWithContext(correlation,
                () -> Contexts.interceptCall(context, echoingCall, headers, next));

        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onMessage(ReqT message) {
                CorrelationContextHolder.runWithContext(correlation, () -> super.onMessage(message));
            }

            @Override
            public void onHalfClose() {
                CorrelationContextHolder.runWithContext(correlation, super::onHalfClose);
            }

            @Override
            public void onCancel() {
                CorrelationContextHolder.runWithContext(correlation, super::onCancel);
            }

            @Override
            public void onComplete() {
                CorrelationContextHolder.runWithContext(correlation, super::onComplete);
            }

            @Override
            public void onReady() {
                CorrelationContextHolder.runWithContext(correlation, super::onReady);
            }
        };
    }
}
