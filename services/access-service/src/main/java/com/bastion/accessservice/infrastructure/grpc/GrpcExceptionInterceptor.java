package com.bastion.accessservice.infrastructure.grpc;

import com.bastion.accessservice.domain.error.AccessException;
import io.grpc.ForwardingServerCall;
import io.grpc.ForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Maps exceptions thrown by service implementations to gRPC status codes.
 *
 * <ul>
 *   <li>{@link AccessException} → the status of its error code, with the message id in the
 *       {@code x-error-id} trailer
 *   <li>{@link IllegalArgumentException} → {@code INVALID_ARGUMENT}
 *   <li>{@link StatusRuntimeException} → its own status
 *   <li>anything else → {@code INTERNAL}
 * </ul>
 */
public class GrpcExceptionInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(GrpcExceptionInterceptor.class);

    public static final Metadata.Key<String> ERROR_ID_KEY =
            Metadata.Key.of("x-error-id", Metadata.ASCII_STRING_MARSHALLER);

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        var closed = new AtomicBoolean();
        ServerCall<ReqT, RespT> trackingCall = new ForwardingServerCall.SimpleForwardingServerCall<>(call) {
            @Override
            public void close(Status status, Metadata trailers) {
                if (status.getCode() == Status.Code.UNKNOWN && status.getCause() != null) {
                    status = mapException(status.getCause(), trailers);
                }
                if (closed.compareAndSet(false, true)) {
                    super.close(status, trailers);
                }
            }
        };

        ServerCall.Listener<ReqT> delegate = next.startCall(trackingCall, headers);
        return new ForwardingServerCallListener.SimpleForwardingServerCallListener<>(delegate) {
            @Override
            public void onMessage(ReqT message) {
                try {
                    super.onMessage(message);
                } catch (RuntimeException e) {
                    fail(e);
                }
            }

            @Override
            public void onHalfClose() {
                try {
                    super.onHalfClose();
                } catch (RuntimeException e) {
                    fail(e);
                }
            }

            private void fail(RuntimeException e) {
                var trailers = new Metadata();
                trackingCall.close(mapException(e, trailers), trailers);
            }
        };
    }

    /** Maps an exception to a status, adding error trailers. Package-private for testing. */
    Status mapException(Throwable throwable, Metadata trailers) {
        if (throwable instanceof AccessException access) {
            trailers.put(ERROR_ID_KEY, access.messageId());
            if (!access.code().clientError()) {
                log.error("gRPC internal error [{}]", access.messageId(), access);
                return Status.INTERNAL.withDescription("Internal server error").withCause(access);
            }
            log.warn("gRPC call rejected [{}]: {}", access.messageId(), access.getMessage());
            return statusOf(access).withDescription(access.getMessage()).withCause(access);
        }
        if (throwable instanceof IllegalArgumentException) {
            log.warn("gRPC bad request: {}", throwable.getMessage());
            return Status.INVALID_ARGUMENT.withDescription(throwable.getMessage()).withCause(throwable);
        }
        if (throwable instanceof StatusRuntimeException sre) {
            return sre.getStatus();
        }
        log.error("gRPC internal error", throwable);
        return Status.INTERNAL.withDescription("Internal server error").withCause(throwable);
    }

    private static Status statusOf(AccessException e) {
        return switch (e.code()) {
            case PERMISSION_DENIED -> Status.PERMISSION_DENIED;
            case INVALID_ARGUMENT -> Status.INVALID_ARGUMENT;
            case NOT_FOUND -> Status.NOT_FOUND;
            case FAILED_PRECONDITION -> Status.FAILED_PRECONDITION;
            case CONFLICT -> Status.ABORTED;
            case DEADLINE_EXCEEDED -> Status.DEADLINE_EXCEEDED;
            case INTERNAL -> Status.INTERNAL;
        };
    }
}
