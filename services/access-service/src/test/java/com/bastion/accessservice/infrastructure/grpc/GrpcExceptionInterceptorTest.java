package com.bastion.accessservice.infrastructure.grpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.bastion.accessservice.domain.error.AccessDeniedException;
import com.bastion.accessservice.domain.error.AccessException;
import com.bastion.accessservice.domain.error.ConflictException;
import com.bastion.accessservice.domain.error.DeadlineExceededException;
import com.bastion.accessservice.domain.error.FailedPreconditionException;
import com.bastion.accessservice.domain.error.InternalException;
import com.bastion.accessservice.domain.error.InvalidArgumentException;
import com.bastion.accessservice.domain.error.NotFoundException;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.Status;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

/**
 * Unit tests for {@link GrpcExceptionInterceptor}.
 */
@DisplayName("GrpcExceptionInterceptor")
class GrpcExceptionInterceptorTest {

    private final GrpcExceptionInterceptor interceptor = new GrpcExceptionInterceptor();

    static Stream<Arguments> accessErrors() {
        return Stream.of(
                Arguments.of(new AccessDeniedException("AUTHZ-1", "denied"), Status.Code.PERMISSION_DENIED),
                Arguments.of(new InvalidArgumentException("ARG-1", "bad"), Status.Code.INVALID_ARGUMENT),
                Arguments.of(new NotFoundException("NF-1", "gone"), Status.Code.NOT_FOUND),
                Arguments.of(new FailedPreconditionException("FP-1", "not now"), Status.Code.FAILED_PRECONDITION),
                Arguments.of(new ConflictException("CF-1", "stale"), Status.Code.ABORTED),
                Arguments.of(new DeadlineExceededException("DL-1", "late"), Status.Code.DEADLINE_EXCEEDED));
    }

    @ParameterizedTest(name = "{1}")
    @MethodSource("accessErrors")
    @DisplayName("maps each client error to its status and exposes the message id")
    void mapsClientErrors(AccessException error, Status.Code expected) {
        var trailers = new Metadata();

        Status status = interceptor.mapException(error, trailers);

        assertThat(status.getCode()).isEqualTo(expected);
        assertThat(status.getDescription()).isEqualTo(error.getMessage());
        assertThat(trailers.get(GrpcExceptionInterceptor.ERROR_ID_KEY)).isEqualTo(error.messageId());
    }

    @Test
    @DisplayName("internal errors hide their message but keep the message id")
    void mapsInternal() {
        var trailers = new Metadata();

        Status status = interceptor.mapException(
                new InternalException("COMMAND-9sk2L", "database password leaked"), trailers);

        assertThat(status.getCode()).isEqualTo(Status.Code.INTERNAL);
        assertThat(status.getDescription()).isEqualTo("Internal server error");
        assertThat(trailers.get(GrpcExceptionInterceptor.ERROR_ID_KEY)).isEqualTo("COMMAND-9sk2L");
    }

    @Test
    @DisplayName("maps IllegalArgumentException to INVALID_ARGUMENT")
    void mapsIllegalArgumentToInvalidArgument() {
        Status status = interceptor.mapException(new IllegalArgumentException("bad input"), new Metadata());

        assertThat(status.getCode()).isEqualTo(Status.Code.INVALID_ARGUMENT);
        assertThat(status.getDescription()).isEqualTo("bad input");
    }

    @Test
    @DisplayName("keeps the status of a StatusRuntimeException")
    void keepsStatusRuntimeException() {
        Status status = interceptor.mapException(
                Status.UNAUTHENTICATED.withDescription("who are you").asRuntimeException(), new Metadata());

        assertThat(status.getCode()).isEqualTo(Status.Code.UNAUTHENTICATED);
    }

    @Test
    @DisplayName("maps unknown Exception to INTERNAL")
    void mapsUnknownExceptionToInternal() {
        Status status = interceptor.mapException(new RuntimeException("oops"), new Metadata());

        assertThat(status.getCode()).isEqualTo(Status.Code.INTERNAL);
        assertThat(status.getDescription()).isEqualTo("Internal server error");
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("closes the call with the mapped status when the handler throws")
    void closesCallOnHandlerFailure() {
        ServerCall<String, String> call = mock(ServerCall.class);
        ServerCallHandler<String, String> handler = mock(ServerCallHandler.class);
        when(handler.startCall(any(), any())).thenReturn(new ServerCall.Listener<>() {
            @Override
            public void onHalfClose() {
                throw new NotFoundException("QUERY-4Fm9s", "user grant not found");
            }
        });

        ServerCall.Listener<String> listener = interceptor.interceptCall(call, new Metadata(), handler);
        listener.onHalfClose();

        verify(call).close(argThat(status -> status.getCode() == Status.Code.NOT_FOUND),
                argThat(trailers -> "QUERY-4Fm9s".equals(trailers.get(GrpcExceptionInterceptor.ERROR_ID_KEY))));
    }
}
