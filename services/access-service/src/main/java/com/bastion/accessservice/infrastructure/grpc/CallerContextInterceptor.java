package com.bastion.accessservice.infrastructure.grpc;

import com.bastion.security.CallerContext;
import com.bastion.security.CallerContextSerializer;
import com.bastion.security.CallerContextValidator;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Deadline;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Reads the pre-authenticated caller from the {@code x-caller-context} metadata entry and makes it
 * available to the service implementations through {@link #current()}.
 * <p>
 * Calls without a well-formed caller context are closed with {@code UNAUTHENTICATED} before they
 * reach a service. The call's gRPC deadline, if any, becomes the caller's deadline.
 */
public class CallerContextInterceptor implements ServerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(CallerContextInterceptor.class);

    public static final Metadata.Key<String> CALLER_CONTEXT_KEY =
            Metadata.Key.of("x-caller-context", Metadata.ASCII_STRING_MARSHALLER);

    static final Context.Key<CallerContext> CALLER = Context.key("bastion-caller");

    private final Clock clock;

    public CallerContextInterceptor(Clock clock) {
        this.clock = clock;
    }

    /**
     * The caller of the current call.
     *
     * @throws StatusRuntimeException with {@code UNAUTHENTICATED} outside an intercepted call
     */
    public static CallerContext current() {
        CallerContext caller = CALLER.get();
        if (caller == null) {
            throw Status.UNAUTHENTICATED.withDescription("no caller context").asRuntimeException();
        }
        return caller;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
            ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {

        String encoded = headers.get(CALLER_CONTEXT_KEY);
        if (encoded == null || encoded.isBlank()) {
            return reject(call, "missing caller context");
        }

        CallerContext caller;
        try {
            caller = CallerContextSerializer.deserialize(encoded);
        } catch (CallerContextSerializer.SecuritySerializationException e) {
            log.warn("Unreadable caller context: {}", e.getMessage());
            return reject(call, "invalid caller context");
        }
        var validation = CallerContextValidator.validate(caller);
        if (!validation.valid()) {
            log.warn("Incomplete caller context: {}", validation.errors());
            return reject(call, "invalid caller context");
        }

        caller = withCallScope(caller);
        Context context = Context.current().withValue(CALLER, caller);
        return Contexts.interceptCall(context, call, headers, next);
    }

    private CallerContext withCallScope(CallerContext caller) {
        String correlationId = GrpcCorrelationInterceptor.CORRELATION_ID.get();
        if (correlationId != null && (caller.correlationId() == null || caller.correlationId().isBlank())) {
            caller = new CallerContext(caller.user(), caller.tenant(), caller.memberships(), correlationId,
                    caller.deadline());
        }
        Deadline deadline = Context.current().getDeadline();
        if (deadline != null) {
            var callDeadline = clock.instant().plusNanos(deadline.timeRemaining(TimeUnit.NANOSECONDS));
            if (caller.deadline() == null || callDeadline.isBefore(caller.deadline())) {
                caller = caller.withDeadline(callDeadline);
            }
        }
        return caller;
    }

    private static <ReqT, RespT> ServerCall.Listener<ReqT> reject(ServerCall<ReqT, RespT> call, String reason) {
        call.close(Status.UNAUTHENTICATED.withDescription(reason), new Metadata());
        return new ServerCall.Listener<>() {
        };
    }
}
