package com.bastion.accessservice.domain.command;

import com.bastion.accessservice.domain.error.AccessDeniedException;
import com.bastion.accessservice.domain.error.AccessException;
import com.bastion.accessservice.domain.error.ConflictException;
import com.bastion.accessservice.domain.error.DeadlineExceededException;
import com.bastion.accessservice.domain.error.InternalException;
import com.bastion.accessservice.domain.port.ConcurrentAppendException;
import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import com.bastion.observability.MetricFactory;
import com.bastion.observability.SpanHelper;
import com.bastion.security.CallerContext;
import com.bastion.security.Permission;
import com.bastion.security.PermissionDeniedException;
import com.bastion.security.PermissionEvaluator;
import com.bastion.security.ResourceScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single entry point for every command and query.
 * <p>
 * For each call, in order: the caller's deadline is checked, the permission is evaluated on the
 * given scope (nothing is read on denial), then the work runs inside a span with its duration and
 * outcome recorded. Store-level concurrency conflicts surface as {@link ConflictException} and any
 * unexpected failure as {@link InternalException}.
 */
public class CommandDispatcher {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String COMMANDS_METRIC = "bastion.commands";
    static final String DURATION_METRIC = "bastion.command.duration";

    private enum Kind { COMMAND, QUERY }

    private final Clock clock;
    private final MetricFactory metrics;
    private final SpanHelper spans;

    public CommandDispatcher(Clock clock, MetricFactory metrics, SpanHelper spans) {
        this.clock = clock;
        this.metrics = metrics;
        this.spans = spans;
    }

    /** Runs a state-changing operation. */
    public <T> T execute(String operation, CallerContext caller, Permission permission,
                         ResourceScope scope, Supplier<T> work) {
        return dispatch(Kind.COMMAND, operation, caller, permission, scope, work);
    }

    /** Runs a read-only operation. */
    public <T> T query(String operation, CallerContext caller, Permission permission,
                       ResourceScope scope, Supplier<T> work) {
        return dispatch(Kind.QUERY, operation, caller, permission, scope, work);
    }

    /**
     * Fails if the caller's deadline has passed. Commands call this right before they append.
     *
     * @throws DeadlineExceededException when the deadline has passed
     */
    public void checkDeadline(CallerContext caller) {
        if (caller.deadlineExpired(clock.instant())) {
            throw new DeadlineExceededException("COMMAND-Dl4sE", "deadline exceeded");
        }
    }

    private <T> T dispatch(Kind kind, String operation, CallerContext caller, Permission permission,
                           ResourceScope scope, Supplier<T> work) {
        Objects.requireNonNull(caller, "caller must not be null");
        return CorrelationContextHolder.callWithContext(correlationOf(caller),
                () -> observed(kind, operation, caller, permission, scope, work));
    }

    private <T> T observed(Kind kind, String operation, CallerContext caller, Permission permission,
                           ResourceScope scope, Supplier<T> work) {
        long start = System.nanoTime();
        String outcome = "ok";
        try {
            checkDeadline(caller);
            authorize(caller, permission, scope);
            T result = spans.withSpan("bastion." + operation,
                    Map.of("bastion.operation", operation, "bastion.permission", permission.value()),
                    work);
            if (kind == Kind.COMMAND) {
                log.info("{} succeeded", operation);
            } else {
                log.debug("{} succeeded", operation);
            }
            return result;
        } catch (ConcurrentAppendException e) {
            outcome = "conflict";
            log.warn("{} rejected: {}", operation, e.getMessage());
            throw new ConflictException("COMMAND-0p9Ul", "the object was modified concurrently", e);
        } catch (AccessException e) {
            outcome = e.code().name().toLowerCase();
            if (e.code().clientError()) {
                log.warn("{} rejected [{}]: {}", operation, e.messageId(), e.getMessage());
            } else {
                log.error("{} failed [{}]", operation, e.messageId(), e);
            }
            throw e;
        } catch (RuntimeException e) {
            outcome = "internal";
            log.error("{} failed unexpectedly", operation, e);
            throw new InternalException("COMMAND-9sk2L", "internal error", e);
        } finally {
            metrics.timer(DURATION_METRIC, "Command and query latency",
                            "operation", operation, "kind", kind.name().toLowerCase())
                    .record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            metrics.counter(COMMANDS_METRIC, "Commands and queries by outcome",
                            "operation", operation, "kind", kind.name().toLowerCase(), "outcome", outcome)
                    .increment();
        }
    }

    private static void authorize(CallerContext caller, Permission permission, ResourceScope scope) {
        try {
            PermissionEvaluator.check(caller, permission, scope);
        } catch (PermissionDeniedException e) {
            throw new AccessDeniedException("AUTHZ-HKJD33", e.getMessage(), e);
        }
    }

    private static CorrelationContext correlationOf(CallerContext caller) {
        String correlationId = caller.correlationId();
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = CorrelationContextHolder.get()
                    .map(CorrelationContext::correlationId)
                    .orElseGet(() -> UUID.randomUUID().toString());
        }
        String requestId = CorrelationContextHolder.get().map(CorrelationContext::requestId).orElse(null);
        return new CorrelationContext(correlationId, caller.instanceId(), caller.organizationId(),
                caller.userId(), requestId);
    }
}
