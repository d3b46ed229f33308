package com.bastion.observability;

/**
 * Immutable correlation context that flows with a request through the command and query paths.
 * <p>
 * Every incoming call establishes a {@code CorrelationContext}. Its values are injected into
 * SLF4J MDC for automatic inclusion in log output and attached to spans.
 *
 * @param correlationId unique ID for the business flow
 * @param instanceId    instance the request targets
 * @param orgId         organization of the caller (nullable for instance-level system work)
 * @param userId        authenticated user performing the action (nullable for system work)
 * @param requestId     unique ID for this specific call
 */
public record CorrelationContext(
        String correlationId,
        String instanceId,
        String orgId,
        String userId,
        String requestId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_INSTANCE_ID = "instanceId";
    public static final String MDC_ORG_ID = "orgId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
