package com.kubelab.observability;

/**
 * Immutable per-request context used for log correlation.
 * <p>
 * Every inbound HTTP request establishes a {@code CorrelationContext}. The correlation ID is
 * echoed back to the client and written to SLF4J MDC so every log line of the request carries
 * it. Once a bearer token has been verified the authenticated username is added as well.
 *
 * @param correlationId unique ID for the request, propagated from the client when supplied
 * @param userId        authenticated username (nullable until the caller is authenticated)
 */
public record CorrelationContext(String correlationId, String userId) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for user ID.
     */
    public static final String MDC_USER_ID = "userId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context for an anonymous request.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null);
    }

    /**
     * Returns a copy of this context bound to the given user.
     */
    public CorrelationContext withUserId(String userId) {
        return new CorrelationContext(correlationId, userId);
    }
}
