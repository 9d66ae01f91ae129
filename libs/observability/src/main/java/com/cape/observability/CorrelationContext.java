package com.cape.observability;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable correlation context for one request against the policy agent.
 * <p>
 * Established at the edge (HTTP filter) and injected into SLF4J MDC so every log line written
 * while the request runs carries the same identifiers.
 *
 * @param correlationId unique ID of the caller's business flow, propagated from the caller when given
 * @param requestId     unique ID of this request (one correlation may span several requests)
 * @param route         the request's method and path, e.g. {@code POST /api/v1/object} (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String route
) {

    /**
     * MDC key for correlation ID.
     */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * MDC key for route.
     */
    public static final String MDC_ROUTE = "route";

    /** Every MDC key this context writes, in log-pattern order. */
    public static final List<String> MDC_KEYS =
            List.of(MDC_CORRELATION_ID, MDC_REQUEST_ID, MDC_ROUTE);

    /**
     * Rejects a null or blank correlationId.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Returns the non-null fields keyed by their MDC key.
     */
    public Map<String, String> mdcEntries() {
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put(MDC_CORRELATION_ID, correlationId);
        if (requestId != null) {
            entries.put(MDC_REQUEST_ID, requestId);
        }
        if (route != null) {
            entries.put(MDC_ROUTE, route);
        }
        return entries;
    }
}
