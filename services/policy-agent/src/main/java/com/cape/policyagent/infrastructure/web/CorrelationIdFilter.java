package com.cape.policyagent.infrastructure.web;

import com.cape.observability.CorrelationContext;
import com.cape.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that establishes the {@link CorrelationContext} of every HTTP request.
 *
 * <ol>
 *   <li>{@code X-Correlation-ID} is propagated from the caller, or generated when absent
 *   <li>{@code X-Request-ID} is generated per request
 *   <li>the route is the request method and path
 * </ol>
 *
 * <p>All three land in the SLF4J MDC through {@link CorrelationContextHolder} and both ids are
 * echoed as response headers. Runs at {@link Ordered#HIGHEST_PRECEDENCE}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        String requestId = UUID.randomUUID().toString();
        String route = request.getMethod() + " " + request.getRequestURI();

        CorrelationContextHolder.set(new CorrelationContext(correlationId, requestId, route));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
