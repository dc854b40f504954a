package com.kubelab.api.infrastructure.web;

import com.kubelab.observability.CorrelationContext;
import com.kubelab.observability.CorrelationContextHolder;
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
 * Binds a correlation ID to every HTTP request.
 *
 * <p>The ID comes from the {@code X-Correlation-ID} request header when present and at most 128
 * characters long, otherwise a random UUID is assigned. It is stored as a request attribute so
 * that an async re-dispatch of the same request (a completed or timed out {@code DeferredResult})
 * binds the same ID again, and error bodies written on that dispatch still carry it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final String CORRELATION_ID_ATTRIBUTE = CorrelationIdFilter.class.getName() + ".correlationId";

    private static final int MAX_LENGTH = 128;

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String correlationId = resolve(request);
        request.setAttribute(CORRELATION_ID_ATTRIBUTE, correlationId);
        if (!response.isCommitted()) {
            response.setHeader(CORRELATION_ID_HEADER, correlationId);
        }

        CorrelationContextHolder.set(CorrelationContext.of(correlationId));
        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    private static String resolve(HttpServletRequest request) {
        if (request.getAttribute(CORRELATION_ID_ATTRIBUTE) instanceof String bound) {
            return bound;
        }
        String header = request.getHeader(CORRELATION_ID_HEADER);
        if (header == null || header.isBlank() || header.length() > MAX_LENGTH) {
            return UUID.randomUUID().toString();
        }
        return header;
    }
}
