package com.kubelab.api.infrastructure.web;

import com.kubelab.observability.HttpRequestMetrics;
import com.kubelab.observability.InFlightRequest;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Observes every HTTP request for {@link HttpRequestMetrics}.
 *
 * <p>On entry the in-flight gauge goes up and a start time is taken. On exit the completion
 * counter is incremented for {@code (method, endpoint, status_code)} and the elapsed time is
 * recorded, then the gauge goes down again. {@code endpoint} is the matched route template such
 * as {@code /auth/login}; requests no handler matched use the raw request path.
 *
 * <p>For async requests the exit happens when the async cycle ends, whether it completes, times
 * out or fails because the client went away. An exception escaping the chain is recorded as 500
 * and rethrown.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestMetricsFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestMetricsFilter.class);

    private final HttpRequestMetrics metrics;

    public RequestMetricsFilter(HttpRequestMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        InFlightRequest inFlight = metrics.begin();
        boolean handedOff = false;
        try {
            filterChain.doFilter(request, response);
            if (request.isAsyncStarted()) {
                request.getAsyncContext()
                        .addListener(new CompletionListener(inFlight, request, response));
                handedOff = true;
            } else {
                inFlight.complete(request.getMethod(), endpoint(request), response.getStatus());
            }
        } catch (IOException | ServletException | RuntimeException e) {
            inFlight.complete(
                    request.getMethod(), endpoint(request), HttpStatus.INTERNAL_SERVER_ERROR.value());
            throw e;
        } finally {
            if (!handedOff) {
                inFlight.close();
            }
        }
    }

    static String endpoint(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : request.getRequestURI();
    }

    /** Records and releases an async request once its cycle ends. */
    private static final class CompletionListener implements AsyncListener {

        private final InFlightRequest inFlight;
        private final HttpServletRequest request;
        private final HttpServletResponse response;

        CompletionListener(
                InFlightRequest inFlight, HttpServletRequest request, HttpServletResponse response) {
            this.inFlight = inFlight;
            this.request = request;
            this.response = response;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            try {
                inFlight.complete(request.getMethod(), endpoint(request), response.getStatus());
            } finally {
                inFlight.close();
            }
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            log.debug("Async request timed out: {} {}", request.getMethod(), request.getRequestURI());
        }

        @Override
        public void onError(AsyncEvent event) {
            // onComplete follows; record the failure status unless a response was already written.
            log.debug("Async request failed: {} {}", request.getMethod(), request.getRequestURI(),
                    event.getThrowable());
            if (!inFlight.isCompleted() && !response.isCommitted()) {
                inFlight.complete(
                        request.getMethod(), endpoint(request), HttpStatus.INTERNAL_SERVER_ERROR.value());
            }
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            event.getAsyncContext().addListener(this);
        }
    }
}
