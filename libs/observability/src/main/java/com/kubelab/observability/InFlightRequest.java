package com.kubelab.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for one request being observed by {@link HttpRequestMetrics}.
 * <p>
 * {@link #complete} records the outcome at most once and never throws: a failure while
 * recording is logged and dropped so the response is still delivered. {@link #close}
 * decrements the in-flight gauge at most once, which lets a synchronous caller use
 * try-with-resources and an asynchronous caller release from a completion callback.
 */
public final class InFlightRequest implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InFlightRequest.class);

    private final HttpRequestMetrics metrics;
    private final long startNanos;
    private final AtomicBoolean recorded = new AtomicBoolean();
    private final AtomicBoolean released = new AtomicBoolean();

    InFlightRequest(HttpRequestMetrics metrics, long startNanos) {
        this.metrics = metrics;
        this.startNanos = startNanos;
    }

    /**
     * Records the completion of this request.
     *
     * @param method     HTTP method
     * @param endpoint   route template, or the raw path when no route matched
     * @param statusCode final HTTP status code
     */
    public void complete(String method, String endpoint, int statusCode) {
        if (!recorded.compareAndSet(false, true)) {
            return;
        }
        try {
            metrics.record(method, endpoint, statusCode, startNanos);
        } catch (RuntimeException e) {
            log.warn("Failed to record request metrics: method={} endpoint={} status={}",
                    method, endpoint, statusCode, e);
        }
    }

    /**
     * Returns whether {@link #complete} has already been called.
     */
    public boolean isCompleted() {
        return recorded.get();
    }

    /**
     * Decrements the in-flight gauge. Idempotent.
     */
    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            metrics.release();
        }
    }
}
