package com.kubelab.observability;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide HTTP request metrics: a completion counter keyed by method, endpoint and
 * status code, a single latency histogram and an in-flight gauge.
 * <p>
 * Exposed in the Prometheus text format as {@code http_requests_total},
 * {@code http_request_duration_seconds} and {@code active_connections}. These names are
 * scraped by existing dashboards and must not change.
 * <p>
 * Every operation is thread-safe on its own. There is no consistency across meters: a reader
 * may see the counter updated before the histogram.
 */
public final class HttpRequestMetrics {

    /** Completion counter; Prometheus appends {@code _total}. */
    public static final String REQUESTS_TOTAL = "http.requests";

    /** Latency histogram; Prometheus appends the {@code _seconds} base unit. */
    public static final String REQUEST_DURATION = "http.request.duration";

    /** In-flight gauge. */
    public static final String ACTIVE_CONNECTIONS = "active.connections";

    public static final String TAG_METHOD = "method";
    public static final String TAG_ENDPOINT = "endpoint";
    public static final String TAG_STATUS_CODE = "status_code";

    /** Bucket bounds of the classic Prometheus client default histogram. */
    static final Duration[] DEFAULT_BUCKETS = {
            Duration.ofMillis(5), Duration.ofMillis(10), Duration.ofMillis(25),
            Duration.ofMillis(50), Duration.ofMillis(75), Duration.ofMillis(100),
            Duration.ofMillis(250), Duration.ofMillis(500), Duration.ofMillis(750),
            Duration.ofSeconds(1), Duration.ofMillis(2500), Duration.ofSeconds(5),
            Duration.ofMillis(7500), Duration.ofSeconds(10)
    };

    private final MetricFactory factory;
    private final Clock clock;
    private final Timer duration;
    private final AtomicLong inFlight;

    public HttpRequestMetrics(MetricFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        this.factory = factory;
        this.clock = factory.registry().config().clock();
        this.duration = factory.histogramTimer(
                REQUEST_DURATION, "HTTP request duration", DEFAULT_BUCKETS);
        this.inFlight = factory.gauge(ACTIVE_CONNECTIONS, "Number of active connections");
    }

    /**
     * Marks the start of a request: increments the in-flight gauge and captures a start
     * time from the registry's monotonic clock.
     * <p>
     * The returned handle must be closed exactly once when the request is finished, on every
     * exit path. Closing it more than once has no further effect.
     *
     * @return the handle tracking this request
     */
    public InFlightRequest begin() {
        inFlight.incrementAndGet();
        return new InFlightRequest(this, clock.monotonicTime());
    }

    /**
     * Returns the current number of requests in flight.
     */
    public long inFlight() {
        return inFlight.get();
    }

    /**
     * Returns how many requests completed with the given method, endpoint and status code.
     */
    public double completed(String method, String endpoint, int statusCode) {
        Counter counter = factory.registry().find(REQUESTS_TOTAL)
                .tags(TAG_METHOD, method, TAG_ENDPOINT, endpoint,
                        TAG_STATUS_CODE, String.valueOf(statusCode))
                .counter();
        return counter == null ? 0 : counter.count();
    }

    /**
     * Returns the latency histogram.
     */
    public Timer duration() {
        return duration;
    }

    void record(String method, String endpoint, int statusCode, long startNanos) {
        factory.counter(REQUESTS_TOTAL, "Total HTTP requests",
                        TAG_METHOD, method,
                        TAG_ENDPOINT, endpoint,
                        TAG_STATUS_CODE, String.valueOf(statusCode))
                .increment();
        duration.record(clock.monotonicTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    void release() {
        inFlight.decrementAndGet();
    }
}
